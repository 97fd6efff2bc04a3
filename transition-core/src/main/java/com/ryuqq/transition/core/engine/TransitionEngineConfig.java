package com.ryuqq.transition.core.engine;

/**
 * TransitionEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>stateFieldName: 상태 저장 시 {@code updateField}에 전달하는 필드 이름 (기본 "state")</li>
 * </ul>
 *
 * @author Transition Team
 * @since 1.0.0
 * @param stateFieldName 상태 필드 이름 (영문자로 시작, 영숫자와 언더스코어만 허용)
 */
public record TransitionEngineConfig(String stateFieldName) {

    /**
     * 기본 상태 필드 이름.
     */
    public static final String DEFAULT_STATE_FIELD = "state";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: stateFieldName="state"</p>
     */
    public TransitionEngineConfig() {
        this(DEFAULT_STATE_FIELD);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TransitionEngineConfig {
        if (stateFieldName == null || !stateFieldName.matches("^[A-Za-z][A-Za-z0-9_]*$")) {
            throw new IllegalArgumentException(
                "stateFieldName must be an identifier (current: " + stateFieldName + ")"
            );
        }
    }

    /**
     * stateFieldName만 변경한 새 인스턴스 생성.
     *
     * @param stateFieldName 새로운 상태 필드 이름
     * @return 새 TransitionEngineConfig 인스턴스
     */
    public TransitionEngineConfig withStateFieldName(String stateFieldName) {
        return new TransitionEngineConfig(stateFieldName);
    }
}
