package com.ryuqq.transition.core.exception;

import com.ryuqq.transition.core.hook.HookPhase;

/**
 * before/after Hook이 던진 예외를 감싼 실패.
 *
 * <p><strong>단계별 상태:</strong></p>
 * <ul>
 *   <li>BEFORE: 상태 변경 없음, 감사 기록 없음</li>
 *   <li>AFTER: 상태 필드는 이미 저장됨, 감사 기록 없음.
 *       호출자가 트랜잭션을 롤백하지 않으면 감사 없는 상태 변경이 남습니다.</li>
 * </ul>
 *
 * <p>원인 예외는 {@link #getCause()}로 변경 없이 조회할 수 있습니다.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class HookFailureException extends TransitionException {

    private final HookPhase phase;

    public HookFailureException(String triggerName, HookPhase phase, Throwable cause) {
        super(triggerName, String.format("%s hook failed for trigger: %s", phase, triggerName), cause);
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        this.phase = phase;
    }

    public HookPhase getPhase() {
        return phase;
    }
}
