package com.ryuqq.transition.core.exception;

/**
 * 상태 전이 실패.
 *
 * <p>TransitionException은 네 가지 실패를 나타냅니다:</p>
 * <ul>
 *   <li>{@link UnknownTriggerException}: 선언되지 않은 Trigger. 부수 효과 없음</li>
 *   <li>{@link InvalidTransitionException}: 현재 상태가 출발 상태가 아님. 부수 효과 없음</li>
 *   <li>{@link HookFailureException}: before/after Hook 실패</li>
 *   <li>{@link PersistenceFailureException}: 트랜잭션 핸들 쓰기 실패</li>
 * </ul>
 *
 * <p>Guard가 false를 반환한 경우는 실패가 아니므로 이 계층에 포함되지 않습니다.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public abstract sealed class TransitionException extends RuntimeException
    permits UnknownTriggerException, InvalidTransitionException, HookFailureException, PersistenceFailureException {

    private final String triggerName;

    protected TransitionException(String triggerName, String message) {
        super(message);
        this.triggerName = triggerName;
    }

    protected TransitionException(String triggerName, String message, Throwable cause) {
        super(message, cause);
        this.triggerName = triggerName;
    }

    /**
     * 실패한 Trigger 이름.
     *
     * @return Trigger 이름
     */
    public String getTriggerName() {
        return triggerName;
    }
}
