package com.ryuqq.transition.core.exception;

/**
 * 선언된 Trigger이지만 현재 상태가 출발 상태 집합에 없는 경우.
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class InvalidTransitionException extends TransitionException {

    private final String currentState;

    public InvalidTransitionException(String triggerName, String currentState) {
        super(triggerName, String.format("Cannot fire trigger: %s, current state: %s", triggerName, currentState));
        this.currentState = currentState;
    }

    /**
     * 거부 시점의 엔티티 상태.
     *
     * @return 현재 상태
     */
    public String getCurrentState() {
        return currentState;
    }
}
