package com.ryuqq.transition.core.exception;

/**
 * 엔티티 타입에 선언되지 않은 Trigger를 요청한 경우.
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class UnknownTriggerException extends TransitionException {

    private final String typeName;

    public UnknownTriggerException(String triggerName, String typeName) {
        super(triggerName, String.format("Unknown trigger: %s (type: %s)", triggerName, typeName));
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
