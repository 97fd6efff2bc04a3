package com.ryuqq.transition.core.exception;

/**
 * 트랜잭션 핸들 쓰기 실패.
 *
 * <p>엔진은 재시도하지 않습니다. STATE_UPDATE 실패 시 엔티티의 메모리 상태는
 * 이미 도착 상태로 바뀌어 있으며 되돌리지 않습니다.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class PersistenceFailureException extends TransitionException {

    /**
     * 실패한 쓰기 작업.
     */
    public enum Operation {

        /**
         * 상태 필드 UPDATE.
         */
        STATE_UPDATE,

        /**
         * 감사 기록 INSERT.
         */
        AUDIT_INSERT
    }

    private final Operation operation;

    public PersistenceFailureException(String triggerName, Operation operation, Throwable cause) {
        super(triggerName, String.format("%s failed for trigger: %s", operation, triggerName), cause);
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        this.operation = operation;
    }

    public Operation getOperation() {
        return operation;
    }
}
