package com.ryuqq.transition.core.hook;

import com.ryuqq.transition.core.spi.TransactionalHandle;

/**
 * Trigger 실행 여부를 결정하는 조건.
 *
 * <p>{@code false}를 반환하면 Trigger는 오류 없이 건너뜁니다 (상태 변경, Hook 실행,
 * 감사 기록 모두 없음). 예외를 던지면 그대로 호출자에게 전파됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Guard positiveAmount = (handle, args) -&gt; ((Integer) args[0]) &gt; 0;
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Guard {

    /**
     * 조건 평가.
     *
     * @param handle 호출자가 소유한 트랜잭션 핸들
     * @param args {@code fire} 호출 시 전달된 인자 (빈 배열 가능)
     * @return Trigger를 실행해야 하면 true
     */
    boolean test(TransactionalHandle handle, Object... args);
}
