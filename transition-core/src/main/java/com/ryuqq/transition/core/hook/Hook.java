package com.ryuqq.transition.core.hook;

import com.ryuqq.transition.core.spi.TransactionalHandle;

/**
 * 상태 변경 직전/직후에 실행되는 부수 효과.
 *
 * <p>던진 예외는 {@link com.ryuqq.transition.core.exception.HookFailureException}으로
 * 감싸져 실행 단계({@link HookPhase})와 함께 호출자에게 전달됩니다.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Hook {

    /**
     * Hook 실행.
     *
     * @param handle 호출자가 소유한 트랜잭션 핸들
     * @param args {@code fire} 호출 시 전달된 인자 (빈 배열 가능)
     * @throws Exception Hook 실패 시
     */
    void run(TransactionalHandle handle, Object... args) throws Exception;
}
