package com.ryuqq.transition.core.hook;

/**
 * Hook 실행 단계.
 *
 * <ul>
 *   <li>BEFORE: 상태 변경 전. 실패해도 부수 효과 없음</li>
 *   <li>AFTER: 상태 필드 저장 후. 실패 시 저장된 상태는 남고 감사 기록은 없음</li>
 * </ul>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public enum HookPhase {

    BEFORE,

    AFTER
}
