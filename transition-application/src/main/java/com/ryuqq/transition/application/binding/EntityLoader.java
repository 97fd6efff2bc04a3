package com.ryuqq.transition.application.binding;

import com.ryuqq.transition.core.contract.Stateful;

import java.util.Optional;

/**
 * 엔티티 로더.
 *
 * <p>애플리케이션의 저장소 조회를 감싸는 함수형 인터페이스입니다.
 * {@link EntityBinder#loading(EntityLoader)}와 함께 쓰면 로드한 엔티티가 엔진에 바인딩된 채로 반환됩니다.</p>
 *
 * @param <E> 엔티티 타입
 *
 * @author Transition Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntityLoader<E extends Stateful> {

    /**
     * ID로 엔티티 조회.
     *
     * @param id 엔티티 ID
     * @return 엔티티 (없으면 empty)
     */
    Optional<E> load(long id);
}
