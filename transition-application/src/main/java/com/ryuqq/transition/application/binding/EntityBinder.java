package com.ryuqq.transition.application.binding;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.engine.TransitionEngine;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 엔티티-엔진 바인딩.
 *
 * <p>로드 직후 호출자가 명시적으로 실행하는 바인딩 단계입니다.
 * 프레임워크 로드 콜백 없이, 단건/목록 로드 모두 같은 방식으로 엔진을 연결합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EntityBinder binder = new EntityBinder(engine);
 *
 * // 단건
 * Order order = binder.bind(orderRepository.findById(id));
 *
 * // 목록
 * List&lt;Order&gt; orders = binder.bindAll(orderRepository.findAll());
 *
 * // 로더 합성
 * EntityLoader&lt;Order&gt; orders = binder.loading(orderRepository::findById);
 * orders.load(id).ifPresent(order -&gt; order.fire(handle, "pay", actorId, amount));
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class EntityBinder {

    private final TransitionEngine engine;

    /**
     * 생성자.
     *
     * @param engine 바인딩할 엔진
     * @throws IllegalArgumentException engine이 null인 경우
     */
    public EntityBinder(TransitionEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    /**
     * 엔티티 하나를 바인딩.
     *
     * @param entity 로드한 엔티티
     * @param <E> 엔티티 타입
     * @return 바인딩된 같은 엔티티
     * @throws IllegalArgumentException entity가 null인 경우
     */
    public <E extends Stateful> E bind(E entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        entity.bindEngine(engine);
        return entity;
    }

    /**
     * 여러 엔티티를 바인딩.
     *
     * @param entities 로드한 엔티티 목록
     * @param <E> 엔티티 타입
     * @return 바인딩된 엔티티 (입력 순서 유지, 불변)
     * @throws IllegalArgumentException entities가 null이거나 null 원소가 있는 경우
     */
    public <E extends Stateful> List<E> bindAll(Collection<E> entities) {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        entities.forEach(this::bind);
        return List.copyOf(entities);
    }

    /**
     * 로드 결과를 자동 바인딩하는 로더 생성.
     *
     * @param loader 원본 로더
     * @param <E> 엔티티 타입
     * @return 바인딩 로더
     * @throws IllegalArgumentException loader가 null인 경우
     */
    public <E extends Stateful> EntityLoader<E> loading(EntityLoader<E> loader) {
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        return id -> {
            Optional<E> loaded = loader.load(id);
            return loaded.map(this::bind);
        };
    }
}
