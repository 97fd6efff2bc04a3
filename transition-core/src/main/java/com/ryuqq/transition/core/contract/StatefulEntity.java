package com.ryuqq.transition.core.contract;

import com.ryuqq.transition.core.engine.TransitionEngine;
import com.ryuqq.transition.core.model.AvailableTrigger;
import com.ryuqq.transition.core.model.StateDescriptor;
import com.ryuqq.transition.core.spi.TransactionalHandle;

import java.util.List;

/**
 * {@link Stateful} 기본 구현.
 *
 * <p>상태 필드와 바인딩된 엔진을 보관하고, 엔진 연산을 엔티티 메서드로 노출합니다.
 * 하위 클래스는 {@link #getId()}만 구현하면 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public class Order extends StatefulEntity {
 *     static final StateDescriptor STATES = StateDescriptor.builder("Order")...build();
 *
 *     public Order(long id) {
 *         super(STATES);
 *         this.id = id;
 *     }
 * }
 *
 * Order order = binder.bind(orderRepository.load(id));
 * order.fire(handle, "pay", actorId, amount);
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public abstract class StatefulEntity implements Stateful {

    private final StateDescriptor descriptor;
    private String state;
    private TransitionEngine engine;

    /**
     * 초기 상태로 생성.
     *
     * @param descriptor 엔티티 타입의 상태 선언
     * @throws IllegalArgumentException descriptor가 null인 경우
     */
    protected StatefulEntity(StateDescriptor descriptor) {
        this(descriptor, descriptor == null ? null : descriptor.initialState());
    }

    /**
     * 저장된 상태로 생성 (로드 시).
     *
     * @param descriptor 엔티티 타입의 상태 선언
     * @param state 저장된 상태
     * @throws IllegalArgumentException descriptor가 null이거나 state가 유효하지 않은 경우
     */
    protected StatefulEntity(StateDescriptor descriptor, String state) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        this.descriptor = descriptor;
        this.state = requireValid(state);
    }

    @Override
    public final StateDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public String getState() {
        return state;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException state가 validStates에 없는 경우
     */
    @Override
    public void setState(String state) {
        this.state = requireValid(state);
    }

    @Override
    public void bindEngine(TransitionEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    public boolean isBound() {
        return engine != null;
    }

    /**
     * 바인딩된 엔진으로 Trigger 실행.
     *
     * @param handle 호출자가 소유한 트랜잭션 핸들
     * @param trigger Trigger 이름
     * @param actorId 요청자 ID
     * @param args Guard/Hook에 전달할 인자
     * @throws IllegalStateException 엔진이 바인딩되지 않은 경우
     * @see TransitionEngine#fire(TransactionalHandle, Stateful, String, long, Object...)
     */
    public void fire(TransactionalHandle handle, String trigger, long actorId, Object... args) {
        boundEngine().fire(handle, this, trigger, actorId, args);
    }

    public List<AvailableTrigger> availableTriggers() {
        return boundEngine().availableTriggers(this);
    }

    public String translatedState() {
        return boundEngine().translatedState(this);
    }

    private String requireValid(String state) {
        if (!descriptor.isValidState(state)) {
            throw new IllegalArgumentException(
                String.format("Invalid state '%s' for type %s (valid: %s)", state, descriptor.typeName(), descriptor.validStates())
            );
        }
        return state;
    }

    private TransitionEngine boundEngine() {
        if (engine == null) {
            throw new IllegalStateException(
                String.format("%s#%d is not bound to a TransitionEngine", typeName(), getId())
            );
        }
        return engine;
    }
}
