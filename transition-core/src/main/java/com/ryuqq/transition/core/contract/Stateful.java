package com.ryuqq.transition.core.contract;

import com.ryuqq.transition.core.engine.TransitionEngine;
import com.ryuqq.transition.core.model.StateDescriptor;
import com.ryuqq.transition.core.model.TriggerDefinition;

import java.util.Map;
import java.util.Set;

/**
 * 상태 전이에 참여하는 엔티티의 계약.
 *
 * <p>엔티티 타입마다 이 인터페이스를 구현하며, 엔진은 런타임 타입 검사 없이
 * 이 계약만으로 엔티티를 다룹니다.</p>
 *
 * <p><strong>바인딩:</strong> 새로 만들거나 로드한 엔티티는 호출자가
 * {@link #bindEngine(TransitionEngine)}을 한 번 호출해 엔진과 연결합니다.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 * @see StatefulEntity
 */
public interface Stateful {

    /**
     * 엔티티 고유 식별자.
     *
     * @return 엔티티 ID
     */
    long getId();

    /**
     * 엔티티 타입의 상태 선언.
     *
     * @return StateDescriptor
     */
    StateDescriptor descriptor();

    /**
     * 엔티티 타입 이름. 감사 기록과 번역 키에 사용됩니다.
     *
     * @return 타입 이름
     */
    default String typeName() {
        return descriptor().typeName();
    }

    default Set<String> validStates() {
        return descriptor().validStates();
    }

    default Map<String, TriggerDefinition> triggers() {
        return descriptor().triggers();
    }

    String getState();

    void setState(String state);

    /**
     * 엔진 바인딩.
     *
     * @param engine 이 엔티티를 다룰 엔진
     * @throws IllegalArgumentException engine이 null인 경우
     */
    void bindEngine(TransitionEngine engine);
}
