package com.ryuqq.transition.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 엔티티 타입별 상태 선언.
 *
 * <p>유효한 상태 이름 집합, 초기 상태, Trigger 테이블을 보관합니다.
 * 엔티티 타입당 하나씩 정의하며 런타임에 변경되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>initialState는 validStates에 포함</li>
 *   <li>모든 Trigger의 sourceStates와 destState는 validStates에 포함</li>
 *   <li>Trigger 테이블의 키는 해당 Trigger의 이름과 동일</li>
 * </ul>
 *
 * <p>위 불변식 덕분에 엔진이 기록하는 상태는 항상 validStates 중 하나입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * StateDescriptor orderStates = StateDescriptor.builder("Order")
 *     .states("Created", "Paid", "Shipped")
 *     .initialState("Created")
 *     .trigger(TriggerDefinition.builder("pay").from("Created").to("Paid").build())
 *     .build();
 * </pre>
 *
 * @param typeName 엔티티 타입 이름 (감사 기록과 번역 키에 사용)
 * @param validStates 유효한 상태 집합
 * @param initialState 새 엔티티의 초기 상태
 * @param triggers Trigger 이름 → 정의 (이름 순 정렬)
 *
 * @author Transition Team
 * @since 1.0.0
 */
public record StateDescriptor(
    String typeName,
    Set<String> validStates,
    String initialState,
    Map<String, TriggerDefinition> triggers
) {

    /**
     * 초기 상태를 지정하지 않았을 때 사용하는 상태 이름.
     */
    public static final String DEFAULT_INITIAL_STATE = "INITIALIZED";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public StateDescriptor {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("typeName cannot be null or blank");
        }
        if (validStates == null || validStates.isEmpty()) {
            throw new IllegalArgumentException("validStates cannot be null or empty (type: " + typeName + ")");
        }
        for (String state : validStates) {
            if (state == null || state.isBlank()) {
                throw new IllegalArgumentException("validStates cannot contain null or blank states (type: " + typeName + ")");
            }
        }
        if (initialState == null || !validStates.contains(initialState)) {
            throw new IllegalArgumentException(
                String.format("initialState must be one of %s (type: %s, initialState: %s)", validStates, typeName, initialState)
            );
        }
        if (triggers == null) {
            throw new IllegalArgumentException("triggers cannot be null (type: " + typeName + ")");
        }

        for (Map.Entry<String, TriggerDefinition> entry : triggers.entrySet()) {
            TriggerDefinition trigger = entry.getValue();
            if (trigger == null || !trigger.name().equals(entry.getKey())) {
                throw new IllegalArgumentException(
                    String.format("Trigger registered as '%s' must have the same name (type: %s)", entry.getKey(), typeName)
                );
            }
            for (String source : trigger.sourceStates()) {
                if (!validStates.contains(source)) {
                    throw new IllegalArgumentException(
                        String.format("Unknown source state '%s' in trigger '%s' (type: %s)", source, trigger.name(), typeName)
                    );
                }
            }
            if (!validStates.contains(trigger.destState())) {
                throw new IllegalArgumentException(
                    String.format("Unknown dest state '%s' in trigger '%s' (type: %s)", trigger.destState(), trigger.name(), typeName)
                );
            }
        }

        validStates = Collections.unmodifiableSet(new LinkedHashSet<>(validStates));
        triggers = Collections.unmodifiableMap(new TreeMap<>(triggers));
    }

    /**
     * 유효한 상태인지 확인.
     *
     * @param state 상태 이름
     * @return validStates에 포함되면 true
     */
    public boolean isValidState(String state) {
        return validStates.contains(state);
    }

    /**
     * 이름으로 Trigger 조회.
     *
     * @param name Trigger 이름
     * @return TriggerDefinition (선언되지 않았으면 empty)
     */
    public Optional<TriggerDefinition> findTrigger(String name) {
        return Optional.ofNullable(triggers.get(name));
    }

    /**
     * Builder 생성.
     *
     * @param typeName 엔티티 타입 이름
     * @return 새 Builder
     */
    public static Builder builder(String typeName) {
        return new Builder(typeName);
    }

    /**
     * {@link StateDescriptor} Builder.
     *
     * <p>initialState를 지정하지 않으면 {@value #DEFAULT_INITIAL_STATE}를 사용합니다.</p>
     */
    public static final class Builder {

        private final String typeName;
        private final Set<String> validStates = new LinkedHashSet<>();
        private final Map<String, TriggerDefinition> triggers = new LinkedHashMap<>();
        private String initialState = DEFAULT_INITIAL_STATE;

        private Builder(String typeName) {
            this.typeName = typeName;
        }

        public Builder states(String... states) {
            validStates.addAll(Arrays.asList(states));
            return this;
        }

        public Builder initialState(String initialState) {
            this.initialState = initialState;
            return this;
        }

        /**
         * Trigger 추가.
         *
         * @param trigger Trigger 정의
         * @return this
         * @throws IllegalArgumentException 같은 이름의 Trigger가 이미 있는 경우
         */
        public Builder trigger(TriggerDefinition trigger) {
            if (trigger == null) {
                throw new IllegalArgumentException("trigger cannot be null");
            }
            if (triggers.putIfAbsent(trigger.name(), trigger) != null) {
                throw new IllegalArgumentException(
                    String.format("Duplicate trigger '%s' (type: %s)", trigger.name(), typeName)
                );
            }
            return this;
        }

        public StateDescriptor build() {
            return new StateDescriptor(typeName, validStates, initialState, triggers);
        }
    }
}
