package com.ryuqq.transition.core.model;

import com.ryuqq.transition.core.hook.Guard;
import com.ryuqq.transition.core.hook.Hook;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 이름이 붙은 상태 전이 정의 (Trigger).
 *
 * <p>허용된 출발 상태 집합, 하나의 도착 상태, 그리고 선택적인 Guard/Hook으로 구성됩니다.
 * 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * TriggerDefinition pay = TriggerDefinition.builder("pay")
 *     .from("Created")
 *     .to("Paid")
 *     .guard((handle, args) -&gt; ((Integer) args[0]) &gt; 0)
 *     .build();
 * </pre>
 *
 * @param name Trigger 이름
 * @param sourceStates 출발 가능한 상태 집합 (비어 있을 수 없음)
 * @param destState 도착 상태
 * @param guard 실행 조건 (null 가능)
 * @param before 상태 변경 전 Hook (null 가능)
 * @param after 상태 저장 후 Hook (null 가능)
 *
 * @author Transition Team
 * @since 1.0.0
 */
public record TriggerDefinition(
    String name,
    Set<String> sourceStates,
    String destState,
    Guard guard,
    Hook before,
    Hook after
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name, destState가 비어 있거나 sourceStates가 비어 있는 경우
     */
    public TriggerDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (sourceStates == null || sourceStates.isEmpty()) {
            throw new IllegalArgumentException("sourceStates cannot be null or empty (trigger: " + name + ")");
        }
        for (String source : sourceStates) {
            if (source == null || source.isBlank()) {
                throw new IllegalArgumentException("sourceStates cannot contain null or blank states (trigger: " + name + ")");
            }
        }
        if (destState == null || destState.isBlank()) {
            throw new IllegalArgumentException("destState cannot be null or blank (trigger: " + name + ")");
        }
        sourceStates = Collections.unmodifiableSet(new LinkedHashSet<>(sourceStates));
        // guard, before, after는 null 허용
    }

    /**
     * 주어진 상태에서 이 Trigger를 실행할 수 있는지 확인.
     *
     * @param state 현재 상태
     * @return sourceStates에 포함되면 true
     */
    public boolean acceptsSource(String state) {
        return sourceStates.contains(state);
    }

    public Optional<Guard> guardOptional() {
        return Optional.ofNullable(guard);
    }

    /**
     * Builder 생성.
     *
     * @param name Trigger 이름
     * @return 새 Builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * {@link TriggerDefinition} Builder.
     */
    public static final class Builder {

        private final String name;
        private final Set<String> sourceStates = new LinkedHashSet<>();
        private String destState;
        private Guard guard;
        private Hook before;
        private Hook after;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * 출발 상태 추가. 여러 번 호출하면 누적됩니다.
         *
         * @param states 출발 상태
         * @return this
         */
        public Builder from(String... states) {
            sourceStates.addAll(Arrays.asList(states));
            return this;
        }

        public Builder to(String state) {
            this.destState = state;
            return this;
        }

        public Builder guard(Guard guard) {
            this.guard = guard;
            return this;
        }

        public Builder before(Hook before) {
            this.before = before;
            return this;
        }

        public Builder after(Hook after) {
            this.after = after;
            return this;
        }

        /**
         * TriggerDefinition 생성.
         *
         * @return 불변 TriggerDefinition
         * @throws IllegalArgumentException 필수 값이 누락된 경우
         */
        public TriggerDefinition build() {
            return new TriggerDefinition(name, sourceStates, destState, guard, before, after);
        }
    }
}
