package com.ryuqq.transition.core.model;

/**
 * 현재 상태에서 실행 가능한 Trigger와 그 표시 이름.
 *
 * @param trigger Trigger 이름
 * @param translatedTrigger 번역된 표시 이름
 *
 * @author Transition Team
 * @since 1.0.0
 */
public record AvailableTrigger(
    String trigger,
    String translatedTrigger
) {

    public AvailableTrigger {
        if (trigger == null || trigger.isBlank()) {
            throw new IllegalArgumentException("trigger cannot be null or blank");
        }
        if (translatedTrigger == null) {
            throw new IllegalArgumentException("translatedTrigger cannot be null");
        }
    }
}
