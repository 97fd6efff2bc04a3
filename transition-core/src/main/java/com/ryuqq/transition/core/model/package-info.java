/**
 * Transition model package.
 *
 * <p>Immutable value types that describe what an entity type may do and what the
 * engine records when it does it.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transition.core.model.TriggerDefinition} - Named transition with source states, dest state, guard and hooks</li>
 *   <li>{@link com.ryuqq.transition.core.model.StateDescriptor} - Valid states, initial state and trigger table of one entity type</li>
 *   <li>{@link com.ryuqq.transition.core.model.AvailableTrigger} - Trigger name paired with its translated label</li>
 *   <li>{@link com.ryuqq.transition.core.model.AuditRecord} - Append-only record of one executed transition</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transition Team
 */
package com.ryuqq.transition.core.model;
