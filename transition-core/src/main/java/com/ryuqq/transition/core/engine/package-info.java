/**
 * Transition engine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transition.core.engine.TransitionEngine} - Trigger execution, availability and translated state</li>
 *   <li>{@link com.ryuqq.transition.core.engine.AuditLogger} - Appends one audit record per executed transition</li>
 *   <li>{@link com.ryuqq.transition.core.engine.TransitionEngineConfig} - Engine settings</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TransitionEngine engine = new TransitionEngine(translations);
 * order.bindEngine(engine);
 *
 * // inside the caller's transaction
 * engine.fire(handle, order, "pay", actorId, amount);
 * </pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li><strong>No side effects before validation:</strong> unknown triggers, invalid source states,
 *       rejecting guards and failing before-hooks leave state and audit trail untouched</li>
 *   <li><strong>One audit record per executed transition</strong>, written through the same handle</li>
 *   <li><strong>After-hook window:</strong> a failing after-hook leaves a persisted state change
 *       without an audit record until the caller rolls back</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transition Team
 */
package com.ryuqq.transition.core.engine;
