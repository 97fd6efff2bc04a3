/**
 * Entity binding package.
 *
 * <p>Entities are wired to their {@link com.ryuqq.transition.core.engine.TransitionEngine}
 * by an explicit step the caller performs once per loaded entity, instead of a
 * persistence-framework load callback.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transition.application.binding.EntityBinder} - Binds single entities, lists and loaders</li>
 *   <li>{@link com.ryuqq.transition.application.binding.EntityLoader} - Repository lookup by id</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transition Team
 */
package com.ryuqq.transition.application.binding;
