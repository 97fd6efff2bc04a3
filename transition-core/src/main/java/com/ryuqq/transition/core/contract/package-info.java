/**
 * State-capability contract package.
 *
 * <p>Every entity type that owns a finite state implements
 * {@link com.ryuqq.transition.core.contract.Stateful}, usually by extending
 * {@link com.ryuqq.transition.core.contract.StatefulEntity}. The contract is
 * resolved at compile time; the engine never inspects entity types reflectively.</p>
 *
 * @since 1.0.0
 * @author Transition Team
 */
package com.ryuqq.transition.core.contract;
