/**
 * In-memory persistence adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.transition.adapter.inmemory.store.InMemoryDatabase}:
 *       committed rows and audit trail, implements
 *       {@link com.ryuqq.transition.core.spi.AuditSchemaManager} and
 *       {@link com.ryuqq.transition.core.spi.AuditHistoryRepository}</li>
 *   <li>{@link com.ryuqq.transition.adapter.inmemory.store.InMemoryTransaction}:
 *       buffered {@link com.ryuqq.transition.core.spi.TransactionalHandle} with commit and rollback</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No actual ACID transaction support</li>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @author Transition Team
 * @since 1.0.0
 */
package com.ryuqq.transition.adapter.inmemory.store;
