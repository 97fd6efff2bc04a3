/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the boundaries the engine consumes. Adapter modules provide
 * the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transition.core.spi.TransactionalHandle} - Caller-owned transaction the engine writes through</li>
 *   <li>{@link com.ryuqq.transition.core.spi.TranslationProvider} - Key to display label lookup</li>
 *   <li>{@link com.ryuqq.transition.core.spi.AuditSchemaManager} - Idempotent audit schema setup</li>
 *   <li>{@link com.ryuqq.transition.core.spi.AuditHistoryRepository} - Audit trail queries</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, JDBC for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transition Team
 */
package com.ryuqq.transition.core.spi;
