/**
 * JDBC persistence adapter on Spring {@link org.springframework.jdbc.core.JdbcTemplate}.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.transition.adapter.jdbc.JdbcTransactionalHandle}: state update and audit insert</li>
 *   <li>{@link com.ryuqq.transition.adapter.jdbc.JdbcAdapterConfig}: table and column naming</li>
 *   <li>{@link com.ryuqq.transition.adapter.jdbc.SqlIdentifiers}: quoting of configured names</li>
 *   <li>{@code audit} package: schema setup and history queries</li>
 * </ul>
 *
 * <p><strong>Wiring Example:</strong></p>
 * <pre>
 * JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
 * new JdbcAuditSchemaManager(jdbcTemplate).ensureSchema();
 *
 * TransactionalHandle handle = new JdbcTransactionalHandle(jdbcTemplate);
 * transactionTemplate.executeWithoutResult(status -&gt;
 *     engine.fire(handle, order, "pay", actorId, 100));
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
package com.ryuqq.transition.adapter.jdbc;
