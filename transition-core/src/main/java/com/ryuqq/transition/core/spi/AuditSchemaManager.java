package com.ryuqq.transition.core.spi;

/**
 * Audit schema setup SPI.
 *
 * <p>Called once at process startup, before the first transition is fired.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public interface AuditSchemaManager {

    /**
     * Creates the audit table and its {@code (object_id, object_type_name)} index if missing.
     *
     * <p><strong>Idempotency:</strong> calling this more than once must leave the schema
     * unchanged and must not fail.</p>
     */
    void ensureSchema();
}
