package com.ryuqq.transition.core.spi;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.model.AuditRecord;

/**
 * Transactional persistence handle SPI.
 *
 * <p>A handle is scoped to one transaction that the <em>caller</em> opened. The
 * engine writes through it but never begins, commits or rolls back; the same
 * handle is passed to guards and hooks so their own writes join the transaction.</p>
 *
 * <p><strong>Transaction Boundary (caller side):</strong></p>
 * <pre>
 * BEGIN TRANSACTION;
 *   UPDATE orders SET state = 'Paid' WHERE id = ?;                 -- updateField
 *   INSERT INTO state_machine_log (...) VALUES (...);              -- insert
 * COMMIT;
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>updateField writes exactly one column and leaves other fields and associations untouched</li>
 *   <li>Failures are reported as unchecked exceptions and never retried by the handle's caller</li>
 *   <li>A handle instance is confined to the thread running the transaction</li>
 * </ul>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public interface TransactionalHandle {

    /**
     * Updates a single field of the given entity.
     *
     * @param entity the entity whose row is updated (identified by type name and id)
     * @param fieldName the field to write
     * @param value the new value
     * @throws RuntimeException if the write fails
     */
    void updateField(Stateful entity, String fieldName, Object value);

    /**
     * Inserts one audit record.
     *
     * @param record the record to append
     * @throws RuntimeException if the insert fails
     */
    void insert(AuditRecord record);
}
