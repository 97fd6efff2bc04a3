package com.ryuqq.transition.adapter.inmemory.store;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.spi.TransactionalHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of {@link TransactionalHandle}.
 *
 * <p>Buffers field writes and audit inserts until {@link #commit()}. Reads through this
 * transaction see its own pending writes on top of the committed data; other transactions
 * and {@link InMemoryDatabase} queries only see committed data.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * ACTIVE → commit()   → COMMITTED
 * ACTIVE → rollback() → ROLLED_BACK
 * </pre>
 *
 * <p>Not thread-safe: a transaction is confined to the thread that began it.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class InMemoryTransaction implements TransactionalHandle {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransaction.class);

    /**
     * Transaction status.
     */
    public enum Status {
        ACTIVE, COMMITTED, ROLLED_BACK
    }

    private final InMemoryDatabase database;
    private final Map<String, Map<String, Object>> pendingRows;
    private final List<AuditRecord> pendingAudit;
    private Status status;
    private RuntimeException nextUpdateFailure;
    private RuntimeException nextInsertFailure;

    InMemoryTransaction(InMemoryDatabase database) {
        this.database = database;
        this.pendingRows = new HashMap<>();
        this.pendingAudit = new ArrayList<>();
        this.status = Status.ACTIVE;
    }

    @Override
    public void updateField(Stateful entity, String fieldName, Object value) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName cannot be null or blank");
        }
        checkActive();
        if (nextUpdateFailure != null) {
            RuntimeException failure = nextUpdateFailure;
            nextUpdateFailure = null;
            throw failure;
        }
        pendingRows.computeIfAbsent(InMemoryDatabase.rowKey(entity), key -> new HashMap<>()).put(fieldName, value);
    }

    @Override
    public void insert(AuditRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        checkActive();
        if (nextInsertFailure != null) {
            RuntimeException failure = nextInsertFailure;
            nextInsertFailure = null;
            throw failure;
        }
        database.checkSchema();
        pendingAudit.add(record);
    }

    /**
     * Publishes all pending writes to the database.
     *
     * @throws IllegalStateException if the transaction is not active
     */
    public void commit() {
        checkActive();
        database.apply(pendingRows, pendingAudit);
        status = Status.COMMITTED;
        log.debug("Committed transaction: rows={}, auditRecords={}", pendingRows.size(), pendingAudit.size());
        clear();
    }

    /**
     * Discards all pending writes.
     *
     * <p>Rolling back a completed transaction is a no-op.</p>
     */
    public void rollback() {
        if (status != Status.ACTIVE) {
            return;
        }
        status = Status.ROLLED_BACK;
        log.debug("Rolled back transaction: rows={}, auditRecords={}", pendingRows.size(), pendingAudit.size());
        clear();
    }

    /**
     * Returns a field value as seen inside this transaction.
     *
     * @param entity the entity
     * @param fieldName the field
     * @return the pending value if written here, otherwise the committed value
     */
    public Optional<Object> readField(Stateful entity, String fieldName) {
        String rowKey = InMemoryDatabase.rowKey(entity);
        Map<String, Object> pending = pendingRows.get(rowKey);
        if (pending != null && pending.containsKey(fieldName)) {
            return Optional.ofNullable(pending.get(fieldName));
        }
        return database.committedValue(rowKey, fieldName);
    }

    /**
     * Returns the audit history of an entity as seen inside this transaction.
     *
     * @param entity the entity
     * @return committed records followed by this transaction's pending records
     */
    public List<AuditRecord> history(Stateful entity) {
        List<AuditRecord> history = new ArrayList<>(database.committedHistory(entity));
        for (AuditRecord record : pendingAudit) {
            if (record.belongsTo(entity.getId(), entity.typeName())) {
                history.add(record);
            }
        }
        return history;
    }

    /**
     * Makes the next {@link #updateField} call throw.
     *
     * @param failure the exception to throw
     */
    public void failNextUpdate(RuntimeException failure) {
        this.nextUpdateFailure = failure;
    }

    /**
     * Makes the next {@link #insert} call throw.
     *
     * @param failure the exception to throw
     */
    public void failNextInsert(RuntimeException failure) {
        this.nextInsertFailure = failure;
    }

    public Status status() {
        return status;
    }

    private void checkActive() {
        if (status != Status.ACTIVE) {
            throw new IllegalStateException("Transaction is not active: " + status);
        }
    }

    private void clear() {
        pendingRows.clear();
        pendingAudit.clear();
    }
}
