package com.ryuqq.transition.adapter.inmemory.store;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.spi.AuditHistoryRepository;
import com.ryuqq.transition.core.spi.AuditSchemaManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory database for testing and reference purposes.
 *
 * <p>Holds committed entity rows and the committed audit trail. Writes only reach it
 * through an {@link InMemoryTransaction} obtained from {@link #begin()}, so a rolled back
 * transaction leaves no trace.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>rows:</strong> ConcurrentHashMap&lt;String, Map&lt;String, Object&gt;&gt; - Committed fields keyed by {@code TypeName#id}</li>
 *   <li><strong>auditLog:</strong> CopyOnWriteArrayList&lt;AuditRecord&gt; - Committed audit records in commit order</li>
 * </ul>
 *
 * <p><strong>Schema:</strong> audit inserts are rejected until {@link #ensureSchema()} has run,
 * the same way a missing {@code state_machine_log} table fails a real insert.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No isolation between concurrent transactions beyond last-commit-wins</li>
 *   <li>Entity rows are created on first write (no separate INSERT)</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryDatabase database = new InMemoryDatabase();
 * database.ensureSchema();
 *
 * InMemoryTransaction tx = database.begin();
 * try {
 *     engine.fire(tx, order, "pay", actorId, 100);
 *     tx.commit();
 * } catch (TransitionException e) {
 *     tx.rollback();
 *     throw e;
 * }
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class InMemoryDatabase implements AuditSchemaManager, AuditHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDatabase.class);

    private final ConcurrentHashMap<String, Map<String, Object>> rows;
    private final CopyOnWriteArrayList<AuditRecord> auditLog;
    private volatile boolean schemaReady;

    /**
     * Creates an empty database without the audit schema.
     */
    public InMemoryDatabase() {
        this.rows = new ConcurrentHashMap<>();
        this.auditLog = new CopyOnWriteArrayList<>();
    }

    /**
     * Opens a new transaction.
     *
     * @return transaction handle to pass to the engine
     */
    public InMemoryTransaction begin() {
        return new InMemoryTransaction(this);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Idempotent: only the first call has an effect.</p>
     */
    @Override
    public synchronized void ensureSchema() {
        if (schemaReady) {
            log.debug("Audit schema already present");
            return;
        }
        schemaReady = true;
        log.info("Created in-memory audit log");
    }

    /**
     * Returns whether the audit schema exists.
     *
     * @return true after {@link #ensureSchema()} ran
     */
    public boolean isSchemaReady() {
        return schemaReady;
    }

    @Override
    public List<AuditRecord> findHistory(long objectId, String objectTypeName) {
        if (objectTypeName == null || objectTypeName.isBlank()) {
            throw new IllegalArgumentException("objectTypeName cannot be null or blank");
        }
        return query(record -> record.belongsTo(objectId, objectTypeName));
    }

    @Override
    public List<AuditRecord> findByActor(long actorId) {
        return query(record -> record.actorId() == actorId);
    }

    /**
     * Returns a committed field value.
     *
     * @param entity the entity
     * @param fieldName the field
     * @return the committed value, or empty if never committed
     */
    public Optional<Object> committedValue(Stateful entity, String fieldName) {
        return committedValue(rowKey(entity), fieldName);
    }

    /**
     * Returns the number of committed audit records.
     *
     * @return audit record count
     */
    public int auditRecordCount() {
        return auditLog.size();
    }

    Optional<Object> committedValue(String rowKey, String fieldName) {
        Map<String, Object> row = rows.get(rowKey);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(fieldName));
    }

    List<AuditRecord> committedHistory(Stateful entity) {
        return findHistory(entity.getId(), entity.typeName());
    }

    void checkSchema() {
        if (!schemaReady) {
            throw new IllegalStateException("Audit log does not exist; call ensureSchema() first");
        }
    }

    /**
     * Applies a transaction's pending writes.
     *
     * @param pendingRows field writes keyed by row
     * @param pendingAudit audit records in insert order
     */
    synchronized void apply(Map<String, Map<String, Object>> pendingRows, List<AuditRecord> pendingAudit) {
        pendingRows.forEach((rowKey, fields) ->
            rows.compute(rowKey, (key, existing) -> {
                Map<String, Object> merged = existing == null ? new HashMap<>() : new HashMap<>(existing);
                merged.putAll(fields);
                return Collections.unmodifiableMap(merged);
            }));
        auditLog.addAll(pendingAudit);
    }

    static String rowKey(Stateful entity) {
        return entity.typeName() + "#" + entity.getId();
    }

    private List<AuditRecord> query(Predicate<AuditRecord> filter) {
        return auditLog.stream()
            .filter(filter)
            .sorted(Comparator.comparing(AuditRecord::createdAt))
            .collect(Collectors.toList());
    }
}
