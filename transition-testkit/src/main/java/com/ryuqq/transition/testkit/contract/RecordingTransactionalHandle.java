package com.ryuqq.transition.testkit.contract;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.spi.TransactionalHandle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Recording implementation of {@link TransactionalHandle} for tests.
 *
 * <p>Keeps every field update and audit insert in memory so tests can assert
 * exactly what the engine wrote. Failures can be injected for the next write.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No transaction semantics (no commit or rollback)</li>
 *   <li>Not thread-safe; one instance per test</li>
 * </ul>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class RecordingTransactionalHandle implements TransactionalHandle {

    private final Map<String, Map<String, Object>> rows = new HashMap<>();
    private final List<AuditRecord> auditRecords = new ArrayList<>();
    private int updateCount;
    private RuntimeException nextUpdateFailure;
    private RuntimeException nextInsertFailure;

    @Override
    public void updateField(Stateful entity, String fieldName, Object value) {
        if (nextUpdateFailure != null) {
            RuntimeException failure = nextUpdateFailure;
            nextUpdateFailure = null;
            throw failure;
        }
        rows.computeIfAbsent(rowKey(entity.typeName(), entity.getId()), key -> new HashMap<>()).put(fieldName, value);
        updateCount++;
    }

    @Override
    public void insert(AuditRecord record) {
        if (nextInsertFailure != null) {
            RuntimeException failure = nextInsertFailure;
            nextInsertFailure = null;
            throw failure;
        }
        auditRecords.add(record);
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

    /**
     * Returns the last value written to a field of an entity.
     *
     * @param entity the entity
     * @param fieldName the field
     * @return the value, or empty if never written
     */
    public Optional<Object> writtenValue(Stateful entity, String fieldName) {
        Map<String, Object> row = rows.get(rowKey(entity.typeName(), entity.getId()));
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(fieldName));
    }

    /**
     * Returns the fields written for an entity.
     *
     * @param entity the entity
     * @return field name to value (empty if none)
     */
    public Map<String, Object> writtenFields(Stateful entity) {
        return Map.copyOf(rows.getOrDefault(rowKey(entity.typeName(), entity.getId()), Map.of()));
    }

    public List<AuditRecord> auditRecords(Stateful entity) {
        return auditRecords.stream()
            .filter(record -> record.belongsTo(entity.getId(), entity.typeName()))
            .collect(Collectors.toList());
    }

    public List<AuditRecord> allAuditRecords() {
        return List.copyOf(auditRecords);
    }

    public int updateCount() {
        return updateCount;
    }

    private static String rowKey(String typeName, long id) {
        return typeName + "#" + id;
    }
}
