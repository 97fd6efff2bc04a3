package com.ryuqq.transition.adapter.jdbc;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.spi.TransactionalHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;

/**
 * {@link TransactionalHandle} backed by Spring {@link JdbcTemplate}.
 *
 * <p>The handle never manages the transaction itself. It joins whatever transaction is
 * bound to the current thread for the template's {@code DataSource}, e.g. one opened by
 * {@code TransactionTemplate} or {@code @Transactional} around the {@code fire} call.</p>
 *
 * <p><strong>Statements</strong> (identifiers quoted by {@link SqlIdentifiers}, shown for H2):</p>
 * <pre>
 * UPDATE "ORDER_LINE" SET "STATE" = ? WHERE "ID" = ?
 * INSERT INTO "STATE_MACHINE_LOG"
 *     (id, object_id, object_type_name, trigger_name, source_state, dest_state, actor_id, created_at)
 * VALUES (?, ?, ?, ?, ?, ?, ?, ?)
 * </pre>
 *
 * <p>An update that matches no row throws {@link IllegalStateException}: the entity must
 * already exist in its table.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class JdbcTransactionalHandle implements TransactionalHandle {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionalHandle.class);

    private final JdbcTemplate jdbcTemplate;
    private final JdbcAdapterConfig config;
    private final SqlIdentifiers identifiers;

    public JdbcTransactionalHandle(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, new JdbcAdapterConfig());
    }

    public JdbcTransactionalHandle(JdbcTemplate jdbcTemplate, JdbcAdapterConfig config) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.config = config;
        this.identifiers = new SqlIdentifiers(jdbcTemplate);
    }

    @Override
    public void updateField(Stateful entity, String fieldName, Object value) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        JdbcAdapterConfig.requireIdentifier(fieldName, "fieldName");

        String table = config.tableFor(entity.typeName());
        String sql = "UPDATE " + identifiers.quote(table)
            + " SET " + identifiers.quote(fieldName) + " = ?"
            + " WHERE " + identifiers.quote(config.idColumn()) + " = ?";
        int rows = jdbcTemplate.update(sql, value, entity.getId());
        if (rows == 0) {
            throw new IllegalStateException(
                String.format("No row updated: %s#%d (table: %s)", entity.typeName(), entity.getId(), table));
        }
        log.debug("Updated {}.{} for {}#{}", table, fieldName, entity.typeName(), entity.getId());
    }

    @Override
    public void insert(AuditRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        String sql = "INSERT INTO " + identifiers.quote(config.auditTable())
            + " (id, object_id, object_type_name, trigger_name, source_state, dest_state, actor_id, created_at)"
            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        jdbcTemplate.update(sql,
            record.id().toString(),
            record.objectId(),
            record.objectTypeName(),
            record.trigger(),
            record.sourceState(),
            record.destState(),
            record.actorId(),
            Timestamp.from(record.createdAt()));
    }
}
