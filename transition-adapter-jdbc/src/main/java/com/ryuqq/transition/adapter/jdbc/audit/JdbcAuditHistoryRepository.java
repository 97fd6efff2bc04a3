package com.ryuqq.transition.adapter.jdbc.audit;

import com.ryuqq.transition.adapter.jdbc.JdbcAdapterConfig;
import com.ryuqq.transition.adapter.jdbc.SqlIdentifiers;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.spi.AuditHistoryRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.UUID;

/**
 * Audit history queries on Spring {@link JdbcTemplate}.
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class JdbcAuditHistoryRepository implements AuditHistoryRepository {

    static final RowMapper<AuditRecord> ROW_MAPPER = (rs, rowNum) -> new AuditRecord(
        UUID.fromString(rs.getString("id")),
        rs.getLong("object_id"),
        rs.getString("object_type_name"),
        rs.getString("trigger_name"),
        rs.getString("source_state"),
        rs.getString("dest_state"),
        rs.getLong("actor_id"),
        rs.getTimestamp("created_at").toInstant()
    );

    private static final String COLUMNS =
        "id, object_id, object_type_name, trigger_name, source_state, dest_state, actor_id, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final JdbcAdapterConfig config;
    private final SqlIdentifiers identifiers;

    public JdbcAuditHistoryRepository(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, new JdbcAdapterConfig());
    }

    public JdbcAuditHistoryRepository(JdbcTemplate jdbcTemplate, JdbcAdapterConfig config) {
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
    public List<AuditRecord> findHistory(long objectId, String objectTypeName) {
        if (objectTypeName == null || objectTypeName.isBlank()) {
            throw new IllegalArgumentException("objectTypeName cannot be null or blank");
        }
        return jdbcTemplate.query(
            select() + " WHERE object_id = ? AND object_type_name = ? ORDER BY created_at ASC",
            ROW_MAPPER, objectId, objectTypeName);
    }

    @Override
    public List<AuditRecord> findByActor(long actorId) {
        return jdbcTemplate.query(
            select() + " WHERE actor_id = ? ORDER BY created_at ASC",
            ROW_MAPPER, actorId);
    }

    private String select() {
        return "SELECT " + COLUMNS + " FROM " + identifiers.quote(config.auditTable());
    }
}
