package com.ryuqq.transition.adapter.jdbc.audit;

import com.ryuqq.transition.adapter.jdbc.JdbcAdapterConfig;
import com.ryuqq.transition.adapter.jdbc.SqlIdentifiers;
import com.ryuqq.transition.core.spi.AuditSchemaManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Creates the audit table and its indexes.
 *
 * <p>Uses {@code IF NOT EXISTS} for every statement, so repeated calls are harmless.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class JdbcAuditSchemaManager implements AuditSchemaManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditSchemaManager.class);

    private final JdbcTemplate jdbcTemplate;
    private final JdbcAdapterConfig config;
    private final SqlIdentifiers identifiers;

    public JdbcAuditSchemaManager(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, new JdbcAdapterConfig());
    }

    public JdbcAuditSchemaManager(JdbcTemplate jdbcTemplate, JdbcAdapterConfig config) {
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
    public void ensureSchema() {
        for (String statement : statements()) {
            jdbcTemplate.execute(statement);
        }
        log.info("Ensured audit schema: table={}", config.auditTable());
    }

    /**
     * DDL statements in execution order.
     *
     * @return table creation followed by index creation
     */
    List<String> statements() {
        String table = identifiers.quote(config.auditTable());
        String indexPrefix = "idx_" + config.auditTable().replace('.', '_');
        return List.of(
            "CREATE TABLE IF NOT EXISTS " + table + " ("
                + "id VARCHAR(36) NOT NULL PRIMARY KEY, "
                + "object_id BIGINT NOT NULL, "
                + "object_type_name VARCHAR(255) NOT NULL, "
                + "trigger_name VARCHAR(255) NOT NULL, "
                + "source_state VARCHAR(255) NOT NULL, "
                + "dest_state VARCHAR(255) NOT NULL, "
                + "actor_id BIGINT NOT NULL, "
                + "created_at TIMESTAMP NOT NULL)",
            "CREATE INDEX IF NOT EXISTS " + identifiers.quote(indexPrefix + "_object")
                + " ON " + table + " (object_id, object_type_name)",
            "CREATE INDEX IF NOT EXISTS " + identifiers.quote(indexPrefix + "_actor")
                + " ON " + table + " (actor_id)"
        );
    }
}
