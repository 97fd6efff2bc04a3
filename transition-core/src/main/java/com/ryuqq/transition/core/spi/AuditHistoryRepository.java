package com.ryuqq.transition.core.spi;

import com.ryuqq.transition.core.model.AuditRecord;

import java.util.List;

/**
 * Read side of the audit trail.
 *
 * <p><strong>Query Example:</strong></p>
 * <pre>
 * SELECT * FROM state_machine_log
 * WHERE object_id = ? AND object_type_name = ?
 * ORDER BY created_at ASC;
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public interface AuditHistoryRepository {

    /**
     * Returns the transitions recorded for one entity, oldest first.
     *
     * @param objectId the entity id
     * @param objectTypeName the entity type name
     * @return audit records (may be empty)
     * @throws IllegalArgumentException if objectTypeName is null or blank
     */
    List<AuditRecord> findHistory(long objectId, String objectTypeName);

    /**
     * Returns the transitions executed by one actor, oldest first.
     *
     * @param actorId the actor id
     * @return audit records (may be empty)
     */
    List<AuditRecord> findByActor(long actorId);
}
