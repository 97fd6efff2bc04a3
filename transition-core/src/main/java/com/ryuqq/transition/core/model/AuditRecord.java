package com.ryuqq.transition.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 실행된 상태 전이 하나에 대한 불변 감사 기록.
 *
 * <p>엔진은 기록을 추가만 하며 수정하거나 삭제하지 않습니다.</p>
 *
 * <p><strong>저장 스키마:</strong></p>
 * <pre>
 * id | object_id | object_type_name | trigger_name | source_state | dest_state | actor_id | created_at
 * INDEX (object_id, object_type_name)
 * </pre>
 *
 * @param id 기록 식별자
 * @param objectId 엔티티 ID
 * @param objectTypeName 엔티티 타입 이름
 * @param trigger 실행된 Trigger 이름
 * @param sourceState 전이 전 상태
 * @param destState 전이 후 상태
 * @param actorId 전이를 요청한 사용자 ID
 * @param createdAt 기록 시각
 *
 * @author Transition Team
 * @since 1.0.0
 */
public record AuditRecord(
    UUID id,
    long objectId,
    String objectTypeName,
    String trigger,
    String sourceState,
    String destState,
    long actorId,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public AuditRecord {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        requireText(objectTypeName, "objectTypeName");
        requireText(trigger, "trigger");
        requireText(sourceState, "sourceState");
        requireText(destState, "destState");
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
    }

    /**
     * 주어진 엔티티의 기록인지 확인.
     *
     * @param objectId 엔티티 ID
     * @param objectTypeName 엔티티 타입 이름
     * @return 일치하면 true
     */
    public boolean belongsTo(long objectId, String objectTypeName) {
        return this.objectId == objectId && this.objectTypeName.equals(objectTypeName);
    }
}
