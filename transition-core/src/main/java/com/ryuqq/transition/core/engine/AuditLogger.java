package com.ryuqq.transition.core.engine;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.spi.TransactionalHandle;

import java.time.Clock;
import java.util.UUID;

/**
 * 감사 기록 작성기.
 *
 * <p>실행된 전이마다 {@link AuditRecord} 하나를 상태 변경과 같은 트랜잭션 핸들로 추가합니다.
 * 실패는 그대로 전파하며 재시도하지 않습니다 (재시도 정책은 영속성 계층의 책임).</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class AuditLogger {

    private final Clock clock;

    /**
     * UTC 시스템 시계를 사용하는 생성자.
     */
    public AuditLogger() {
        this(Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param clock createdAt 기록에 사용할 시계
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public AuditLogger(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 감사 기록 추가.
     *
     * @param handle 트랜잭션 핸들
     * @param entity 전이된 엔티티
     * @param trigger Trigger 이름
     * @param sourceState 전이 전 상태
     * @param destState 전이 후 상태
     * @param actorId 요청자 ID
     * @return 추가된 기록
     * @throws RuntimeException handle의 insert가 실패한 경우 (변경 없이 전파)
     */
    public AuditRecord append(
        TransactionalHandle handle,
        Stateful entity,
        String trigger,
        String sourceState,
        String destState,
        long actorId
    ) {
        AuditRecord record = new AuditRecord(
            UUID.randomUUID(),
            entity.getId(),
            entity.typeName(),
            trigger,
            sourceState,
            destState,
            actorId,
            clock.instant()
        );
        handle.insert(record);
        return record;
    }
}
