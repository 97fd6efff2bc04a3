package com.ryuqq.transition.core.engine;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.exception.HookFailureException;
import com.ryuqq.transition.core.exception.InvalidTransitionException;
import com.ryuqq.transition.core.exception.PersistenceFailureException;
import com.ryuqq.transition.core.exception.UnknownTriggerException;
import com.ryuqq.transition.core.hook.Hook;
import com.ryuqq.transition.core.hook.HookPhase;
import com.ryuqq.transition.core.model.AvailableTrigger;
import com.ryuqq.transition.core.model.TriggerDefinition;
import com.ryuqq.transition.core.spi.TransactionalHandle;
import com.ryuqq.transition.core.spi.TranslationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 상태 전이 엔진.
 *
 * <p>{@link Stateful} 엔티티에 대해 Trigger 조회, 출발 상태 검증, Guard 평가,
 * Hook 실행, 상태 변경과 저장, 감사 기록을 순서대로 수행합니다.</p>
 *
 * <p><strong>fire 처리 순서:</strong></p>
 * <pre>
 * 1. Lookup    : Trigger 미선언          → UnknownTriggerException
 * 2. Validate  : 현재 상태 ∉ sourceStates → InvalidTransitionException
 * 3. Guard     : false                  → 아무것도 하지 않고 정상 반환
 * 4. Before    : 실패                    → HookFailureException(BEFORE)
 * 5. Mutate    : entity.setState(dest)
 * 6. Persist   : handle.updateField(entity, "state", dest)
 *                실패                    → PersistenceFailureException(STATE_UPDATE)
 * 7. After     : 실패                    → HookFailureException(AFTER)  (상태는 이미 저장됨)
 * 8. Audit     : handle.insert(record)
 *                실패                    → PersistenceFailureException(AUDIT_INSERT)
 * </pre>
 *
 * <p><strong>트랜잭션:</strong> 엔진은 트랜잭션을 열거나 커밋하지 않습니다.
 * 상태 변경과 감사 기록의 원자성은 호출자가 fire 전체를 하나의 트랜잭션에서
 * 실행하고 한 번 커밋할 때만 보장됩니다.</p>
 *
 * <p><strong>동시성:</strong> 공유 가변 상태가 없으므로 서로 다른 엔티티에 대해 동시에
 * 호출해도 안전합니다. 같은 엔티티에 대한 동시 호출은 잠금이나 버전 검사가 없어
 * 나중 쓰기가 앞선 전이를 덮어쓸 수 있습니다. 필요하면 호출자가 행 잠금을 걸거나
 * before Hook에서 버전 컬럼을 검사해야 합니다.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public final class TransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);
    private static final Object[] NO_ARGS = new Object[0];

    private final TranslationProvider translations;
    private final AuditLogger auditLogger;
    private final TransitionEngineConfig config;

    /**
     * 기본 AuditLogger와 기본 설정을 사용하는 생성자.
     *
     * @param translations 번역 제공자
     * @throws IllegalArgumentException translations가 null인 경우
     */
    public TransitionEngine(TranslationProvider translations) {
        this(translations, new AuditLogger(), new TransitionEngineConfig());
    }

    /**
     * 생성자.
     *
     * @param translations 번역 제공자
     * @param auditLogger 감사 기록 작성기
     * @param config 엔진 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransitionEngine(TranslationProvider translations, AuditLogger auditLogger, TransitionEngineConfig config) {
        if (translations == null) {
            throw new IllegalArgumentException("translations cannot be null");
        }
        if (auditLogger == null) {
            throw new IllegalArgumentException("auditLogger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.translations = translations;
        this.auditLogger = auditLogger;
        this.config = config;
    }

    /**
     * 현재 상태에서 실행 가능한 Trigger 목록.
     *
     * <p>sourceStates에 현재 상태가 포함된 Trigger를 이름 순으로 반환하며,
     * 각 Trigger의 표시 이름은 {@code "<TypeName>:<trigger>"} 키로 번역합니다.
     * Guard는 평가하지 않습니다.</p>
     *
     * @param entity 엔티티
     * @return 실행 가능한 Trigger (이름 순, 비어 있을 수 있음)
     * @throws IllegalArgumentException entity가 null인 경우
     */
    public List<AvailableTrigger> availableTriggers(Stateful entity) {
        requireEntity(entity);
        String currentState = entity.getState();

        return entity.triggers().values().stream()
            .filter(definition -> definition.acceptsSource(currentState))
            .sorted(Comparator.comparing(TriggerDefinition::name))
            .map(definition -> new AvailableTrigger(
                definition.name(),
                translations.translate(TranslationProvider.keyOf(entity.typeName(), definition.name()))
            ))
            .collect(Collectors.toList());
    }

    /**
     * 현재 상태의 표시 이름.
     *
     * @param entity 엔티티
     * @return {@code "<TypeName>:<state>"} 키의 번역
     * @throws IllegalArgumentException entity가 null인 경우
     */
    public String translatedState(Stateful entity) {
        requireEntity(entity);
        return translations.translate(TranslationProvider.keyOf(entity.typeName(), entity.getState()));
    }

    /**
     * Trigger 실행.
     *
     * <p>Guard가 false를 반환하면 예외 없이 반환하며 상태, Hook, 감사 기록 모두
     * 변경되지 않습니다. 호출자는 상태 변화 여부로만 이를 구분할 수 있습니다.</p>
     *
     * <p>after Hook이 실패하면 상태 필드는 이미 저장된 상태이고 감사 기록은 남지 않습니다.
     * 호출자가 트랜잭션을 롤백해야 일관성이 유지됩니다.</p>
     *
     * @param handle 호출자가 소유한 트랜잭션 핸들
     * @param entity 엔티티
     * @param trigger Trigger 이름
     * @param actorId 요청자 ID
     * @param args Guard/Hook에 전달할 인자
     * @throws IllegalArgumentException handle, entity, trigger가 null인 경우
     * @throws UnknownTriggerException 선언되지 않은 Trigger인 경우
     * @throws InvalidTransitionException 현재 상태에서 실행할 수 없는 경우
     * @throws HookFailureException before/after Hook이 실패한 경우
     * @throws PersistenceFailureException 상태 저장 또는 감사 기록이 실패한 경우
     */
    public void fire(TransactionalHandle handle, Stateful entity, String trigger, long actorId, Object... args) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        requireEntity(entity);
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        Object[] hookArgs = args == null ? NO_ARGS : args;

        // 1. Lookup
        TriggerDefinition definition = entity.triggers().get(trigger);
        if (definition == null) {
            throw new UnknownTriggerException(trigger, entity.typeName());
        }

        // 2. Source validation
        String sourceState = entity.getState();
        if (!definition.acceptsSource(sourceState)) {
            throw new InvalidTransitionException(trigger, sourceState);
        }

        // 3. Guard: false는 오류가 아닌 no-op
        boolean allowed = definition.guardOptional()
            .map(guard -> guard.test(handle, hookArgs))
            .orElse(true);
        if (!allowed) {
            log.debug("Guard rejected {} on {}#{} in state {}", trigger, entity.typeName(), entity.getId(), sourceState);
            return;
        }

        // 4. Before hook
        runHook(definition.before(), HookPhase.BEFORE, trigger, handle, hookArgs);

        // 5. Mutate
        String destState = definition.destState();
        entity.setState(destState);

        // 6. Persist (상태 필드만)
        try {
            handle.updateField(entity, config.stateFieldName(), destState);
        } catch (RuntimeException e) {
            log.warn("State update failed for {} on {}#{}: {} → {}", trigger, entity.typeName(), entity.getId(), sourceState, destState);
            throw new PersistenceFailureException(trigger, PersistenceFailureException.Operation.STATE_UPDATE, e);
        }

        // 7. After hook: 실패 시 저장된 상태는 남고 감사 기록은 없음
        runHook(definition.after(), HookPhase.AFTER, trigger, handle, hookArgs);

        // 8. Audit
        try {
            auditLogger.append(handle, entity, trigger, sourceState, destState, actorId);
        } catch (RuntimeException e) {
            log.warn("Audit insert failed for {} on {}#{}", trigger, entity.typeName(), entity.getId());
            throw new PersistenceFailureException(trigger, PersistenceFailureException.Operation.AUDIT_INSERT, e);
        }

        log.info("{}#{} {}: {} → {} (actor {})", entity.typeName(), entity.getId(), trigger, sourceState, destState, actorId);
    }

    private void runHook(Hook hook, HookPhase phase, String trigger, TransactionalHandle handle, Object[] args) {
        if (hook == null) {
            return;
        }
        try {
            hook.run(handle, args);
        } catch (Exception e) {
            log.warn("{} hook failed for {}", phase, trigger, e);
            throw new HookFailureException(trigger, phase, e);
        }
    }

    private static void requireEntity(Stateful entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
    }
}
