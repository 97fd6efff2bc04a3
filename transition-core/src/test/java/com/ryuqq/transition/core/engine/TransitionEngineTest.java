package com.ryuqq.transition.core.engine;

import com.ryuqq.transition.core.exception.HookFailureException;
import com.ryuqq.transition.core.exception.InvalidTransitionException;
import com.ryuqq.transition.core.exception.PersistenceFailureException;
import com.ryuqq.transition.core.exception.UnknownTriggerException;
import com.ryuqq.transition.core.fixture.Ticket;
import com.ryuqq.transition.core.hook.HookPhase;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.model.AvailableTrigger;
import com.ryuqq.transition.core.model.TriggerDefinition;
import com.ryuqq.transition.core.spi.TransactionalHandle;
import com.ryuqq.transition.core.spi.TranslationProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * TransitionEngine 유닛 테스트.
 *
 * <p>fire 처리 순서와 실패 단계별 부수 효과를 검증합니다:</p>
 * <ul>
 *   <li>미선언 Trigger / 잘못된 출발 상태 → 상태, 감사 기록 변경 없음</li>
 *   <li>Guard false → 예외 없이 no-op</li>
 *   <li>before Hook 실패 → 변경 없음</li>
 *   <li>after Hook 실패 → 상태는 저장됨, 감사 기록 없음</li>
 *   <li>성공 → 상태 저장 후 감사 기록 1건</li>
 * </ul>
 *
 * @author Transition Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TransitionEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Mock
    private TransactionalHandle handle;

    private TransitionEngine engine;

    @BeforeEach
    void setUp() {
        AuditLogger auditLogger = new AuditLogger(Clock.fixed(NOW, ZoneOffset.UTC));
        engine = new TransitionEngine(TranslationProvider.identity(), auditLogger, new TransitionEngineConfig());
    }

    // ============================================================
    // 1. 성공
    // ============================================================

    @Test
    void fire_성공시_상태_저장_후_감사_기록_1건() {
        // given
        Ticket ticket = new Ticket(42L, Ticket.states());

        // when
        engine.fire(handle, ticket, "start", 7L);

        // then
        assertThat(ticket.getState()).isEqualTo("InProgress");

        InOrder inOrder = inOrder(handle);
        inOrder.verify(handle).updateField(ticket, "state", "InProgress");
        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        inOrder.verify(handle).insert(captor.capture());
        verifyNoMoreInteractions(handle);

        AuditRecord record = captor.getValue();
        assertThat(record.objectId()).isEqualTo(42L);
        assertThat(record.objectTypeName()).isEqualTo("Ticket");
        assertThat(record.trigger()).isEqualTo("start");
        assertThat(record.sourceState()).isEqualTo("Open");
        assertThat(record.destState()).isEqualTo("InProgress");
        assertThat(record.actorId()).isEqualTo(7L);
        assertThat(record.createdAt()).isEqualTo(NOW);
        assertThat(record.id()).isNotNull();
    }

    @Test
    void fire_여러_출발_상태_중_현재_상태를_sourceState로_기록() {
        // given
        Ticket ticket = new Ticket(1L, Ticket.states(), "Resolved");

        // when
        engine.fire(handle, ticket, "reopen", 3L);

        // then
        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(handle).insert(captor.capture());
        assertThat(captor.getValue().sourceState()).isEqualTo("Resolved");
        assertThat(captor.getValue().destState()).isEqualTo("Open");
        assertThat(ticket.getState()).isEqualTo("Open");
    }

    @Test
    void fire_Hook_실행_순서는_before_mutate_persist_after_audit() {
        // given
        List<String> events = new ArrayList<>();
        Ticket[] holder = new Ticket[1];
        Ticket ticket = new Ticket(5L, Ticket.states(
            (h, args) -> events.add("guard:" + holder[0].getState()),
            (h, args) -> events.add("before:" + holder[0].getState()),
            (h, args) -> events.add("after:" + holder[0].getState())
        ), "InProgress");
        holder[0] = ticket;
        doAnswer(inv -> events.add("update")).when(handle).updateField(any(), anyString(), any());
        doAnswer(inv -> events.add("insert")).when(handle).insert(any());

        // when
        engine.fire(handle, ticket, "resolve", 1L);

        // then
        assertThat(events).containsExactly(
            "guard:InProgress",
            "before:InProgress",
            "update",
            "after:Resolved",
            "insert"
        );
    }

    @Test
    void fire_Guard와_Hook에_handle과_인자_전달() {
        // given
        List<Object> seen = new ArrayList<>();
        Ticket ticket = new Ticket(5L, Ticket.states(
            (h, args) -> seen.add(h) && seen.add(List.of(args)),
            (h, args) -> seen.add(List.of(args)),
            null
        ), "InProgress");

        // when
        engine.fire(handle, ticket, "resolve", 1L, "note", 10);

        // then
        assertThat(seen).containsExactly(handle, List.of("note", 10), List.of("note", 10));
    }

    @Test
    void fire_args가_null이면_빈_배열로_전달() {
        // given
        List<Integer> lengths = new ArrayList<>();
        Ticket ticket = new Ticket(5L, Ticket.states(
            (h, args) -> lengths.add(args.length),
            null,
            null
        ), "InProgress");

        // when
        engine.fire(handle, ticket, "resolve", 1L, (Object[]) null);

        // then
        assertThat(lengths).containsExactly(0);
        assertThat(ticket.getState()).isEqualTo("Resolved");
    }

    @Test
    void fire_설정된_상태_필드_이름으로_저장() {
        // given
        engine = new TransitionEngine(
            TranslationProvider.identity(),
            new AuditLogger(),
            new TransitionEngineConfig().withStateFieldName("status")
        );
        Ticket ticket = new Ticket(9L, Ticket.states());

        // when
        engine.fire(handle, ticket, "start", 1L);

        // then
        verify(handle).updateField(ticket, "status", "InProgress");
    }

    // ============================================================
    // 2. 검증 실패
    // ============================================================

    @Test
    void fire_미선언_Trigger면_UnknownTriggerException_변경_없음() {
        // given
        Ticket ticket = new Ticket(1L, Ticket.states());

        // when & then
        assertThatThrownBy(() -> engine.fire(handle, ticket, "archive", 1L))
            .isInstanceOf(UnknownTriggerException.class)
            .hasMessageContaining("archive")
            .satisfies(e -> {
                UnknownTriggerException ex = (UnknownTriggerException) e;
                assertThat(ex.getTriggerName()).isEqualTo("archive");
                assertThat(ex.getTypeName()).isEqualTo("Ticket");
            });

        assertThat(ticket.getState()).isEqualTo("Open");
        verifyNoInteractions(handle);
    }

    @Test
    void fire_출발_상태가_아니면_InvalidTransitionException_변경_없음() {
        // given
        AtomicBoolean guardCalled = new AtomicBoolean();
        Ticket ticket = new Ticket(1L, Ticket.states(
            (h, args) -> guardCalled.getAndSet(true) || true,
            null,
            null
        ));

        // when & then
        assertThatThrownBy(() -> engine.fire(handle, ticket, "resolve", 1L))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessage("Cannot fire trigger: resolve, current state: Open")
            .satisfies(e -> assertThat(((InvalidTransitionException) e).getCurrentState()).isEqualTo("Open"));

        assertThat(ticket.getState()).isEqualTo("Open");
        assertThat(guardCalled).isFalse();
        verifyNoInteractions(handle);
    }

    @Test
    void fire_null_인자_검증() {
        Ticket ticket = new Ticket(1L, Ticket.states());

        assertThatThrownBy(() -> engine.fire(null, ticket, "start", 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handle");
        assertThatThrownBy(() -> engine.fire(handle, null, "start", 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entity");
        assertThatThrownBy(() -> engine.fire(handle, ticket, null, 1L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("trigger");
    }

    @Test
    void fire_와_availableTriggers는_엔티티가_노출한_Trigger만_사용() {
        // given: reopen을 숨긴 엔티티
        Ticket ticket = new Ticket(1L, Ticket.states(), "InProgress") {
            @Override
            public Map<String, TriggerDefinition> triggers() {
                Map<String, TriggerDefinition> visible = new LinkedHashMap<>(super.triggers());
                visible.remove("reopen");
                return visible;
            }
        };

        // when & then
        assertThat(engine.availableTriggers(ticket))
            .extracting(AvailableTrigger::trigger)
            .containsExactly("resolve");
        assertThatThrownBy(() -> engine.fire(handle, ticket, "reopen", 1L))
            .isInstanceOf(UnknownTriggerException.class);
        assertThat(ticket.getState()).isEqualTo("InProgress");
        verifyNoInteractions(handle);
    }

    // ============================================================
    // 3. Guard
    // ============================================================

    @Test
    void fire_Guard가_false면_예외_없이_no_op() {
        // given
        AtomicBoolean beforeCalled = new AtomicBoolean();
        AtomicBoolean afterCalled = new AtomicBoolean();
        Ticket ticket = new Ticket(1L, Ticket.states(
            (h, args) -> false,
            (h, args) -> beforeCalled.set(true),
            (h, args) -> afterCalled.set(true)
        ), "InProgress");

        // when
        engine.fire(handle, ticket, "resolve", 1L);

        // then
        assertThat(ticket.getState()).isEqualTo("InProgress");
        assertThat(beforeCalled).isFalse();
        assertThat(afterCalled).isFalse();
        verifyNoInteractions(handle);
    }

    @Test
    void fire_Guard_예외는_감싸지_않고_전파() {
        // given
        IllegalStateException guardError = new IllegalStateException("lookup failed");
        Ticket ticket = new Ticket(1L, Ticket.states(
            (h, args) -> {
                throw guardError;
            },
            null,
            null
        ), "InProgress");

        // when & then
        assertThatThrownBy(() -> engine.fire(handle, ticket, "resolve", 1L)).isSameAs(guardError);
        assertThat(ticket.getState()).isEqualTo("InProgress");
        verifyNoInteractions(handle);
    }

    // ============================================================
    // 4. Hook 실패
    // ============================================================

    @Test
    void fire_before_Hook_실패시_BEFORE_단계_예외_변경_없음() {
        // given
        IOException cause = new IOException("inventory service down");
        Ticket ticket = new Ticket(1L, Ticket.states(
            null,
            (h, args) -> {
                throw cause;
            },
            null
        ), "InProgress");

        // when & then
        assertThatThrownBy(() -> engine.fire(handle, ticket, "resolve", 1L))
            .isInstanceOf(HookFailureException.class)
            .hasCause(cause)
            .satisfies(e -> assertThat(((HookFailureException) e).getPhase()).isEqualTo(HookPhase.BEFORE));

        assertThat(ticket.getState()).isEqualTo("InProgress");
        verifyNoInteractions(handle);
    }

    @Test
    void fire_after_Hook_실패시_상태는_저장되고_감사_기록은_없음() {
        // given
        RuntimeException cause = new RuntimeException("notification failed");
        Ticket ticket = new Ticket(1L, Ticket.states(
            null,
            null,
            (h, args) -> {
                throw cause;
            }
        ), "InProgress");

        // when & then
        assertThatThrownBy(() -> engine.fire(handle, ticket, "resolve", 1L))
            .isInstanceOf(HookFailureException.class)
            .hasCause(cause)
            .satisfies(e -> assertThat(((HookFailureException) e).getPhase()).isEqualTo(HookPhase.AFTER));

        assertThat(ticket.getState()).isEqualTo("Resolved");
        verify(handle).updateField(ticket, "state", "Resolved");
        verify(handle, never()).insert(any());
    }

    // ============================================================
    // 5. 영속성 실패
    // ============================================================

    @Test
    void fire_상태_저장_실패시_STATE_UPDATE_예외_메모리_상태는_유지() {
        // given
        AtomicBoolean afterCalled = new AtomicBoolean();
        Ticket ticket = new Ticket(1L, Ticket.states(null, null, (h, args) -> afterCalled.set(true)), "InProgress");
        RuntimeException dbError = new RuntimeException("connection reset");
        doThrow(dbError).when(handle).updateField(any(), anyString(), any());

        // when & then
        assertThatThrownBy(() -> engine.fire(handle, ticket, "resolve", 1L))
            .isInstanceOf(PersistenceFailureException.class)
            .hasCause(dbError)
            .satisfies(e -> assertThat(((PersistenceFailureException) e).getOperation())
                .isEqualTo(PersistenceFailureException.Operation.STATE_UPDATE));

        assertThat(ticket.getState()).isEqualTo("Resolved");
        assertThat(afterCalled).isFalse();
        verify(handle, never()).insert(any());
    }

    @Test
    void fire_감사_기록_실패시_AUDIT_INSERT_예외_재시도_없음() {
        // given
        Ticket ticket = new Ticket(1L, Ticket.states());
        RuntimeException dbError = new RuntimeException("unique violation");
        doThrow(dbError).when(handle).insert(any());

        // when & then
        assertThatThrownBy(() -> engine.fire(handle, ticket, "start", 1L))
            .isInstanceOf(PersistenceFailureException.class)
            .hasCause(dbError)
            .satisfies(e -> assertThat(((PersistenceFailureException) e).getOperation())
                .isEqualTo(PersistenceFailureException.Operation.AUDIT_INSERT));

        verify(handle, times(1)).insert(any());
    }

    // ============================================================
    // 6. 생성자 검증
    // ============================================================

    @Test
    void 생성자_의존성_null_검증() {
        assertThatThrownBy(() -> new TransitionEngine(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("translations");
        assertThatThrownBy(() -> new TransitionEngine(TranslationProvider.identity(), null, new TransitionEngineConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("auditLogger");
        assertThatThrownBy(() -> new TransitionEngine(TranslationProvider.identity(), new AuditLogger(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }
}
