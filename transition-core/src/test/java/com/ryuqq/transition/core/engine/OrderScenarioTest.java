package com.ryuqq.transition.core.engine;

import com.ryuqq.transition.core.contract.StatefulEntity;
import com.ryuqq.transition.core.exception.InvalidTransitionException;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.model.StateDescriptor;
import com.ryuqq.transition.core.model.TriggerDefinition;
import com.ryuqq.transition.core.spi.TransactionalHandle;
import com.ryuqq.transition.core.spi.TranslationProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * 주문 결제 시나리오 테스트.
 *
 * <pre>
 * Created ──pay (amount &gt; 0)──► Paid ──ship──► Shipped
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OrderScenarioTest {

    private static final StateDescriptor ORDER_STATES = StateDescriptor.builder("Order")
        .states("Created", "Paid", "Shipped")
        .initialState("Created")
        .trigger(TriggerDefinition.builder("pay")
            .from("Created")
            .to("Paid")
            .guard((handle, args) -> ((Integer) args[0]) > 0)
            .build())
        .trigger(TriggerDefinition.builder("ship").from("Paid").to("Shipped").build())
        .build();

    @Mock
    private TransactionalHandle handle;

    private TransitionEngine engine;
    private Order order;

    @BeforeEach
    void setUp() {
        engine = new TransitionEngine(TranslationProvider.identity());
        order = new Order(100L);
        order.bindEngine(engine);
    }

    @Test
    void pay_금액이_양수면_Paid로_전이되고_감사_기록_1건() {
        // when
        order.fire(handle, "pay", 7L, 10);

        // then
        assertThat(order.getState()).isEqualTo("Paid");
        verify(handle).updateField(order, "state", "Paid");

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(handle, times(1)).insert(captor.capture());
        AuditRecord record = captor.getValue();
        assertThat(record.trigger()).isEqualTo("pay");
        assertThat(record.sourceState()).isEqualTo("Created");
        assertThat(record.destState()).isEqualTo("Paid");
        assertThat(record.actorId()).isEqualTo(7L);
        assertThat(record.objectId()).isEqualTo(100L);
        assertThat(record.objectTypeName()).isEqualTo("Order");
    }

    @Test
    void pay_금액이_0이면_오류_없이_Created_유지_감사_기록_없음() {
        // when
        order.fire(handle, "pay", 7L, 0);

        // then
        assertThat(order.getState()).isEqualTo("Created");
        verifyNoInteractions(handle);
    }

    @Test
    void pay_Shipped_상태에서는_InvalidTransitionException() {
        // given
        order.setState("Shipped");

        // when & then
        assertThatThrownBy(() -> order.fire(handle, "pay", 7L, 10))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("Shipped");
        assertThat(order.getState()).isEqualTo("Shipped");
        verifyNoInteractions(handle);
    }

    @Test
    void pay_이후_ship_전체_흐름() {
        // when
        order.fire(handle, "pay", 7L, 10);
        order.fire(handle, "ship", 8L);

        // then
        assertThat(order.getState()).isEqualTo("Shipped");
        assertThat(order.availableTriggers()).isEmpty();
        verify(handle, times(2)).insert(any());
    }

    private static final class Order extends StatefulEntity {

        private final long id;

        Order(long id) {
            super(ORDER_STATES);
            this.id = id;
        }

        @Override
        public long getId() {
            return id;
        }
    }
}
