package com.ryuqq.transition.testkit.contract;

import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.testkit.fixture.Order;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RecordingTransactionalHandle tests.
 *
 * @author Transition Team
 * @since 1.0.0
 */
class RecordingTransactionalHandleTest {

    private final RecordingTransactionalHandle handle = new RecordingTransactionalHandle();

    @Test
    void updateField_KeepsLastValuePerEntity() {
        Order first = new Order(1L);
        Order second = new Order(2L);

        handle.updateField(first, "state", Order.PAID);
        handle.updateField(first, "state", Order.SHIPPED);

        assertThat(handle.writtenValue(first, "state")).contains(Order.SHIPPED);
        assertThat(handle.writtenValue(second, "state")).isEmpty();
        assertThat(handle.updateCount()).isEqualTo(2);
    }

    @Test
    void insert_FiltersRecordsByEntity() {
        Order order = new Order(1L);
        handle.insert(record(1L, "Order"));
        handle.insert(record(1L, "Invoice"));
        handle.insert(record(2L, "Order"));

        assertThat(handle.auditRecords(order)).hasSize(1);
        assertThat(handle.allAuditRecords()).hasSize(3);
    }

    @Test
    void injectedFailures_ApplyOnceEach() {
        Order order = new Order(1L);
        handle.failNextUpdate(new IllegalStateException("update"));
        handle.failNextInsert(new IllegalStateException("insert"));

        assertThatThrownBy(() -> handle.updateField(order, "state", Order.PAID)).hasMessage("update");
        assertThatThrownBy(() -> handle.insert(record(1L, "Order"))).hasMessage("insert");

        handle.updateField(order, "state", Order.PAID);
        handle.insert(record(1L, "Order"));
        assertThat(handle.writtenValue(order, "state")).contains(Order.PAID);
        assertThat(handle.auditRecords(order)).hasSize(1);
    }

    private static AuditRecord record(long objectId, String typeName) {
        return new AuditRecord(UUID.randomUUID(), objectId, typeName, "pay", "Created", "Paid", 1L, Instant.now());
    }
}
