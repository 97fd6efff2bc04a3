package com.ryuqq.transition.adapter.inmemory.store;

import com.ryuqq.transition.core.contract.Stateful;
import com.ryuqq.transition.core.model.AuditRecord;
import com.ryuqq.transition.core.spi.TransactionalHandle;
import com.ryuqq.transition.testkit.contract.AbstractTransitionContractTest;

import java.util.List;
import java.util.Optional;

/**
 * Contract Tests for the in-memory transaction handle.
 *
 * <p>Reads go through the open transaction, so pending writes are visible
 * exactly as the engine left them.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
class InMemoryTransitionContractTest extends AbstractTransitionContractTest {

    private InMemoryTransaction transaction;

    @Override
    protected TransactionalHandle createHandle() {
        InMemoryDatabase database = new InMemoryDatabase();
        database.ensureSchema();
        transaction = database.begin();
        return transaction;
    }

    @Override
    protected Optional<String> persistedState(Stateful entity) {
        return transaction.readField(entity, "state").map(String.class::cast);
    }

    @Override
    protected List<AuditRecord> auditHistory(Stateful entity) {
        return transaction.history(entity);
    }

    @Override
    protected void failNextUpdate(RuntimeException failure) {
        transaction.failNextUpdate(failure);
    }

    @Override
    protected void failNextInsert(RuntimeException failure) {
        transaction.failNextInsert(failure);
    }
}
