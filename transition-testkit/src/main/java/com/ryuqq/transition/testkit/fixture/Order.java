package com.ryuqq.transition.testkit.fixture;

import com.ryuqq.transition.core.contract.StatefulEntity;
import com.ryuqq.transition.core.hook.Hook;
import com.ryuqq.transition.core.model.StateDescriptor;
import com.ryuqq.transition.core.model.TriggerDefinition;

/**
 * Order fixture entity for contract tests.
 *
 * <pre>
 * Created ──pay (amount &gt; 0)──► Paid ──ship──► Shipped
 *    │                          │
 *    └──────────cancel──────────┴──► Cancelled
 * </pre>
 *
 * <p>{@code pay} expects the amount as its first argument ({@link Integer}).</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class Order extends StatefulEntity {

    public static final String TYPE_NAME = "Order";

    public static final String CREATED = "Created";
    public static final String PAID = "Paid";
    public static final String SHIPPED = "Shipped";
    public static final String CANCELLED = "Cancelled";

    public static final String PAY = "pay";
    public static final String SHIP = "ship";
    public static final String CANCEL = "cancel";

    private final long id;

    /**
     * Creates an order in {@value #CREATED} without hooks.
     *
     * @param id the order id
     */
    public Order(long id) {
        this(id, states(null, null));
    }

    /**
     * Creates an order with a custom descriptor, e.g. one built by {@link #states(Hook, Hook)}.
     *
     * @param id the order id
     * @param descriptor the descriptor
     */
    public Order(long id, StateDescriptor descriptor) {
        super(descriptor);
        this.id = id;
    }

    @Override
    public long getId() {
        return id;
    }

    /**
     * Builds the Order descriptor.
     *
     * @param beforePay before-hook of {@code pay} (nullable)
     * @param afterPay after-hook of {@code pay} (nullable)
     * @return the descriptor
     */
    public static StateDescriptor states(Hook beforePay, Hook afterPay) {
        return StateDescriptor.builder(TYPE_NAME)
            .states(CREATED, PAID, SHIPPED, CANCELLED)
            .initialState(CREATED)
            .trigger(TriggerDefinition.builder(PAY)
                .from(CREATED)
                .to(PAID)
                .guard((handle, args) -> args.length > 0 && ((Integer) args[0]) > 0)
                .before(beforePay)
                .after(afterPay)
                .build())
            .trigger(TriggerDefinition.builder(SHIP).from(PAID).to(SHIPPED).build())
            .trigger(TriggerDefinition.builder(CANCEL).from(CREATED, PAID).to(CANCELLED).build())
            .build();
    }
}
