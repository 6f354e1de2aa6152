package dk.cloudcreate.bookstore.eventstore.types;

import dk.cloudcreate.bookstore.common.types.LongType;

/**
 * The Global Order is a sequential ever-growing number that tracks the order in which events have been stored,
 * across all streams and tenants.<br>
 * The first global-event-order has value 1, since this is the initial value for a Postgresql BIGINT IDENTITY column.
 * {@link #NONE} is used as the checkpoint of a projection that hasn't applied any events
 */
public class GlobalEventOrder extends LongType<GlobalEventOrder> {
    public static final GlobalEventOrder NONE                     = GlobalEventOrder.of(0);
    public static final GlobalEventOrder FIRST_GLOBAL_EVENT_ORDER = GlobalEventOrder.of(1);

    public GlobalEventOrder(Long value) {
        super(value);
    }

    public static GlobalEventOrder of(long value) {
        return new GlobalEventOrder(value);
    }

    public GlobalEventOrder increment() {
        return new GlobalEventOrder(value + 1);
    }

    public static GlobalEventOrder max(GlobalEventOrder first, GlobalEventOrder second) {
        return first.isGreaterThan(second) ? first : second;
    }
}
