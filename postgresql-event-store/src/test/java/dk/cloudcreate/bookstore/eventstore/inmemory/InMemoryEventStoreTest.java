package dk.cloudcreate.bookstore.eventstore.inmemory;

import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.test_data.OrderEvents;
import org.junit.jupiter.api.BeforeEach;

class InMemoryEventStoreTest extends AbstractEventStoreTest {
    private InMemoryEventStore eventStore;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore(OrderEvents.registry());
    }

    @Override
    protected EventStore eventStore() {
        return eventStore;
    }
}
