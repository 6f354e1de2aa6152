package dk.cloudcreate.bookstore.scheduler;

import dk.cloudcreate.bookstore.scheduler.store.ScheduledCommandStore;
import dk.cloudcreate.bookstore.scheduler.store.inmemory.InMemoryScheduledCommandStore;

class CommandSchedulerTest extends AbstractCommandSchedulerTest {
    @Override
    protected ScheduledCommandStore createStore() {
        return new InMemoryScheduledCommandStore();
    }
}
