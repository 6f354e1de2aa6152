package dk.cloudcreate.bookstore.domain.tenant;

import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.common.tenant.TenantRegistry;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.EventStore;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.slf4j.*;

import java.util.*;

import static com.google.common.base.Preconditions.*;

/**
 * {@link TenantRegistry} backed by {@link TenantRegistered} events in the {@link TenantId#SYSTEM} partition.<br>
 * Every lookup reads the event store, so wrap it in a {@link dk.cloudcreate.bookstore.common.tenant.CachingTenantRegistry}
 * when it sits on the request path
 */
public class EventSourcedTenantRegistry implements TenantRegistry {
    private static final Logger log       = LoggerFactory.getLogger(EventSourcedTenantRegistry.class);
    private static final int    READ_SIZE = 500;

    private final CommandBus commandBus;
    private final EventStore eventStore;

    public EventSourcedTenantRegistry(CommandBus commandBus, EventStore eventStore) {
        this.commandBus = checkNotNull(commandBus, "No commandBus provided");
        this.eventStore = checkNotNull(eventStore, "No eventStore provided");
    }

    @Override
    public boolean isValid(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return tenantId.isSystemTenant() || !eventStore.currentVersion(TenantId.SYSTEM, StreamId.of(tenantId.toString())).isNewStream();
    }

    @Override
    public boolean register(TenantId tenantId, String name) {
        checkNotNull(tenantId, "No tenantId provided");
        checkArgument(!tenantId.isSystemTenant(), "The system tenant cannot be registered");
        var result = commandBus.submit(CommandEnvelope.of(TenantId.SYSTEM, new RegisterTenant(tenantId.toString(), name)));
        if (result.isChanged()) {
            log.info("Registered tenant '{}'", tenantId);
        }
        return result.isChanged();
    }

    @Override
    public Set<TenantId> registeredTenants() {
        var tenants = new LinkedHashSet<TenantId>();
        var from    = GlobalEventOrder.FIRST_GLOBAL_EVENT_ORDER;
        while (true) {
            var events = eventStore.readAll(TenantId.SYSTEM, from, READ_SIZE);
            events.stream()
                  .map(persistedEvent -> persistedEvent.event())
                  .filter(event -> event instanceof TenantRegistered)
                  .forEach(event -> tenants.add(TenantId.of(((TenantRegistered) event).getTenantId())));
            if (events.size() < READ_SIZE) {
                return Collections.unmodifiableSet(tenants);
            }
            from = events.get(events.size() - 1).globalEventOrder().increment();
        }
    }

    @Override
    public Optional<String> nameOf(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return commandBus.rehydrator()
                         .rehydrate(TenantId.SYSTEM, StreamId.of(tenantId.toString()), TenantAggregate.DEFINITION)
                         .map(snapshot -> snapshot.state);
    }
}
