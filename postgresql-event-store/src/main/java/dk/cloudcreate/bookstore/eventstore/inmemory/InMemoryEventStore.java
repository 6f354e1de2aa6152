package dk.cloudcreate.bookstore.eventstore.inmemory;

import com.google.common.collect.*;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.bus.CommittedEventsBus;
import dk.cloudcreate.bookstore.eventstore.serializer.json.*;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.*;

/**
 * {@link EventStore} keeping all streams in memory. Appends are serialized on the store instance, which makes the
 * global order equal to the commit order.<br>
 * Payloads are round-tripped through the {@link JSONSerializer} exactly like the PostgreSQL store does, so readers never
 * share mutable payload instances with writers
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Table<TenantId, StreamId, List<PersistedEvent>> streams        = HashBasedTable.create();
    private final List<PersistedEvent>                            allEvents      = new ArrayList<>();
    private final CommittedEventsBus                              committedEvents = new CommittedEventsBus();
    private final EventTypeRegistry                               eventTypeRegistry;
    private final JSONSerializer                                  jsonSerializer;
    private final Clock                                           clock;

    public InMemoryEventStore(EventTypeRegistry eventTypeRegistry) {
        this(eventTypeRegistry, new JacksonJSONSerializer(), Clock.systemUTC());
    }

    public InMemoryEventStore(EventTypeRegistry eventTypeRegistry, JSONSerializer jsonSerializer, Clock clock) {
        this.eventTypeRegistry = checkNotNull(eventTypeRegistry, "No eventTypeRegistry provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.clock = checkNotNull(clock, "No clock provided");
    }

    @Override
    public AppendResult append(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, List<PersistableEvent> events) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(streamId, "No streamId provided");
        checkNotNull(expectedVersion, "No expectedVersion provided");
        checkNotNull(events, "No events provided");

        List<PersistedEvent> persistedEvents;
        StreamVersion        newVersion;
        synchronized (this) {
            var stream         = streams.get(tenantId, streamId);
            var currentVersion = StreamVersion.of(stream == null ? 0 : stream.size());
            if (expectedVersion.isNewStream() && !currentVersion.isNewStream()) {
                throw new StreamCollisionException(tenantId, streamId);
            }
            if (!expectedVersion.equals(currentVersion)) {
                throw new ConcurrencyConflictException(tenantId, streamId, expectedVersion, Optional.of(currentVersion));
            }
            if (events.isEmpty()) {
                return new AppendResult(tenantId, streamId, currentVersion, List.of());
            }

            var timestamp = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
            var version   = currentVersion;
            persistedEvents = new ArrayList<>(events.size());
            for (var event : events) {
                version = version.increment();
                var eventType = event.eventType().orElseGet(() -> eventTypeRegistry.eventTypeOf(event.event().getClass()));
                persistedEvents.add(new PersistedEvent(event.eventId(),
                                                       tenantId,
                                                       streamId,
                                                       version,
                                                       GlobalEventOrder.of(allEvents.size() + persistedEvents.size() + 1L),
                                                       new EventJSON(eventTypeRegistry, jsonSerializer, eventType, jsonSerializer.serialize(event.event())),
                                                       event.correlationId(),
                                                       event.causationId(),
                                                       timestamp));
            }
            if (stream == null) {
                stream = new ArrayList<>();
                streams.put(tenantId, streamId, stream);
            }
            stream.addAll(persistedEvents);
            allEvents.addAll(persistedEvents);
            newVersion = version;
            // Published while holding the lock to keep publication in commit order
            committedEvents.publish(persistedEvents);
        }
        log.debug("[{}:{}] Appended {} event(s), stream is now at version {}", tenantId, streamId, persistedEvents.size(), newVersion);
        return new AppendResult(tenantId, streamId, newVersion, persistedEvents);
    }

    @Override
    public synchronized List<PersistedEvent> readStream(TenantId tenantId, StreamId streamId) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(streamId, "No streamId provided");
        var stream = streams.get(tenantId, streamId);
        return stream == null ? List.of() : List.copyOf(stream);
    }

    @Override
    public synchronized StreamVersion currentVersion(TenantId tenantId, StreamId streamId) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(streamId, "No streamId provided");
        var stream = streams.get(tenantId, streamId);
        return StreamVersion.of(stream == null ? 0 : stream.size());
    }

    @Override
    public synchronized List<PersistedEvent> readAll(GlobalEventOrder fromGlobalEventOrder, int batchSize) {
        checkNotNull(fromGlobalEventOrder, "No fromGlobalEventOrder provided");
        checkArgument(batchSize > 0, "batchSize must be > 0");
        var fromIndex = (int) Math.max(0, fromGlobalEventOrder.longValue() - 1);
        if (fromIndex >= allEvents.size()) {
            return List.of();
        }
        return List.copyOf(allEvents.subList(fromIndex, Math.min(allEvents.size(), fromIndex + batchSize)));
    }

    @Override
    public synchronized List<PersistedEvent> readAll(TenantId tenantId, GlobalEventOrder fromGlobalEventOrder, int batchSize) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(fromGlobalEventOrder, "No fromGlobalEventOrder provided");
        checkArgument(batchSize > 0, "batchSize must be > 0");
        var fromIndex = (int) Math.max(0, fromGlobalEventOrder.longValue() - 1);
        if (fromIndex >= allEvents.size()) {
            return List.of();
        }
        return allEvents.subList(fromIndex, allEvents.size())
                        .stream()
                        .filter(event -> event.tenantId().equals(tenantId))
                        .limit(batchSize)
                        .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public synchronized GlobalEventOrder headPosition(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        for (int i = allEvents.size() - 1; i >= 0; i--) {
            if (allEvents.get(i).tenantId().equals(tenantId)) {
                return allEvents.get(i).globalEventOrder();
            }
        }
        return GlobalEventOrder.NONE;
    }

    @Override
    public Flux<PersistedEvent> committedEvents() {
        return committedEvents.flux();
    }

    @Override
    public EventTypeRegistry eventTypes() {
        return eventTypeRegistry;
    }
}
