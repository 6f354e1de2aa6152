package dk.cloudcreate.bookstore.eventstore.postgresql;

import com.google.common.base.Throwables;
import dk.cloudcreate.bookstore.common.transaction.*;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.bus.CommittedEventsBus;
import dk.cloudcreate.bookstore.eventstore.serializer.json.*;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.jdbi.v3.core.Handle;
import org.postgresql.util.PSQLException;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.*;
import java.util.*;
import java.util.function.Function;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * {@link EventStore} storing the events of all tenants and streams in a single PostgreSQL table.<br>
 * <br>
 * Concurrency control: appends for the same tenant are serialized using a transaction scoped advisory lock keyed by the tenant.
 * While holding the lock the current stream version is compared with the expected version, and the
 * <code>UNIQUE (tenant_id, stream_id, stream_version)</code> constraint backs up the check.<br>
 * Serializing appends per tenant also guarantees that <code>global_order</code> values become visible in increasing order within a tenant,
 * so a consumer reading with {@link #readAll(TenantId, GlobalEventOrder, int)} can never skip a late committing event.
 */
public class PostgresqlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private final HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory;
    private final EventTypeRegistry                                             eventTypeRegistry;
    private final JSONSerializer                                                jsonSerializer;
    private final PostgresqlEventStoreConfiguration                             configuration;
    private final Clock                                                         clock;
    private final PersistedEventRowMapper                                       rowMapper;
    private final CommittedEventsBus                                            committedEvents = new CommittedEventsBus();
    private final String                                                        insertSql;
    private final String                                                        streamVersionConstraintName;

    public PostgresqlEventStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                                EventTypeRegistry eventTypeRegistry) {
        this(unitOfWorkFactory, eventTypeRegistry, new JacksonJSONSerializer(), PostgresqlEventStoreConfiguration.defaultConfiguration(), Clock.systemUTC());
    }

    public PostgresqlEventStore(HandleAwareUnitOfWorkFactory<? extends HandleAwareUnitOfWork> unitOfWorkFactory,
                                EventTypeRegistry eventTypeRegistry,
                                JSONSerializer jsonSerializer,
                                PostgresqlEventStoreConfiguration configuration,
                                Clock clock) {
        this.unitOfWorkFactory = checkNotNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.eventTypeRegistry = checkNotNull(eventTypeRegistry, "No eventTypeRegistry provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
        this.clock = checkNotNull(clock, "No clock provided");
        this.rowMapper = new PersistedEventRowMapper(eventTypeRegistry, jsonSerializer);
        this.streamVersionConstraintName = configuration.eventsTableName + "_stream_version_key";
        this.insertSql = "INSERT INTO " + configuration.eventsTableName + " (\n" +
                "   tenant_id, stream_id, stream_version, event_id, event_type, event_payload, correlation_id, causation_id, event_timestamp\n" +
                ") VALUES (\n" +
                "   :tenantId, :streamId, :streamVersion, :eventId, :eventType, CAST(:eventPayload AS JSONB), :correlationId, :causationId, :eventTimestamp\n" +
                ")";
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> createEventsTable(unitOfWork.handle()));
    }

    private void createEventsTable(Handle handle) {
        var table = configuration.eventsTableName;
        handle.execute("CREATE TABLE IF NOT EXISTS " + table + " (\n" +
                               "    global_order bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                               "    tenant_id text NOT NULL,\n" +
                               "    stream_id text NOT NULL,\n" +
                               "    stream_version bigint NOT NULL,\n" +
                               "    event_id text NOT NULL,\n" +
                               "    event_type text NOT NULL,\n" +
                               "    event_payload JSONB NOT NULL,\n" +
                               "    correlation_id text,\n" +
                               "    causation_id text,\n" +
                               "    event_timestamp TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                               "    CONSTRAINT " + streamVersionConstraintName + " UNIQUE (tenant_id, stream_id, stream_version),\n" +
                               "    CONSTRAINT " + table + "_event_id_key UNIQUE (event_id)\n" +
                               ")");
        handle.execute("CREATE INDEX IF NOT EXISTS " + table + "_tenant_global_order_idx ON " + table + " (tenant_id, global_order)");
        log.info("Ensured event table '{}' exists", table);
    }

    @Override
    public AppendResult append(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, List<PersistableEvent> events) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(streamId, "No streamId provided");
        checkNotNull(expectedVersion, "No expectedVersion provided");
        checkNotNull(events, "No events provided");

        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            handle.createQuery("SELECT pg_advisory_xact_lock(:namespace, hashtext(:tenantId))")
                  .bind("namespace", configuration.appendLockNamespace)
                  .bind("tenantId", tenantId.toString())
                  .mapToMap()
                  .one();

            var currentVersion = currentVersion(handle, tenantId, streamId);
            if (expectedVersion.isNewStream() && !currentVersion.isNewStream()) {
                throw new StreamCollisionException(tenantId, streamId);
            }
            if (!expectedVersion.equals(currentVersion)) {
                throw new ConcurrencyConflictException(tenantId, streamId, expectedVersion, Optional.of(currentVersion));
            }
            if (events.isEmpty()) {
                return new AppendResult(tenantId, streamId, currentVersion, List.of());
            }

            var persistedEvents = insertEvents(handle, tenantId, streamId, expectedVersion, events);
            var newVersion      = expectedVersion.plus(events.size());
            unitOfWork.onAfterCommit(() -> committedEvents.publish(persistedEvents));
            log.debug("[{}:{}] Appended {} event(s), stream is now at version {}", tenantId, streamId, events.size(), newVersion);
            return new AppendResult(tenantId, streamId, newVersion, persistedEvents);
        });
    }

    private List<PersistedEvent> insertEvents(Handle handle, TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, List<PersistableEvent> events) {
        var timestamp  = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        var batch      = handle.prepareBatch(insertSql);
        var version    = expectedVersion;
        var eventJSONs = new ArrayList<EventJSON>(events.size());
        for (var event : events) {
            version = version.increment();
            var eventType = event.eventType().orElseGet(() -> eventTypeRegistry.eventTypeOf(event.event().getClass()));
            var eventJSON = new EventJSON(eventTypeRegistry, jsonSerializer, eventType, jsonSerializer.serialize(event.event()));
            eventJSONs.add(eventJSON);
            batch.bind("tenantId", tenantId.toString())
                 .bind("streamId", streamId.toString())
                 .bind("streamVersion", version.longValue())
                 .bind("eventId", event.eventId().toString())
                 .bind("eventType", eventType.toString())
                 .bind("eventPayload", eventJSON.json())
                 .bind("correlationId", event.correlationId().map(Object::toString).orElse(null))
                 .bind("causationId", event.causationId().map(Object::toString).orElse(null))
                 .bind("eventTimestamp", timestamp)
                 .add();
        }

        List<Long> globalOrders;
        try {
            globalOrders = batch.executePreparedBatch("global_order")
                                .mapTo(Long.class)
                                .list();
        } catch (RuntimeException e) {
            throw translateAppendFailure(e, tenantId, streamId, expectedVersion, events.size());
        }
        checkState(globalOrders.size() == events.size(), "Expected %s generated global orders but got %s", events.size(), globalOrders.size());

        var persistedEvents = new ArrayList<PersistedEvent>(events.size());
        for (int i = 0; i < events.size(); i++) {
            var event = events.get(i);
            persistedEvents.add(new PersistedEvent(event.eventId(),
                                                   tenantId,
                                                   streamId,
                                                   expectedVersion.plus(i + 1L),
                                                   GlobalEventOrder.of(globalOrders.get(i)),
                                                   eventJSONs.get(i),
                                                   event.correlationId(),
                                                   event.causationId(),
                                                   timestamp));
        }
        return persistedEvents;
    }

    private RuntimeException translateAppendFailure(RuntimeException e, TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, int numberOfEvents) {
        var rootCause = Throwables.getRootCause(e);
        if (rootCause instanceof PSQLException) {
            var serverErrorMessage = ((PSQLException) rootCause).getServerErrorMessage();
            if (serverErrorMessage != null && streamVersionConstraintName.equals(serverErrorMessage.getConstraint())) {
                if (expectedVersion.isNewStream()) {
                    return new StreamCollisionException(tenantId, streamId, e);
                }
                return new ConcurrencyConflictException(tenantId, streamId, expectedVersion, Optional.empty(), e);
            }
        }
        return new AppendToStreamException(lenientFormat("[%s:%s] Failed to append %s event(s) after stream version %s",
                                                         tenantId, streamId, numberOfEvents, expectedVersion), e);
    }

    @Override
    public List<PersistedEvent> readStream(TenantId tenantId, StreamId streamId) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(streamId, "No streamId provided");
        return withHandle(handle -> handle.createQuery("SELECT * FROM " + configuration.eventsTableName +
                                                               " WHERE tenant_id = :tenantId AND stream_id = :streamId ORDER BY stream_version ASC")
                                          .bind("tenantId", tenantId.toString())
                                          .bind("streamId", streamId.toString())
                                          .map(rowMapper)
                                          .list());
    }

    @Override
    public StreamVersion currentVersion(TenantId tenantId, StreamId streamId) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(streamId, "No streamId provided");
        return withHandle(handle -> currentVersion(handle, tenantId, streamId));
    }

    private StreamVersion currentVersion(Handle handle, TenantId tenantId, StreamId streamId) {
        return StreamVersion.of(handle.createQuery("SELECT COALESCE(MAX(stream_version), 0) FROM " + configuration.eventsTableName +
                                                           " WHERE tenant_id = :tenantId AND stream_id = :streamId")
                                      .bind("tenantId", tenantId.toString())
                                      .bind("streamId", streamId.toString())
                                      .mapTo(Long.class)
                                      .one());
    }

    @Override
    public List<PersistedEvent> readAll(GlobalEventOrder fromGlobalEventOrder, int batchSize) {
        checkNotNull(fromGlobalEventOrder, "No fromGlobalEventOrder provided");
        checkArgument(batchSize > 0, "batchSize must be > 0");
        return withHandle(handle -> handle.createQuery("SELECT * FROM " + configuration.eventsTableName +
                                                               " WHERE global_order >= :fromGlobalOrder ORDER BY global_order ASC LIMIT :batchSize")
                                          .bind("fromGlobalOrder", fromGlobalEventOrder.longValue())
                                          .bind("batchSize", batchSize)
                                          .map(rowMapper)
                                          .list());
    }

    @Override
    public List<PersistedEvent> readAll(TenantId tenantId, GlobalEventOrder fromGlobalEventOrder, int batchSize) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(fromGlobalEventOrder, "No fromGlobalEventOrder provided");
        checkArgument(batchSize > 0, "batchSize must be > 0");
        return withHandle(handle -> handle.createQuery("SELECT * FROM " + configuration.eventsTableName +
                                                               " WHERE tenant_id = :tenantId AND global_order >= :fromGlobalOrder" +
                                                               " ORDER BY global_order ASC LIMIT :batchSize")
                                          .bind("tenantId", tenantId.toString())
                                          .bind("fromGlobalOrder", fromGlobalEventOrder.longValue())
                                          .bind("batchSize", batchSize)
                                          .map(rowMapper)
                                          .list());
    }

    @Override
    public GlobalEventOrder headPosition(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return GlobalEventOrder.of(withHandle(handle -> handle.createQuery("SELECT COALESCE(MAX(global_order), 0) FROM " + configuration.eventsTableName +
                                                                                   " WHERE tenant_id = :tenantId")
                                                              .bind("tenantId", tenantId.toString())
                                                              .mapTo(Long.class)
                                                              .one()));
    }

    @Override
    public Flux<PersistedEvent> committedEvents() {
        return committedEvents.flux();
    }

    @Override
    public EventTypeRegistry eventTypes() {
        return eventTypeRegistry;
    }

    private <R> R withHandle(Function<Handle, R> function) {
        var unitOfWork = unitOfWorkFactory.getCurrentUnitOfWork();
        if (unitOfWork.isPresent()) {
            return function.apply(unitOfWork.get().handle());
        }
        return unitOfWorkFactory.withUnitOfWork(newUnitOfWork -> function.apply(newUnitOfWork.handle()));
    }
}
