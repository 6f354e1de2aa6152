package dk.cloudcreate.bookstore.aggregates;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.slf4j.*;

import java.util.*;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Folds the events of a stream, strictly in version order, into the state of a single aggregate instance.<br>
 * Rehydration is side effect free. An event whose type isn't registered, or isn't part of the aggregate's event family,
 * fails with an {@link UnknownEventTypeException}; a version gap fails with a {@link StreamIntegrityException}.
 */
public class AggregateRehydrator {
    private static final Logger log = LoggerFactory.getLogger(AggregateRehydrator.class);

    private final EventStore eventStore;

    public AggregateRehydrator(EventStore eventStore) {
        this.eventStore = checkNotNull(eventStore, "No eventStore provided");
    }

    /**
     * @return the current state, or {@link Optional#empty()} if the stream doesn't exist
     */
    public <STATE, EVENT> Optional<AggregateSnapshot<STATE>> rehydrate(TenantId tenantId, StreamId streamId, AggregateDefinition<STATE, EVENT> definition) {
        return rehydrate(tenantId, streamId, definition, Optional.empty());
    }

    /**
     * Rehydrate the aggregate as it was at <code>asOfVersion</code> (time travel) or, if no version is given, its current state.
     * If <code>asOfVersion</code> is beyond the end of the stream the current state is returned
     *
     * @return the state, or {@link Optional#empty()} if the stream doesn't exist
     */
    public <STATE, EVENT> Optional<AggregateSnapshot<STATE>> rehydrate(TenantId tenantId,
                                                                      StreamId streamId,
                                                                      AggregateDefinition<STATE, EVENT> definition,
                                                                      Optional<StreamVersion> asOfVersion) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(streamId, "No streamId provided");
        checkNotNull(definition, "No definition provided");
        checkNotNull(asOfVersion, "No asOfVersion option provided");
        asOfVersion.ifPresent(version -> checkArgument(!version.isNewStream(), "asOfVersion must be %s or higher", StreamVersion.FIRST_VERSION));

        var events = eventStore.readStream(tenantId, streamId);
        if (events.isEmpty()) {
            log.trace("[{}:{}] Didn't find a {}", tenantId, streamId, definition.aggregateName());
            return Optional.empty();
        }
        var snapshot = fold(tenantId, streamId, definition, events, asOfVersion);
        log.trace("[{}:{}] Rehydrated {} at version {}", tenantId, streamId, definition.aggregateName(), snapshot.version);
        return Optional.of(snapshot);
    }

    /**
     * @throws AggregateNotFoundException if the stream doesn't exist
     */
    public <STATE, EVENT> AggregateSnapshot<STATE> load(TenantId tenantId, StreamId streamId, AggregateDefinition<STATE, EVENT> definition) {
        return rehydrate(tenantId, streamId, definition).orElseThrow(() -> new AggregateNotFoundException(tenantId, streamId, definition.aggregateName()));
    }

    /**
     * Fold already read events. <code>events</code> must be the complete stream (or its prefix) ordered by version
     */
    public static <STATE, EVENT> AggregateSnapshot<STATE> fold(TenantId tenantId,
                                                                StreamId streamId,
                                                                AggregateDefinition<STATE, EVENT> definition,
                                                                List<PersistedEvent> events,
                                                                Optional<StreamVersion> asOfVersion) {
        checkArgument(!events.isEmpty(), "Cannot fold an empty stream");
        var state           = checkNotNull(definition.initialState(streamId), "%s initialState returned null", definition.aggregateName());
        var expectedVersion = StreamVersion.FIRST_VERSION;
        var version         = StreamVersion.NEW_STREAM;
        for (var persistedEvent : events) {
            if (asOfVersion.isPresent() && persistedEvent.version().isGreaterThan(asOfVersion.get())) {
                break;
            }
            if (!persistedEvent.version().equals(expectedVersion)) {
                log.error("[{}:{}] Version gap in {} stream: expected {} but found {}",
                          tenantId, streamId, definition.aggregateName(), expectedVersion, persistedEvent.version());
                throw new StreamIntegrityException(tenantId, streamId, expectedVersion, persistedEvent.version());
            }
            var event = persistedEvent.event();
            if (!definition.eventFamily().isInstance(event)) {
                throw new UnknownEventTypeException(persistedEvent.eventType(),
                                                    lenientFormat("[%s:%s] EventType '%s' (version %s) isn't part of the %s event family",
                                                                  tenantId, streamId, persistedEvent.eventType(), persistedEvent.version(), definition.aggregateName()));
            }
            state = checkNotNull(definition.apply(state, definition.eventFamily().cast(event)),
                                 "%s apply returned null for %s", definition.aggregateName(), persistedEvent.eventType());
            version = persistedEvent.version();
            expectedVersion = expectedVersion.increment();
        }
        return new AggregateSnapshot<>(tenantId, streamId, state, version);
    }
}
