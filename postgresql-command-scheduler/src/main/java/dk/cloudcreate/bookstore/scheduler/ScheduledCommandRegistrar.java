package dk.cloudcreate.bookstore.scheduler;

import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JSONSerializer;
import dk.cloudcreate.bookstore.scheduler.store.ScheduledCommandStore;
import org.slf4j.*;

import java.time.*;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link DeferredCommandRegistrar} that persists each {@link DeferredCommand} as a {@link ScheduledCommand} for the
 * {@link CommandScheduler} to dispatch.<br>
 * Registering an idempotency key that already exists for the tenant is ignored. If the caller has an active unit of work (as the
 * {@link CommandBus} has when appending the events that caused the registration) the registration is part of it.
 */
public class ScheduledCommandRegistrar implements DeferredCommandRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ScheduledCommandRegistrar.class);

    private final ScheduledCommandStore store;
    private final JSONSerializer        jsonSerializer;
    private final Clock                 clock;

    public ScheduledCommandRegistrar(ScheduledCommandStore store, JSONSerializer jsonSerializer, Clock clock) {
        this.store = checkNotNull(store, "No store provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.clock = checkNotNull(clock, "No clock provided");
    }

    @Override
    public void register(TenantId tenantId, DeferredCommand deferredCommand, CorrelationId correlationId, Optional<EventId> causationId) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(deferredCommand, "No deferredCommand provided");
        checkNotNull(correlationId, "No correlationId provided");
        checkNotNull(causationId, "No causationId option provided");
        var scheduledCommand = ScheduledCommand.pending(tenantId,
                                                        deferredCommand.idempotencyKey,
                                                        deferredCommand.command.getClass().getName(),
                                                        jsonSerializer.serialize(deferredCommand.command),
                                                        deferredCommand.dueAt.withOffsetSameInstant(ZoneOffset.UTC),
                                                        correlationId,
                                                        causationId,
                                                        OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
        if (store.register(scheduledCommand)) {
            log.debug("[{}:{}] Registered {} due at {}", tenantId, deferredCommand.idempotencyKey, scheduledCommand.commandType, scheduledCommand.dueAt);
        } else {
            log.debug("[{}:{}] Ignoring duplicate registration of {}", tenantId, deferredCommand.idempotencyKey, scheduledCommand.commandType);
        }
    }
}
