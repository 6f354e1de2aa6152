package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.aggregates.*;
import dk.cloudcreate.bookstore.common.tenant.TenantContext;
import dk.cloudcreate.bookstore.common.transaction.UnitOfWorkFactory;
import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Executes commands: resolves the handler from the {@link CommandHandlerRegistry}, rehydrates the targeted aggregate,
 * checks the caller's ETag, lets the pure {@link CommandHandler} decide and appends the resulting events with the rehydrated
 * version as expected version.<br>
 * <br>
 * Failure handling:
 * <ul>
 *     <li>ETag mismatch, before or during the append: {@link PreconditionFailedException}</li>
 *     <li>Required but missing ETag: {@link PreconditionRequiredException}</li>
 *     <li>{@link ConcurrencyConflictException} without an ETag: the command is re-executed against freshly read state,
 *     at most {@link CommandBusConfiguration#maxConflictRetries} times</li>
 *     <li>{@link AppendToStreamException}: retried with backoff, at most {@link CommandBusConfiguration#maxTransientRetries} times</li>
 *     <li>Deadline passed before the append: {@link CommandTimeoutException}</li>
 * </ul>
 * {@link DeferredCommand}'s returned by a handler are registered through the {@link DeferredCommandRegistrar}. If a
 * {@link UnitOfWorkFactory} is configured the append and the registrations share one unit of work.<br>
 * Submit commands outside of an active unit of work: a conflict marks a joined unit of work rollback only, which makes a retry within it pointless.
 */
public class CommandBus {
    private static final Logger log = LoggerFactory.getLogger(CommandBus.class);

    public static final String STREAM_ID_MDC_KEY = "streamId";

    private final EventStore                     eventStore;
    private final AggregateRehydrator            rehydrator;
    private final CommandHandlerRegistry         registry;
    private final DeferredCommandRegistrar       deferredCommandRegistrar;
    private final Optional<UnitOfWorkFactory<?>> unitOfWorkFactory;
    private final CommandBusConfiguration        configuration;
    private final Clock                          clock;

    public CommandBus(EventStore eventStore, CommandHandlerRegistry registry) {
        this(eventStore, registry, DeferredCommandRegistrar.NONE, Optional.empty(), CommandBusConfiguration.DEFAULT, Clock.systemUTC());
    }

    public CommandBus(EventStore eventStore,
                      CommandHandlerRegistry registry,
                      DeferredCommandRegistrar deferredCommandRegistrar,
                      Optional<UnitOfWorkFactory<?>> unitOfWorkFactory,
                      CommandBusConfiguration configuration,
                      Clock clock) {
        this.eventStore = checkNotNull(eventStore, "No eventStore provided");
        this.registry = checkNotNull(registry, "No registry provided");
        this.deferredCommandRegistrar = checkNotNull(deferredCommandRegistrar, "No deferredCommandRegistrar provided");
        this.unitOfWorkFactory = checkNotNull(unitOfWorkFactory, "No unitOfWorkFactory option provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
        this.clock = checkNotNull(clock, "No clock provided");
        this.rehydrator = new AggregateRehydrator(eventStore);
        log.info("Created CommandBus with {} command handler(s) and {}", registry.commandTypes().size(), configuration);
    }

    public CommandHandlerRegistry registry() {
        return registry;
    }

    public AggregateRehydrator rehydrator() {
        return rehydrator;
    }

    /**
     * Execute the command
     *
     * @return the result including the new ETag
     * @throws ValidationFailedException     if the handler rejected the command
     * @throws PreconditionFailedException   if the supplied ETag doesn't match
     * @throws PreconditionRequiredException if an ETag is required but wasn't supplied
     * @throws ConcurrencyConflictException  if conflicts persisted after the configured retries
     * @throws StreamCollisionException      if a stream creating command raced with another creation of the same stream
     * @throws CommandTimeoutException       if the deadline passed before the append
     * @throws UnknownCommandException       if no handler is registered for the command type
     */
    public CommandResult submit(CommandEnvelope envelope) {
        checkNotNull(envelope, "No envelope provided");
        var registration = registry.registrationFor(envelope.command.getClass());
        try (var scope = TenantContext.open(envelope.tenantId, envelope.correlationId);
             var streamMdc = MDC.putCloseable(STREAM_ID_MDC_KEY, envelope.command.streamId().toString())) {
            return execute(envelope, registration);
        }
    }

    private <COMMAND extends Command, STATE> CommandResult execute(CommandEnvelope envelope, CommandHandlerRegistry.Registration<COMMAND, STATE> registration) {
        var command          = registration.commandType.cast(envelope.command);
        var tenantId         = envelope.tenantId;
        var streamId         = command.streamId();
        var commandName      = command.getClass().getSimpleName();
        var timeout          = envelope.timeout.orElse(configuration.requestTimeout);
        var deadline         = clock.instant().plus(timeout);
        var conflictRetries  = 0;
        var transientRetries = 0;

        while (true) {
            checkDeadline(deadline, commandName, timeout);
            var snapshot = rehydrator.rehydrate(tenantId, streamId, registration.definition);
            checkPreconditions(envelope, tenantId, streamId, snapshot);

            var decision = registration.handler.handle(command, snapshot.map(s -> s.state));
            if (decision.isRejected()) {
                var failure = decision.rejection().get();
                log.debug("[{}:{}] {} rejected: {}", tenantId, streamId, commandName, failure);
                throw new ValidationFailedException(tenantId, streamId, failure);
            }
            var currentVersion = snapshot.map(s -> s.version).orElse(StreamVersion.NEW_STREAM);
            if (decision.isNoChange()) {
                log.debug("[{}:{}] {} resulted in no change at version {}", tenantId, streamId, commandName, currentVersion);
                return new CommandResult(tenantId, streamId, CommandResult.Outcome.NO_CHANGE, currentVersion, List.of(), List.of());
            }

            checkDeadline(deadline, commandName, timeout);
            try {
                var appendResult = appendAndRegister(envelope, streamId, currentVersion, decision);
                log.debug("[{}:{}] {} appended {} event(s) and registered {} deferred command(s), stream is now at version {}",
                          tenantId, streamId, commandName, appendResult.persistedEvents.size(), decision.deferredCommands().size(), appendResult.newVersion);
                return new CommandResult(tenantId, streamId, CommandResult.Outcome.CHANGED, appendResult.newVersion, appendResult.persistedEvents, decision.deferredCommands());
            } catch (ConcurrencyConflictException e) {
                if (envelope.ifMatch.isPresent() && !ETag.ANY.equals(envelope.ifMatch.get())) {
                    log.debug("[{}:{}] {} lost the race for ETag {}", tenantId, streamId, commandName, envelope.ifMatch.get());
                    throw new PreconditionFailedException(tenantId, streamId, envelope.ifMatch.get(), e.actualVersion, e);
                }
                if (conflictRetries >= configuration.maxConflictRetries) {
                    log.warn("[{}:{}] {} gave up after {} concurrency conflict retries", tenantId, streamId, commandName, conflictRetries);
                    throw e;
                }
                conflictRetries++;
                log.debug("[{}:{}] {} hit a concurrency conflict, re-reading the stream (retry {} of {})",
                          tenantId, streamId, commandName, conflictRetries, configuration.maxConflictRetries);
            } catch (AppendToStreamException e) {
                if (transientRetries >= configuration.maxTransientRetries) {
                    log.error("[{}:{}] {} failed after {} transient retries", tenantId, streamId, commandName, transientRetries, e);
                    throw e;
                }
                transientRetries++;
                var backoff = configuration.transientRetryBackoff.multipliedBy(1L << (transientRetries - 1));
                log.warn("[{}:{}] {} hit a transient storage error, retrying in {} (retry {} of {}): {}",
                         tenantId, streamId, commandName, backoff, transientRetries, configuration.maxTransientRetries, e.getMessage());
                sleep(backoff);
            }
        }
    }

    private void checkPreconditions(CommandEnvelope envelope, TenantId tenantId, StreamId streamId, Optional<? extends AggregateSnapshot<?>> snapshot) {
        // A missing stream is at version 0, so only If-Match "0" (or *) holds against it
        var currentVersion = snapshot.map(s -> s.version).orElse(StreamVersion.NEW_STREAM);
        if (envelope.ifMatch.isPresent()) {
            var rawIfMatch = envelope.ifMatch.get();
            if (ETag.ANY.equals(rawIfMatch)) {
                return;
            }
            var matches = ETag.parse(rawIfMatch).map(etag -> etag.matches(currentVersion)).orElse(false);
            if (!matches) {
                log.debug("[{}:{}] ETag mismatch: If-Match {} but current ETag is {}", tenantId, streamId, rawIfMatch, ETag.of(currentVersion));
                throw new PreconditionFailedException(tenantId, streamId, rawIfMatch, Optional.of(currentVersion));
            }
        } else if (snapshot.isPresent() && (envelope.etagRequired || configuration.etagRequired)) {
            // Creation, or a command against a missing stream that the handler reports as NotFound, needs no ETag
            throw new PreconditionRequiredException(tenantId, streamId);
        }
    }

    private AppendResult appendAndRegister(CommandEnvelope envelope, StreamId streamId, StreamVersion expectedVersion, Decision decision) {
        var persistableEvents = decision.events()
                                        .stream()
                                        .map(event -> PersistableEvent.of(event, envelope.correlationId, envelope.causationId))
                                        .collect(Collectors.toList());
        if (unitOfWorkFactory.isPresent()) {
            return unitOfWorkFactory.get().withUnitOfWork(unitOfWork -> {
                var appendResult = eventStore.append(envelope.tenantId, streamId, expectedVersion, persistableEvents);
                registerDeferredCommands(envelope, decision, appendResult);
                return appendResult;
            });
        }
        var appendResult = eventStore.append(envelope.tenantId, streamId, expectedVersion, persistableEvents);
        registerDeferredCommands(envelope, decision, appendResult);
        return appendResult;
    }

    private void registerDeferredCommands(CommandEnvelope envelope, Decision decision, AppendResult appendResult) {
        var causationId = Optional.of(appendResult.persistedEvents.get(0).eventId());
        decision.deferredCommands()
                .forEach(deferredCommand -> deferredCommandRegistrar.register(envelope.tenantId, deferredCommand, envelope.correlationId, causationId));
    }

    private void checkDeadline(Instant deadline, String commandName, Duration timeout) {
        if (clock.instant().isAfter(deadline)) {
            log.warn("{} timed out after {}", commandName, timeout);
            throw new CommandTimeoutException(commandName, timeout);
        }
    }

    private static void sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandException("Interrupted while waiting to retry", e);
        }
    }
}
