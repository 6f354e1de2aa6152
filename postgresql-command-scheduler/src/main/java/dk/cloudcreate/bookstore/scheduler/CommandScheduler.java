package dk.cloudcreate.bookstore.scheduler;

import com.google.common.util.concurrent.*;
import dk.cloudcreate.bookstore.aggregates.*;
import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.common.Lifecycle;
import dk.cloudcreate.bookstore.common.tenant.*;
import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.serializer.json.*;
import dk.cloudcreate.bookstore.scheduler.store.ScheduledCommandStore;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.Lock;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Dispatches the {@link ScheduledCommand}'s registered by the {@link ScheduledCommandRegistrar} through the {@link CommandBus}
 * at or after their due time.<br>
 * <br>
 * A single poller claims due entries from the {@link ScheduledCommandStore} and hands them to a pool of
 * {@link CommandSchedulerConfiguration#parallelDispatchers} dispatchers. Commands targeting different streams are dispatched in
 * parallel, commands targeting the same stream are dispatched one at a time in due order.<br>
 * Delivery is at-least-once: a claim that isn't completed within {@link CommandSchedulerConfiguration#claimTimeout} (e.g. because
 * the process died) is claimed again, so the scheduled commands must be idempotent.<br>
 * <br>
 * A transient dispatch failure is redelivered according to the {@link RedeliveryPolicy}. A permanent failure, or a transient
 * failure that exhausted the redeliveries, marks the entry {@link ScheduledCommandStatus#FAILED}.
 */
public class CommandScheduler implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(CommandScheduler.class);

    private final ScheduledCommandStore         store;
    private final CommandBus                    commandBus;
    private final JSONSerializer                jsonSerializer;
    private final CommandSchedulerConfiguration configuration;
    private final Clock                         clock;
    private final Striped<Lock>                 streamLocks;

    private volatile boolean                  started;
    private          ScheduledExecutorService pollingExecutor;
    private          ExecutorService          dispatchExecutor;

    public CommandScheduler(ScheduledCommandStore store, CommandBus commandBus, JSONSerializer jsonSerializer) {
        this(store, commandBus, jsonSerializer, CommandSchedulerConfiguration.DEFAULT, Clock.systemUTC());
    }

    public CommandScheduler(ScheduledCommandStore store,
                            CommandBus commandBus,
                            JSONSerializer jsonSerializer,
                            CommandSchedulerConfiguration configuration,
                            Clock clock) {
        this.store = checkNotNull(store, "No store provided");
        this.commandBus = checkNotNull(commandBus, "No commandBus provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
        this.clock = checkNotNull(clock, "No clock provided");
        this.streamLocks = Striped.lazyWeakLock(configuration.parallelDispatchers * 16);
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.debug("CommandScheduler was already started");
            return;
        }
        dispatchExecutor = Executors.newFixedThreadPool(configuration.parallelDispatchers,
                                                        new ThreadFactoryBuilder().setNameFormat("CommandScheduler-Dispatcher-%d")
                                                                                  .setDaemon(true)
                                                                                  .build());
        pollingExecutor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder().setNameFormat("CommandScheduler-Polling-%d")
                                                                                               .setDaemon(true)
                                                                                               .build());
        started = true;
        pollingExecutor.scheduleWithFixedDelay(this::pollDueSafely,
                                               0,
                                               configuration.pollingInterval.toMillis(),
                                               TimeUnit.MILLISECONDS);
        log.info("Started CommandScheduler with {}", configuration);
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            log.debug("CommandScheduler was already stopped");
            return;
        }
        started = false;
        shutdown(pollingExecutor, "polling");
        shutdown(dispatchExecutor, "dispatch");
        pollingExecutor = null;
        dispatchExecutor = null;
        log.info("Stopped CommandScheduler");
    }

    private void shutdown(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(configuration.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("CommandScheduler {} executor didn't stop within {}, interrupting it", name, configuration.shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    public Optional<ScheduledCommand> find(TenantId tenantId, String idempotencyKey) {
        return store.find(tenantId, idempotencyKey);
    }

    public List<ScheduledCommand> findAll(TenantId tenantId) {
        return store.findAll(tenantId);
    }

    private void pollDueSafely() {
        try {
            var dispatched = pollDue();
            if (dispatched > 0) {
                log.debug("Processed {} due scheduled command(s)", dispatched);
            }
        } catch (Exception e) {
            log.error("Failed to poll due scheduled commands", e);
        }
    }

    /**
     * Claim the commands that are due now and dispatch them. Called by the background poller, but may be called directly
     * (e.g. from tests or an admin operation). When the scheduler isn't started the dispatch happens on the calling thread
     *
     * @return the number of claimed commands that were processed (executed, rescheduled or failed)
     */
    public int pollDue() {
        var now     = now();
        var claimed = store.claimDue(now, now.minus(configuration.claimTimeout), configuration.batchSize);
        if (claimed.isEmpty()) {
            return 0;
        }
        log.trace("Claimed {} due scheduled command(s)", claimed.size());

        var commandsPerStream = new LinkedHashMap<String, List<ResolvedCommand>>();
        for (var scheduledCommand : claimed) {
            Command command;
            try {
                command = resolveCommand(scheduledCommand);
            } catch (RuntimeException e) {
                handleFailure(scheduledCommand, e);
                continue;
            }
            commandsPerStream.computeIfAbsent(scheduledCommand.tenantId + "|" + command.streamId(), key -> new ArrayList<>())
                             .add(new ResolvedCommand(scheduledCommand, command));
        }

        var executor = started ? dispatchExecutor : null;
        if (executor == null) {
            commandsPerStream.forEach(this::dispatchInOrder);
            return claimed.size();
        }
        var futures = new ArrayList<Future<?>>(commandsPerStream.size());
        commandsPerStream.forEach((streamKey, commands) -> futures.add(executor.submit(() -> dispatchInOrder(streamKey, commands))));
        for (var future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ScheduledCommandException("Interrupted while waiting for scheduled command dispatches", e);
            } catch (ExecutionException e) {
                log.error("Scheduled command dispatch failed unexpectedly", e.getCause());
            }
        }
        return claimed.size();
    }

    private void dispatchInOrder(String streamKey, List<ResolvedCommand> commands) {
        var lock = streamLocks.get(streamKey);
        lock.lock();
        try {
            commands.forEach(this::dispatch);
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(ResolvedCommand resolvedCommand) {
        var scheduledCommand = resolvedCommand.scheduledCommand;
        try (var scope = TenantContext.open(scheduledCommand.tenantId, scheduledCommand.correlationId)) {
            var envelope = CommandEnvelope.builder(scheduledCommand.tenantId, resolvedCommand.command)
                                          .correlationId(scheduledCommand.correlationId);
            scheduledCommand.causationId.ifPresent(envelope::causationId);
            CommandResult result;
            try {
                result = commandBus.submit(envelope.build());
            } catch (RuntimeException e) {
                handleFailure(scheduledCommand, e);
                return;
            }
            store.markExecuted(scheduledCommand.id, now());
            log.debug("[{}:{}] Dispatched {} (attempt {}) with outcome {} at version {}",
                      scheduledCommand.tenantId, scheduledCommand.idempotencyKey, resolvedCommand.command.getClass().getSimpleName(),
                      scheduledCommand.dispatchAttempts, result.outcome, result.version);
        }
    }

    private Command resolveCommand(ScheduledCommand scheduledCommand) {
        Class<?> commandType;
        try {
            commandType = Class.forName(scheduledCommand.commandType);
        } catch (ClassNotFoundException e) {
            throw new ScheduledCommandException(lenientFormat("Unknown command type '%s'", scheduledCommand.commandType), e);
        }
        if (!Command.class.isAssignableFrom(commandType)) {
            throw new ScheduledCommandException(lenientFormat("'%s' isn't a %s", scheduledCommand.commandType, Command.class.getSimpleName()));
        }
        return (Command) jsonSerializer.deserialize(scheduledCommand.commandJson, commandType);
    }

    private void handleFailure(ScheduledCommand scheduledCommand, RuntimeException cause) {
        var permanent = isPermanentFailure(cause);
        var failure   = new SchedulerDispatchException(scheduledCommand, permanent, cause);
        var now       = now();
        var policy    = configuration.redeliveryPolicy;
        if (permanent) {
            log.error("[{}:{}] Marking scheduled command as failed: {}", scheduledCommand.tenantId, scheduledCommand.idempotencyKey, failure.getMessage(), cause);
            store.markFailed(scheduledCommand.id, now, failure.getMessage());
        } else if (policy.isExhausted(scheduledCommand.dispatchAttempts)) {
            log.error("[{}:{}] Marking scheduled command as failed after {} dispatch attempts: {}",
                      scheduledCommand.tenantId, scheduledCommand.idempotencyKey, scheduledCommand.dispatchAttempts, failure.getMessage(), cause);
            store.markFailed(scheduledCommand.id, now, failure.getMessage());
        } else {
            var nextDueAt = now.plus(policy.calculateNextRedeliveryDelay(scheduledCommand.dispatchAttempts - 1));
            log.warn("[{}:{}] Redelivering scheduled command at {} (dispatch attempt {} of {}): {}",
                     scheduledCommand.tenantId, scheduledCommand.idempotencyKey, nextDueAt, scheduledCommand.dispatchAttempts,
                     policy.maximumNumberOfRedeliveries + 1, failure.getMessage());
            store.reschedule(scheduledCommand.id, nextDueAt, failure.getMessage());
        }
    }

    /**
     * Failures that will fail the same way when redelivered
     */
    static boolean isPermanentFailure(Throwable failure) {
        if (CommandFailures.isRetryable(failure)) {
            return false;
        }
        return failure instanceof ValidationFailedException
                || failure instanceof UnknownCommandException
                || failure instanceof PreconditionFailedException
                || failure instanceof PreconditionRequiredException
                || failure instanceof AggregateNotFoundException
                || failure instanceof StreamIntegrityException
                || failure instanceof StreamCollisionException
                || failure instanceof UnknownEventTypeException
                || failure instanceof TenantException
                || failure instanceof JSONDeserializationException
                || failure instanceof ScheduledCommandException;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private static final class ResolvedCommand {
        private final ScheduledCommand scheduledCommand;
        private final Command          command;

        private ResolvedCommand(ScheduledCommand scheduledCommand, Command command) {
            this.scheduledCommand = scheduledCommand;
            this.command = command;
        }
    }
}
