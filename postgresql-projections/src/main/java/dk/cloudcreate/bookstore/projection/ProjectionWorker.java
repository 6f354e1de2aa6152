package dk.cloudcreate.bookstore.projection;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.bookstore.common.Lifecycle;
import dk.cloudcreate.bookstore.common.tenant.TenantContext;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JSONSerializer;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.store.ProjectionStore;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs one {@link Projection} for one tenant on a dedicated thread.<br>
 * The worker polls the tenant's events after its checkpoint, applies them in global order and commits the resulting
 * document writes together with the new checkpoint. {@link #wakeUp()} triggers an immediate poll (multiple wake ups
 * collapse into one).<br>
 * An event that fails to apply halts the worker: the events before it are committed, the error is persisted and nothing
 * more is processed until {@link #resume()} or {@link #triggerRebuild()} is called.
 */
public class ProjectionWorker implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(ProjectionWorker.class);

    private final Projection                    projection;
    private final TenantId                      tenantId;
    private final EventStore                    eventStore;
    private final ProjectionStore               projectionStore;
    private final JSONSerializer                jsonSerializer;
    private final ProjectionCommitListener      commitListener;
    private final ProjectionEngineConfiguration configuration;
    private final AtomicBoolean                 wakeUpPending    = new AtomicBoolean();
    private final AtomicBoolean                 rebuildRequested = new AtomicBoolean();

    private volatile ScheduledExecutorService executor;
    private volatile boolean                  started;
    private volatile ProjectionStatus         status = ProjectionStatus.STOPPED;
    private volatile String                   lastError;

    public ProjectionWorker(Projection projection,
                            TenantId tenantId,
                            EventStore eventStore,
                            ProjectionStore projectionStore,
                            JSONSerializer jsonSerializer,
                            ProjectionCommitListener commitListener,
                            ProjectionEngineConfiguration configuration) {
        this.projection = checkNotNull(projection, "No projection provided");
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.eventStore = checkNotNull(eventStore, "No eventStore provided");
        this.projectionStore = checkNotNull(projectionStore, "No projectionStore provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.commitListener = checkNotNull(commitListener, "No commitListener provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.debug("[{}:{}] Projection worker was already started", projection.name(), tenantId);
            return;
        }
        var checkpoint = projectionStore.checkpoint(projection.name(), tenantId);
        if (checkpoint.isHalted()) {
            lastError = checkpoint.haltedError.get();
            status = ProjectionStatus.HALTED;
            log.warn("[{}:{}] Starting halted projection. Error: {}", projection.name(), tenantId, lastError);
        } else {
            status = ProjectionStatus.CATCHING_UP;
        }
        if (checkpoint.isRebuilding()) {
            log.info("[{}:{}] Restarting interrupted rebuild of generation {}", projection.name(), tenantId, checkpoint.rebuildGeneration.get());
            rebuildRequested.set(true);
        }
        executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder().setNameFormat("Projection-" + projection.name() + "-" + tenantId + "-%d")
                                                                                        .setDaemon(true)
                                                                                        .build());
        started = true;
        executor.scheduleWithFixedDelay(this::poll,
                                        0,
                                        configuration.pollingInterval.toMillis(),
                                        TimeUnit.MILLISECONDS);
        log.info("[{}:{}] Started projection worker from checkpoint {}", projection.name(), tenantId, checkpoint.checkpoint);
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            log.debug("[{}:{}] Projection worker was already stopped", projection.name(), tenantId);
            return;
        }
        started = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(configuration.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[{}:{}] Projection worker didn't stop within {}, interrupting it", projection.name(), tenantId, configuration.shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (status != ProjectionStatus.HALTED) {
            status = ProjectionStatus.STOPPED;
        }
        log.info("[{}:{}] Stopped projection worker", projection.name(), tenantId);
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    /**
     * Request an immediate poll. Calls made while a wake up is pending are collapsed
     */
    public void wakeUp() {
        var currentExecutor = executor;
        if (!started || currentExecutor == null || !wakeUpPending.compareAndSet(false, true)) {
            return;
        }
        try {
            currentExecutor.execute(() -> {
                wakeUpPending.set(false);
                poll();
            });
        } catch (RejectedExecutionException e) {
            wakeUpPending.set(false);
            log.trace("[{}:{}] Ignoring wake up, the worker is stopping", projection.name(), tenantId);
        }
    }

    /**
     * Request a full rebuild. Queries keep reading the current generation until the rebuilt generation replaces it.
     * A halted projection is un-halted by a rebuild
     */
    public void triggerRebuild() {
        log.info("[{}:{}] Rebuild requested", projection.name(), tenantId);
        rebuildRequested.set(true);
        if (status == ProjectionStatus.HALTED) {
            projectionStore.clearHalt(projection.name(), tenantId);
            lastError = null;
            status = ProjectionStatus.REBUILDING;
        }
        wakeUp();
    }

    /**
     * Clear a halt and retry the failing event
     */
    public void resume() {
        if (status != ProjectionStatus.HALTED) {
            log.debug("[{}:{}] Projection isn't halted, ignoring resume", projection.name(), tenantId);
            return;
        }
        log.info("[{}:{}] Resuming halted projection", projection.name(), tenantId);
        projectionStore.clearHalt(projection.name(), tenantId);
        if (projectionStore.checkpoint(projection.name(), tenantId).isRebuilding()) {
            rebuildRequested.set(true);
        }
        lastError = null;
        status = ProjectionStatus.CATCHING_UP;
        wakeUp();
    }

    public Projection projection() {
        return projection;
    }

    public TenantId tenantId() {
        return tenantId;
    }

    public ProjectionStatus status() {
        return status;
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * @return the highest {@link GlobalEventOrder} applied to the generation queries read from
     */
    public GlobalEventOrder checkpoint() {
        return projectionStore.checkpoint(projection.name(), tenantId).checkpoint;
    }

    private void poll() {
        if (!started || status == ProjectionStatus.HALTED) {
            return;
        }
        try (var ignored = TenantContext.open(tenantId)) {
            if (rebuildRequested.getAndSet(false)) {
                rebuild();
            }
            catchUp();
        } catch (Exception e) {
            log.error("[{}:{}] Error polling for events, will retry on the next poll", projection.name(), tenantId, e);
        }
    }

    private void catchUp() {
        while (started && status != ProjectionStatus.HALTED && !rebuildRequested.get()) {
            var checkpoint = projectionStore.checkpoint(projection.name(), tenantId);
            var events     = eventStore.readAll(tenantId, checkpoint.checkpoint.increment(), configuration.batchSize);
            if (events.isEmpty()) {
                status = ProjectionStatus.LIVE;
                return;
            }
            if (events.size() == configuration.batchSize) {
                status = ProjectionStatus.CATCHING_UP;
            }
            log.trace("[{}:{}] Applying {} event(s) after checkpoint {}", projection.name(), tenantId, events.size(), checkpoint.checkpoint);
            if (!applyBatch(events, checkpoint.activeGeneration, false)) {
                return;
            }
            if (events.size() < configuration.batchSize) {
                status = ProjectionStatus.LIVE;
                return;
            }
        }
    }

    private void rebuild() {
        status = ProjectionStatus.REBUILDING;
        var generation = projectionStore.beginRebuild(projection.name(), tenantId);
        log.info("[{}:{}] Rebuilding into generation {}", projection.name(), tenantId, generation);
        var position       = GlobalEventOrder.FIRST_GLOBAL_EVENT_ORDER;
        var numberOfEvents = 0L;
        while (started) {
            var events = eventStore.readAll(tenantId, position, configuration.batchSize);
            if (events.isEmpty()) {
                projectionStore.completeRebuild(projection.name(), tenantId, generation);
                status = ProjectionStatus.CATCHING_UP;
                log.info("[{}:{}] Completed rebuild of generation {} after {} event(s)", projection.name(), tenantId, generation, numberOfEvents);
                try {
                    commitListener.onRebuildCompleted(projection.name(), tenantId);
                } catch (RuntimeException e) {
                    log.error("[{}:{}] Rebuild completion listener failed", projection.name(), tenantId, e);
                }
                return;
            }
            if (!applyBatch(events, generation, true)) {
                return;
            }
            numberOfEvents += events.size();
            position = events.get(events.size() - 1).globalEventOrder().increment();
        }
        log.info("[{}:{}] Rebuild of generation {} interrupted by stop, it restarts on the next start", projection.name(), tenantId, generation);
    }

    /**
     * @return false if the projection halted
     */
    private boolean applyBatch(List<PersistedEvent> events, int generation, boolean rebuilding) {
        var                      session     = new ProjectionSession(projectionStore, projection.name(), tenantId, generation, jsonSerializer);
        GlobalEventOrder         lastApplied = null;
        ProjectionApplyException failure     = null;
        for (var event : events) {
            if (!event.eventJSON().isKnownEventType()) {
                log.warn("[{}:{}] Skipping event with unknown type '{}' at global order {}", projection.name(), tenantId, event.eventType(), event.globalEventOrder());
                lastApplied = event.globalEventOrder();
                continue;
            }
            session.beginEvent(event);
            try {
                var payload = event.event();
                if (projection.handles(payload)) {
                    projection.apply(event, session);
                } else {
                    log.trace("[{}:{}] Projection doesn't handle '{}'", projection.name(), tenantId, event.eventType());
                }
                session.completeEvent();
                lastApplied = event.globalEventOrder();
            } catch (RuntimeException e) {
                session.discardEvent();
                failure = new ProjectionApplyException(projection.name(), tenantId, event, e);
                break;
            }
        }

        if (lastApplied != null) {
            projectionStore.commit(projection.name(), tenantId, generation, session.writes(), lastApplied);
            if (!rebuilding) {
                var changes = session.changes();
                if (!changes.isEmpty()) {
                    notifyCommitted(changes);
                }
            }
        }
        if (failure != null) {
            halt(failure);
            return false;
        }
        return true;
    }

    private void notifyCommitted(List<DocumentChange> changes) {
        try {
            commitListener.onCommitted(projection.name(), tenantId, changes);
        } catch (RuntimeException e) {
            log.error("[{}:{}] Commit listener failed for {} change(s)", projection.name(), tenantId, changes.size(), e);
        }
    }

    private void halt(ProjectionApplyException failure) {
        log.error("[{}:{}] Halting projection", projection.name(), tenantId, failure);
        lastError = failure.getMessage();
        status = ProjectionStatus.HALTED;
        projectionStore.halt(projection.name(), tenantId, failure.getMessage());
    }

    @Override
    public String toString() {
        return "ProjectionWorker{" + projection.name() + ":" + tenantId + ", status=" + status + '}';
    }
}
