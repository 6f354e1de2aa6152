package dk.cloudcreate.bookstore.projection;

import dk.cloudcreate.bookstore.common.Lifecycle;
import dk.cloudcreate.bookstore.common.tenant.TenantRegistry;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JSONSerializer;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.store.ProjectionStore;
import org.slf4j.*;
import reactor.core.Disposable;

import java.util.*;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.*;

/**
 * Runs every registered {@link Projection} for every registered tenant, one {@link ProjectionWorker} per projection and tenant.<br>
 * Workers poll the event store and are woken up by {@link EventStore#committedEvents()}, so a committed event normally reaches
 * the read models without waiting for the polling interval. Tenants registered after start are picked up by {@link #addTenant(TenantId)},
 * or automatically when the first event of a registered tenant is committed.<br>
 * A failure in one projection or tenant never affects the others.
 */
public class ProjectionEngine implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(ProjectionEngine.class);

    private final EventStore                               eventStore;
    private final ProjectionStore                          projectionStore;
    private final Map<ProjectionName, Projection>          projections;
    private final TenantRegistry                           tenantRegistry;
    private final ProjectionCommitListener                 commitListener;
    private final JSONSerializer                           jsonSerializer;
    private final ProjectionEngineConfiguration            configuration;
    private final ConcurrentMap<String, ProjectionWorker>  workers = new ConcurrentHashMap<>();
    private final Set<TenantId>                            tenants = ConcurrentHashMap.newKeySet();

    private volatile boolean    started;
    private          Disposable committedEventsSubscription;

    public ProjectionEngine(EventStore eventStore,
                            ProjectionStore projectionStore,
                            List<? extends Projection> projections,
                            TenantRegistry tenantRegistry,
                            ProjectionCommitListener commitListener,
                            JSONSerializer jsonSerializer,
                            ProjectionEngineConfiguration configuration) {
        this.eventStore = checkNotNull(eventStore, "No eventStore provided");
        this.projectionStore = checkNotNull(projectionStore, "No projectionStore provided");
        this.tenantRegistry = checkNotNull(tenantRegistry, "No tenantRegistry provided");
        this.commitListener = checkNotNull(commitListener, "No commitListener provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
        checkNotNull(projections, "No projections provided");
        this.projections = new LinkedHashMap<>();
        for (var projection : projections) {
            checkArgument(this.projections.put(projection.name(), projection) == null, "Duplicate projection name '%s'", projection.name());
        }
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.debug("ProjectionEngine was already started");
            return;
        }
        started = true;
        log.info("Starting ProjectionEngine with projections {} and {}", projections.keySet(), configuration);
        committedEventsSubscription = eventStore.committedEvents()
                                                .subscribe(this::onEventCommitted,
                                                           error -> log.error("Committed events subscription failed, relying on polling", error));
        tenantRegistry.registeredTenants().forEach(this::addTenant);
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            log.debug("ProjectionEngine was already stopped");
            return;
        }
        started = false;
        if (committedEventsSubscription != null) {
            committedEventsSubscription.dispose();
            committedEventsSubscription = null;
        }
        workers.values().forEach(ProjectionWorker::stop);
        log.info("Stopped ProjectionEngine");
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    /**
     * Start the workers of every projection for the tenant (no-op for a tenant that already has workers)
     */
    public void addTenant(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        checkArgument(!tenantId.isSystemTenant(), "Projections don't run for the system tenant");
        if (tenants.add(tenantId)) {
            log.info("Adding projection workers for tenant '{}'", tenantId);
        }
        for (var projection : projections.values()) {
            var worker = workers.computeIfAbsent(workerKey(projection.name(), tenantId),
                                                 key -> new ProjectionWorker(projection,
                                                                             tenantId,
                                                                             eventStore,
                                                                             projectionStore,
                                                                             jsonSerializer,
                                                                             commitListener,
                                                                             configuration));
            if (started) {
                worker.start();
            }
        }
    }

    public Set<TenantId> tenants() {
        return Set.copyOf(tenants);
    }

    public Collection<Projection> projections() {
        return Collections.unmodifiableCollection(projections.values());
    }

    public ProjectionStatus getStatus(ProjectionName projectionName, TenantId tenantId) {
        return worker(projectionName, tenantId).status();
    }

    public GlobalEventOrder getCheckpoint(ProjectionName projectionName, TenantId tenantId) {
        return worker(projectionName, tenantId).checkpoint();
    }

    public Optional<String> getLastError(ProjectionName projectionName, TenantId tenantId) {
        return worker(projectionName, tenantId).lastError();
    }

    public void triggerRebuild(ProjectionName projectionName, TenantId tenantId) {
        worker(projectionName, tenantId).triggerRebuild();
    }

    public void resume(ProjectionName projectionName, TenantId tenantId) {
        worker(projectionName, tenantId).resume();
    }

    /**
     * Wake up every worker of the tenant
     */
    public void wakeUp(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        for (var projectionName : projections.keySet()) {
            var worker = workers.get(workerKey(projectionName, tenantId));
            if (worker != null) {
                worker.wakeUp();
            }
        }
    }

    private void onEventCommitted(PersistedEvent event) {
        var tenantId = event.tenantId();
        if (tenantId.isSystemTenant() || !started) {
            return;
        }
        if (!tenants.contains(tenantId)) {
            if (!tenantRegistry.isValid(tenantId)) {
                log.warn("Ignoring committed event for unregistered tenant '{}'", tenantId);
                return;
            }
            addTenant(tenantId);
        }
        wakeUp(tenantId);
    }

    private ProjectionWorker worker(ProjectionName projectionName, TenantId tenantId) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        checkArgument(projections.containsKey(projectionName), "Unknown projection '%s'", projectionName);
        var worker = workers.get(workerKey(projectionName, tenantId));
        checkArgument(worker != null, "Tenant '%s' has no projection workers", tenantId);
        return worker;
    }

    private static String workerKey(ProjectionName projectionName, TenantId tenantId) {
        return projectionName + "|" + tenantId;
    }
}
