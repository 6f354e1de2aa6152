package dk.cloudcreate.bookstore.domain;

import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.common.Lifecycle;
import dk.cloudcreate.bookstore.common.tenant.*;
import dk.cloudcreate.bookstore.common.transaction.*;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.domain.projection.BookStoreProjections;
import dk.cloudcreate.bookstore.domain.query.BookStoreQueries;
import dk.cloudcreate.bookstore.domain.tenant.EventSourcedTenantRegistry;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.bookstore.eventstore.postgresql.*;
import dk.cloudcreate.bookstore.eventstore.serializer.json.*;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.*;
import dk.cloudcreate.bookstore.projection.cache.CaffeineTaggedCache;
import dk.cloudcreate.bookstore.projection.notification.*;
import dk.cloudcreate.bookstore.projection.postcommit.PostCommitCoordinator;
import dk.cloudcreate.bookstore.projection.query.ProjectionQueries;
import dk.cloudcreate.bookstore.projection.store.ProjectionStore;
import dk.cloudcreate.bookstore.projection.store.inmemory.InMemoryProjectionStore;
import dk.cloudcreate.bookstore.projection.store.postgresql.PostgresqlProjectionStore;
import dk.cloudcreate.bookstore.scheduler.*;
import dk.cloudcreate.bookstore.scheduler.store.ScheduledCommandStore;
import dk.cloudcreate.bookstore.scheduler.store.inmemory.InMemoryScheduledCommandStore;
import dk.cloudcreate.bookstore.scheduler.store.postgresql.PostgresqlScheduledCommandStore;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Composition root of the bookstore engine: wires the event store, command bus, command scheduler, projection engine,
 * post commit coordinator, query cache and tenant registry, and exposes the operations offered to the outer layers.<br>
 * <br>
 * Commands submitted through {@link #submit(CommandEnvelope)} are only accepted for registered tenants. Deferred commands
 * are dispatched by the {@link CommandScheduler} and read models are updated asynchronously by the {@link ProjectionEngine}
 * once {@link #start()} has been called.
 */
public class BookStoreEngine implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(BookStoreEngine.class);

    private final EventStore                   eventStore;
    private final CommandBus                   commandBus;
    private final TenantRegistry               tenantRegistry;
    private final TenantResolver               tenantResolver;
    private final ProjectionEngine             projectionEngine;
    private final CommandScheduler             commandScheduler;
    private final PostCommitCoordinator        postCommitCoordinator;
    private final ReactorNotificationPublisher notifications;
    private final BookStoreQueries             queries;
    private final BookStoreEngineConfiguration configuration;

    private volatile boolean started;

    BookStoreEngine(EventStore eventStore,
                    ProjectionStore projectionStore,
                    ScheduledCommandStore scheduledCommandStore,
                    Optional<UnitOfWorkFactory<?>> unitOfWorkFactory,
                    JSONSerializer jsonSerializer,
                    BookStoreEngineConfiguration configuration,
                    Clock clock) {
        this.eventStore = checkNotNull(eventStore, "No eventStore provided");
        checkNotNull(projectionStore, "No projectionStore provided");
        checkNotNull(scheduledCommandStore, "No scheduledCommandStore provided");
        checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
        checkNotNull(clock, "No clock provided");

        commandBus = new CommandBus(eventStore,
                                    BookStoreCommandHandlers.create(),
                                    new ScheduledCommandRegistrar(scheduledCommandStore, jsonSerializer, clock),
                                    unitOfWorkFactory,
                                    configuration.commandBus,
                                    clock);
        tenantRegistry = new CachingTenantRegistry(new EventSourcedTenantRegistry(commandBus, eventStore), configuration.tenantValidity);
        tenantResolver = new TenantResolver(tenantRegistry);
        commandScheduler = new CommandScheduler(scheduledCommandStore, commandBus, jsonSerializer, configuration.commandScheduler, clock);

        var mappings = BookStoreProjections.cacheInvalidationMappings();
        var cache    = new CaffeineTaggedCache(configuration.cacheMaximumSize, configuration.cacheMaximumTtl);
        notifications = new ReactorNotificationPublisher();
        postCommitCoordinator = new PostCommitCoordinator(cache,
                                                          NotificationPublisher.composite(List.of(new LoggingNotificationPublisher(), notifications)),
                                                          mappings);
        var projections = BookStoreProjections.all();
        postCommitCoordinator.verifyMappings(projections);
        projectionEngine = new ProjectionEngine(eventStore,
                                                projectionStore,
                                                projections,
                                                tenantRegistry,
                                                postCommitCoordinator,
                                                jsonSerializer,
                                                configuration.projectionEngine);
        queries = new BookStoreQueries(new ProjectionQueries(projectionStore, cache, mappings, jsonSerializer, configuration.queryCacheTtl));
    }

    public static BookStoreEngine inMemory() {
        return inMemory(BookStoreEngineConfiguration.DEFAULT, Clock.systemUTC());
    }

    public static BookStoreEngine inMemory(BookStoreEngineConfiguration configuration, Clock clock) {
        var jsonSerializer = new JacksonJSONSerializer();
        return new BookStoreEngine(new InMemoryEventStore(BookStoreEventTypes.create(), jsonSerializer, clock),
                                   new InMemoryProjectionStore(clock),
                                   new InMemoryScheduledCommandStore(),
                                   Optional.empty(),
                                   jsonSerializer,
                                   configuration,
                                   clock);
    }

    public static BookStoreEngine postgresql(Jdbi jdbi) {
        return postgresql(jdbi, BookStoreEngineConfiguration.DEFAULT, Clock.systemUTC());
    }

    /**
     * Create an engine that stores events, projection documents and scheduled commands in PostgreSQL.
     * Tables are created if they don't exist
     */
    public static BookStoreEngine postgresql(Jdbi jdbi, BookStoreEngineConfiguration configuration, Clock clock) {
        checkNotNull(jdbi, "No jdbi provided");
        var unitOfWorkFactory = new JdbiUnitOfWorkFactory(jdbi);
        var jsonSerializer    = new JacksonJSONSerializer();
        return new BookStoreEngine(new PostgresqlEventStore(unitOfWorkFactory,
                                                            BookStoreEventTypes.create(),
                                                            jsonSerializer,
                                                            PostgresqlEventStoreConfiguration.defaultConfiguration(),
                                                            clock),
                                   new PostgresqlProjectionStore(unitOfWorkFactory,
                                                                 PostgresqlProjectionStore.DEFAULT_CHECKPOINTS_TABLE_NAME,
                                                                 PostgresqlProjectionStore.DEFAULT_DOCUMENTS_TABLE_NAME,
                                                                 clock),
                                   new PostgresqlScheduledCommandStore(unitOfWorkFactory),
                                   Optional.<UnitOfWorkFactory<?>>of(unitOfWorkFactory),
                                   jsonSerializer,
                                   configuration,
                                   clock);
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.debug("BookStoreEngine was already started");
            return;
        }
        started = true;
        projectionEngine.start();
        commandScheduler.start();
        log.info("Started BookStoreEngine with {}", configuration);
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            log.debug("BookStoreEngine was already stopped");
            return;
        }
        started = false;
        commandScheduler.stop();
        projectionEngine.stop();
        log.info("Stopped BookStoreEngine");
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    /**
     * Execute a command for a registered tenant
     *
     * @throws InvalidTenantException if the tenant isn't registered or is the system tenant
     * @see CommandBus#submit(CommandEnvelope)
     */
    public CommandResult submit(CommandEnvelope envelope) {
        checkNotNull(envelope, "No envelope provided");
        tenantResolver.validate(envelope.tenantId.toString());
        return commandBus.submit(envelope);
    }

    public CommandResult submit(TenantId tenantId, Command command) {
        return submit(CommandEnvelope.of(tenantId, command));
    }

    /**
     * Register a tenant and start its projection workers. Registering an existing tenant is a no-op
     *
     * @return true if the tenant was added
     */
    public boolean registerTenant(TenantId tenantId, String name) {
        var added = tenantRegistry.register(tenantId, name);
        projectionEngine.addTenant(tenantId);
        return added;
    }

    public TenantRegistry tenantRegistry() {
        return tenantRegistry;
    }

    /**
     * Resolves the tenant of inbound requests from the <code>X-Tenant-ID</code> header
     */
    public TenantResolver tenantResolver() {
        return tenantResolver;
    }

    public BookStoreQueries queries() {
        return queries;
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public CommandBus commandBus() {
        return commandBus;
    }

    public CommandScheduler commandScheduler() {
        return commandScheduler;
    }

    public ProjectionEngine projectionEngine() {
        return projectionEngine;
    }

    /**
     * @return entity change notifications of the tenant, published after the read models have committed
     */
    public Flux<EntityChangedNotification> notifications(TenantId tenantId) {
        return notifications.subscribe(tenantId);
    }

    // Administration

    public ProjectionStatus projectionStatus(ProjectionName projectionName, TenantId tenantId) {
        return projectionEngine.getStatus(projectionName, tenantId);
    }

    public GlobalEventOrder projectionCheckpoint(ProjectionName projectionName, TenantId tenantId) {
        return projectionEngine.getCheckpoint(projectionName, tenantId);
    }

    public Optional<String> projectionLastError(ProjectionName projectionName, TenantId tenantId) {
        return projectionEngine.getLastError(projectionName, tenantId);
    }

    /**
     * Rebuild the read model of one tenant from the first event. The current documents keep serving queries until the
     * rebuilt generation has caught up
     */
    public void rebuildProjection(ProjectionName projectionName, TenantId tenantId) {
        log.info("[{}:{}] Rebuild requested", projectionName, tenantId);
        projectionEngine.triggerRebuild(projectionName, tenantId);
    }

    /**
     * Resume a projection that halted on a failing event
     */
    public void resumeProjection(ProjectionName projectionName, TenantId tenantId) {
        log.info("[{}:{}] Resume requested", projectionName, tenantId);
        projectionEngine.resume(projectionName, tenantId);
    }

    public List<ScheduledCommand> scheduledCommands(TenantId tenantId) {
        return commandScheduler.findAll(tenantId);
    }

    public Optional<ScheduledCommand> scheduledCommand(TenantId tenantId, String idempotencyKey) {
        return commandScheduler.find(tenantId, idempotencyKey);
    }

    /**
     * @return the <code>projection/documentType</code> pairs without a cache invalidation mapping (empty when complete)
     */
    public List<String> verifyMappings() {
        return postCommitCoordinator.verifyMappings(projectionEngine.projections());
    }
}
