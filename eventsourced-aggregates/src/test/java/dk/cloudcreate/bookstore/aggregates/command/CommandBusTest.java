package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.aggregates.ETag;
import dk.cloudcreate.bookstore.aggregates.test_data.*;
import dk.cloudcreate.bookstore.common.tenant.TenantContext;
import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.bookstore.eventstore.types.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static dk.cloudcreate.bookstore.aggregates.test_data.OrderCommands.*;
import static dk.cloudcreate.bookstore.aggregates.test_data.OrderEvent.*;
import static org.assertj.core.api.Assertions.*;

class CommandBusTest {
    private static final TenantId TENANT   = TenantId.of("acme");
    private static final StreamId ORDER_ID = StreamId.of("order-1");

    private TestEventStore     eventStore;
    private RecordingRegistrar registrar;
    private CommandBus         commandBus;

    @BeforeEach
    void setup() {
        eventStore = new TestEventStore();
        registrar = new RecordingRegistrar();
        commandBus = createCommandBus(CommandBusConfiguration.builder().transientRetryBackoff(Duration.ofMillis(1)).build(), Clock.systemUTC());
    }

    private CommandBus createCommandBus(CommandBusConfiguration configuration, Clock clock) {
        return new CommandBus(eventStore, OrderAggregate.commandHandlers(), registrar, Optional.empty(), configuration, clock);
    }

    @Test
    void creates_a_stream_and_returns_the_new_etag() {
        // Given
        var correlationId = CorrelationId.random();

        // When
        var result = commandBus.submit(CommandEnvelope.builder(TENANT, new PlaceOrder("order-1", "customer-1", null))
                                                      .correlationId(correlationId)
                                                      .build());

        // Then
        assertThat(result.outcome).isEqualTo(CommandResult.Outcome.CHANGED);
        assertThat(result.etag()).isEqualTo(ETag.of(1));
        assertThat(result.events).hasSize(1);
        assertThat(result.events.get(0).correlationId()).contains(correlationId);
        assertThat(eventStore.readStream(TENANT, ORDER_ID)).extracting(PersistedEvent::eventType).containsExactly(EventType.of("OrderPlaced"));
        assertThat(TenantContext.currentTenant()).isEmpty();
    }

    @Test
    void a_matching_etag_is_accepted() {
        // Given
        var created = commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));

        // When
        var result = commandBus.submit(CommandEnvelope.builder(TENANT, new AddProduct("order-1", "product-1", 2))
                                                      .ifMatch(created.etag())
                                                      .build());

        // Then
        assertThat(result.etag().toString()).isEqualTo("\"2\"");
    }

    @Test
    void a_stale_etag_is_a_precondition_failure_and_nothing_is_appended() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        commandBus.submit(CommandEnvelope.of(TENANT, new AddProduct("order-1", "product-1", 2)));

        // When / Then
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.builder(TENANT, new AddProduct("order-1", "product-2", 1))
                                                                  .ifMatch("\"1\"")
                                                                  .build()))
                .isInstanceOfSatisfying(PreconditionFailedException.class, e -> {
                    assertThat(e.currentVersion).contains(StreamVersion.of(2));
                    assertThat(e.getMessage()).contains(PreconditionFailedException.USER_MESSAGE);
                });
        assertThat(eventStore.currentVersion(TENANT, ORDER_ID)).isEqualTo(StreamVersion.of(2));
    }

    @Test
    void a_malformed_etag_is_a_precondition_failure() {
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));

        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.builder(TENANT, new AcceptOrder("order-1")).ifMatch("not-an-etag").build()))
                .isInstanceOf(PreconditionFailedException.class);
    }

    @Test
    void a_missing_required_etag_is_a_precondition_required_failure() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));

        // When / Then
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.builder(TENANT, new AcceptOrder("order-1")).etagRequired(true).build()))
                .isInstanceOf(PreconditionRequiredException.class);
    }

    @Test
    void an_etag_is_not_required_to_create_a_stream() {
        var result = commandBus.submit(CommandEnvelope.builder(TENANT, new PlaceOrder("order-1", "customer-1", null)).etagRequired(true).build());

        assertThat(result.isChanged()).isTrue();
    }

    @Test
    void a_rejection_is_a_validation_failure_with_field_errors() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));

        // When / Then
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.of(TENANT, new AddProduct("order-1", null, 0))))
                .isInstanceOfSatisfying(ValidationFailedException.class, e -> {
                    assertThat(e.failure.kind).isEqualTo(ValidationFailure.Kind.INVALID);
                    assertThat(e.failure.fieldErrors).containsOnlyKeys("productId", "quantity");
                });
    }

    @Test
    void a_command_against_a_missing_stream_is_not_found() {
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.of(TENANT, new AcceptOrder("order-1"))))
                .isInstanceOfSatisfying(ValidationFailedException.class,
                                        e -> assertThat(e.failure.kind).isEqualTo(ValidationFailure.Kind.NOT_FOUND));
    }

    @Test
    void an_already_satisfied_command_is_no_change() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        commandBus.submit(CommandEnvelope.of(TENANT, new AcceptOrder("order-1")));

        // When
        var result = commandBus.submit(CommandEnvelope.of(TENANT, new AcceptOrder("order-1")));

        // Then
        assertThat(result.outcome).isEqualTo(CommandResult.Outcome.NO_CHANGE);
        assertThat(result.etag()).isEqualTo(ETag.of(2));
        assertThat(eventStore.currentVersion(TENANT, ORDER_ID)).isEqualTo(StreamVersion.of(2));
    }

    @Test
    void a_concurrency_conflict_without_etag_is_retried_against_fresh_state() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        eventStore.beforeNextAppend = () -> eventStore.append(TENANT, ORDER_ID, StreamVersion.of(1),
                                                              List.of(PersistableEvent.of(new ProductAdded("order-1", "product-1", 1))));

        // When
        var result = commandBus.submit(CommandEnvelope.of(TENANT, new AddProduct("order-1", "product-2", 3)));

        // Then
        assertThat(result.version).isEqualTo(StreamVersion.of(3));
        var products = eventStore.readStream(TENANT, ORDER_ID).stream()
                                 .map(PersistedEvent::event)
                                 .filter(ProductAdded.class::isInstance)
                                 .map(event -> ((ProductAdded) event).getProductId());
        assertThat(products).containsExactly("product-1", "product-2");
    }

    @Test
    void a_concurrency_conflict_with_etag_is_a_precondition_failure() {
        // Given
        var created = commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        eventStore.beforeNextAppend = () -> eventStore.append(TENANT, ORDER_ID, StreamVersion.of(1),
                                                              List.of(PersistableEvent.of(new ProductAdded("order-1", "product-1", 1))));

        // When / Then
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.builder(TENANT, new AddProduct("order-1", "product-2", 3))
                                                                  .ifMatch(created.etag())
                                                                  .build()))
                .isInstanceOf(PreconditionFailedException.class)
                .hasCauseInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void a_concurrency_conflict_with_wildcard_etag_is_retried_against_fresh_state() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        eventStore.beforeNextAppend = () -> eventStore.append(TENANT, ORDER_ID, StreamVersion.of(1),
                                                              List.of(PersistableEvent.of(new ProductAdded("order-1", "product-1", 1))));

        // When
        var result = commandBus.submit(CommandEnvelope.builder(TENANT, new AddProduct("order-1", "product-2", 3))
                                                      .ifMatch(ETag.ANY)
                                                      .build());

        // Then
        assertThat(result.version).isEqualTo(StreamVersion.of(3));
        assertThat(eventStore.currentVersion(TENANT, ORDER_ID)).isEqualTo(StreamVersion.of(3));
    }

    @Test
    void a_non_zero_etag_against_a_missing_stream_is_a_precondition_failure() {
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.builder(TENANT, new PlaceOrder("order-1", "customer-1", null))
                                                                  .ifMatch("\"5\"")
                                                                  .build()))
                .isInstanceOfSatisfying(PreconditionFailedException.class,
                                        e -> assertThat(e.currentVersion).contains(StreamVersion.NEW_STREAM));
        assertThat(eventStore.readStream(TENANT, ORDER_ID)).isEmpty();
    }

    @Test
    void a_zero_etag_against_a_missing_stream_creates_it() {
        // When
        var result = commandBus.submit(CommandEnvelope.builder(TENANT, new PlaceOrder("order-1", "customer-1", null))
                                                      .ifMatch("\"0\"")
                                                      .build());

        // Then
        assertThat(result.isChanged()).isTrue();
        assertThat(result.etag()).isEqualTo(ETag.of(1));
    }

    @Test
    void conflict_retries_are_bounded() {
        // Given
        var bus = createCommandBus(CommandBusConfiguration.builder().maxConflictRetries(2).build(), Clock.systemUTC());
        bus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        eventStore.appendAttempts.set(0);
        eventStore.conflictOnEveryAppend = true;

        // When / Then
        assertThatThrownBy(() -> bus.submit(CommandEnvelope.of(TENANT, new AddProduct("order-1", "product-2", 3))))
                .isInstanceOf(ConcurrencyConflictException.class);
        assertThat(eventStore.appendAttempts.get()).isEqualTo(1 + 2);
    }

    @Test
    void transient_append_failures_are_retried_with_backoff() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        eventStore.transientFailuresRemaining = 2;

        // When
        var result = commandBus.submit(CommandEnvelope.of(TENANT, new AcceptOrder("order-1")));

        // Then
        assertThat(result.version).isEqualTo(StreamVersion.of(2));
    }

    @Test
    void transient_append_failures_surface_after_the_retry_budget() {
        // Given
        commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null)));
        eventStore.transientFailuresRemaining = 10;

        // When / Then
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.of(TENANT, new AcceptOrder("order-1"))))
                .isInstanceOf(AppendToStreamException.class);
        assertThat(eventStore.currentVersion(TENANT, ORDER_ID)).isEqualTo(StreamVersion.of(1));
    }

    @Test
    void a_passed_deadline_times_out_before_anything_is_appended() {
        // Given
        var clock = new SteppingClock(Duration.ofSeconds(2));
        var bus   = createCommandBus(CommandBusConfiguration.builder().requestTimeout(Duration.ofSeconds(1)).build(), clock);

        // When / Then
        assertThatThrownBy(() -> bus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", null))))
                .isInstanceOf(CommandTimeoutException.class);
        assertThat(eventStore.readStream(TENANT, ORDER_ID)).isEmpty();
    }

    @Test
    void deferred_commands_are_registered_with_the_first_event_as_causation() {
        // Given
        var acceptBefore = OffsetDateTime.parse("2030-01-01T12:00:00Z");

        // When
        var result = commandBus.submit(CommandEnvelope.of(TENANT, new PlaceOrder("order-1", "customer-1", acceptBefore)));

        // Then
        assertThat(result.deferredCommands).hasSize(1);
        assertThat(registrar.registrations).hasSize(1);
        var registration = registrar.registrations.get(0);
        assertThat((Object) registration.tenantId).isEqualTo(TENANT);
        assertThat(registration.deferredCommand.dueAt).isEqualTo(acceptBefore);
        assertThat(registration.deferredCommand.idempotencyKey).isEqualTo("order:order-1:accept");
        assertThat(registration.deferredCommand.command).isInstanceOf(AcceptOrder.class);
        assertThat(registration.causationId).contains(result.events.get(0).eventId());
    }

    @Test
    void an_unregistered_command_type_is_rejected() {
        Command unknown = () -> ORDER_ID;
        assertThatThrownBy(() -> commandBus.submit(CommandEnvelope.of(TENANT, unknown)))
                .isInstanceOf(UnknownCommandException.class);
    }

    private static class TestEventStore extends InMemoryEventStore {
        final AtomicInteger appendAttempts = new AtomicInteger();
        volatile Runnable   beforeNextAppend;
        volatile boolean    conflictOnEveryAppend;
        volatile int        transientFailuresRemaining;

        TestEventStore() {
            super(OrderAggregate.eventTypes());
        }

        @Override
        public AppendResult append(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, List<PersistableEvent> events) {
            var interceptor = beforeNextAppend;
            if (interceptor != null) {
                beforeNextAppend = null;
                interceptor.run();
            } else {
                appendAttempts.incrementAndGet();
            }
            if (conflictOnEveryAppend) {
                throw new ConcurrencyConflictException(tenantId, streamId, expectedVersion, Optional.empty());
            }
            if (transientFailuresRemaining > 0) {
                transientFailuresRemaining--;
                throw new AppendToStreamException("Simulated connection reset", new RuntimeException("connection reset"));
            }
            return super.append(tenantId, streamId, expectedVersion, events);
        }
    }

    private static class RecordingRegistrar implements DeferredCommandRegistrar {
        final List<Registration> registrations = new CopyOnWriteArrayList<>();

        @Override
        public void register(TenantId tenantId, DeferredCommand deferredCommand, CorrelationId correlationId, Optional<EventId> causationId) {
            registrations.add(new Registration(tenantId, deferredCommand, causationId));
        }
    }

    private static class Registration {
        final TenantId          tenantId;
        final DeferredCommand   deferredCommand;
        final Optional<EventId> causationId;

        Registration(TenantId tenantId, DeferredCommand deferredCommand, Optional<EventId> causationId) {
            this.tenantId = tenantId;
            this.deferredCommand = deferredCommand;
            this.causationId = causationId;
        }
    }

    /**
     * Every read advances the time by a fixed step
     */
    private static class SteppingClock extends Clock {
        private final Duration step;
        private       Instant  now = Instant.parse("2030-01-01T00:00:00Z");

        SteppingClock(Duration step) {
            this.step = step;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public synchronized Instant instant() {
            var current = now;
            now = now.plus(step);
            return current;
        }
    }
}
