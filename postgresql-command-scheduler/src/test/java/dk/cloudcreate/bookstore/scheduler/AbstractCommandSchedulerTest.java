package dk.cloudcreate.bookstore.scheduler;

import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.common.types.*;
import dk.cloudcreate.bookstore.eventstore.*;
import dk.cloudcreate.bookstore.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.bookstore.eventstore.types.*;
import dk.cloudcreate.bookstore.scheduler.store.ScheduledCommandStore;
import dk.cloudcreate.bookstore.scheduler.test_data.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.bookstore.scheduler.test_data.ReminderCommands.*;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

public abstract class AbstractCommandSchedulerTest {
    protected static final TenantId ACME   = TenantId.of("acme");
    protected static final TenantId GLOBEX = TenantId.of("globex");

    protected MutableClock              clock;
    protected ScheduledCommandStore     store;
    protected FlakyEventStore           eventStore;
    protected CommandBus                commandBus;
    protected ScheduledCommandRegistrar registrar;
    protected CommandScheduler          scheduler;

    protected abstract ScheduledCommandStore createStore();

    @BeforeEach
    void setupScheduler() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        store = createStore();
        eventStore = new FlakyEventStore();
        var jsonSerializer = new JacksonJSONSerializer();
        registrar = new ScheduledCommandRegistrar(store, jsonSerializer, clock);
        commandBus = new CommandBus(eventStore,
                                    ReminderAggregate.commandHandlers(),
                                    registrar,
                                    Optional.empty(),
                                    CommandBusConfiguration.builder().maxTransientRetries(0).build(),
                                    clock);
        scheduler = new CommandScheduler(store,
                                         commandBus,
                                         jsonSerializer,
                                         CommandSchedulerConfiguration.builder()
                                                                      .pollingInterval(Duration.ofMillis(20))
                                                                      .claimTimeout(Duration.ofMinutes(5))
                                                                      .redeliveryPolicy(RedeliveryPolicy.fixedBackoff(Duration.ofMinutes(1), 2))
                                                                      .build(),
                                         clock);
    }

    @AfterEach
    void stopScheduler() {
        scheduler.stop();
    }

    private void scheduleReminder(TenantId tenantId, String reminderId, OffsetDateTime sendAt) {
        commandBus.submit(CommandEnvelope.of(tenantId, new ScheduleReminder(reminderId, sendAt)));
    }

    private List<EventType> eventTypesOf(TenantId tenantId, String reminderId) {
        return eventStore.readStream(tenantId, StreamId.of(reminderId))
                         .stream()
                         .map(PersistedEvent::eventType)
                         .collect(Collectors.toList());
    }

    @Test
    void a_due_command_is_dispatched_once_even_when_the_poller_runs_twice() {
        // Given
        var dueAt = clock.now().plusHours(1);
        scheduleReminder(ACME, "reminder-1", dueAt);
        assertThat(scheduler.pollDue()).isEqualTo(0);

        // When
        clock.advance(Duration.ofHours(1).plusSeconds(1));
        var firstPoll  = scheduler.pollDue();
        var secondPoll = scheduler.pollDue();

        // Then
        assertThat(firstPoll).isEqualTo(1);
        assertThat(secondPoll).isEqualTo(0);
        assertThat(eventTypesOf(ACME, "reminder-1")).containsExactly(EventType.of("ReminderScheduled"), EventType.of("ReminderSent"));
        var entry = scheduler.find(ACME, ReminderAggregate.sendKey("reminder-1")).get();
        assertThat(entry.status).isEqualTo(ScheduledCommandStatus.EXECUTED);
        assertThat(entry.dispatchAttempts).isEqualTo(1);
        assertThat(entry.completedAt).isPresent();
    }

    @Test
    void the_dispatched_command_carries_the_correlation_and_causation_of_the_command_that_scheduled_it() {
        // Given
        var correlationId = CorrelationId.random();
        var scheduled = commandBus.submit(CommandEnvelope.builder(ACME, new ScheduleReminder("reminder-1", clock.now()))
                                                         .correlationId(correlationId)
                                                         .build());

        // When
        scheduler.pollDue();

        // Then
        var sent = eventStore.readStream(ACME, StreamId.of("reminder-1")).get(1);
        assertThat(sent.correlationId()).contains(correlationId);
        assertThat(sent.causationId()).contains(scheduled.events.get(0).eventId());
    }

    @Test
    void a_duplicate_registration_is_ignored() {
        // Given
        var deferredCommand = new DeferredCommand(clock.now(), new SendReminder("reminder-1"), ReminderAggregate.sendKey("reminder-1"));
        registrar.register(ACME, deferredCommand, CorrelationId.random(), Optional.empty());

        // When
        registrar.register(ACME, deferredCommand, CorrelationId.random(), Optional.empty());
        registrar.register(GLOBEX, deferredCommand, CorrelationId.random(), Optional.empty());

        // Then
        assertThat(scheduler.findAll(ACME)).hasSize(1);
        assertThat(scheduler.findAll(GLOBEX)).hasSize(1);
    }

    @Test
    void a_stale_claim_is_reclaimed_and_dispatched() {
        // Given a dispatcher that claimed the entry and died
        scheduleReminder(ACME, "reminder-1", clock.now());
        assertThat(store.claimDue(clock.now(), clock.now().minusMinutes(5), 10)).hasSize(1);
        assertThat(scheduler.pollDue()).isEqualTo(0);

        // When
        clock.advance(Duration.ofMinutes(6));
        var dispatched = scheduler.pollDue();

        // Then
        assertThat(dispatched).isEqualTo(1);
        var entry = scheduler.find(ACME, ReminderAggregate.sendKey("reminder-1")).get();
        assertThat(entry.status).isEqualTo(ScheduledCommandStatus.EXECUTED);
        assertThat(entry.dispatchAttempts).isEqualTo(2);
        assertThat(eventTypesOf(ACME, "reminder-1")).containsExactly(EventType.of("ReminderScheduled"), EventType.of("ReminderSent"));
    }

    @Test
    void a_redispatch_of_an_already_executed_command_is_a_no_op() {
        // Given
        scheduleReminder(ACME, "reminder-1", clock.now());
        scheduler.pollDue();

        // When the same command is dispatched again under a different key
        registrar.register(ACME, new DeferredCommand(clock.now(), new SendReminder("reminder-1"), "reminder:reminder-1:resend"), CorrelationId.random(), Optional.empty());
        scheduler.pollDue();

        // Then
        assertThat(scheduler.find(ACME, "reminder:reminder-1:resend").get().status).isEqualTo(ScheduledCommandStatus.EXECUTED);
        assertThat(eventTypesOf(ACME, "reminder-1")).containsExactly(EventType.of("ReminderScheduled"), EventType.of("ReminderSent"));
    }

    @Test
    void a_transient_failure_is_redelivered_after_the_redelivery_delay() {
        // Given
        scheduleReminder(ACME, "reminder-1", clock.now());
        eventStore.transientFailuresRemaining = 1;

        // When
        scheduler.pollDue();

        // Then
        var rescheduled = scheduler.find(ACME, ReminderAggregate.sendKey("reminder-1")).get();
        assertThat(rescheduled.status).isEqualTo(ScheduledCommandStatus.PENDING);
        assertThat(rescheduled.dispatchAttempts).isEqualTo(1);
        assertThat(rescheduled.lastError).hasValueSatisfying(error -> assertThat(error).contains("Transient"));
        assertThat(rescheduled.dueAt).isEqualTo(clock.now().plusMinutes(1));
        assertThat(scheduler.pollDue()).isEqualTo(0);

        // And when
        clock.advance(Duration.ofMinutes(1));
        scheduler.pollDue();

        // Then
        var executed = scheduler.find(ACME, ReminderAggregate.sendKey("reminder-1")).get();
        assertThat(executed.status).isEqualTo(ScheduledCommandStatus.EXECUTED);
        assertThat(executed.dispatchAttempts).isEqualTo(2);
        assertThat(eventTypesOf(ACME, "reminder-1")).containsExactly(EventType.of("ReminderScheduled"), EventType.of("ReminderSent"));
    }

    @Test
    void exhausted_redeliveries_mark_the_command_as_failed() {
        // Given
        scheduleReminder(ACME, "reminder-1", clock.now());
        eventStore.transientFailuresRemaining = 100;

        // When
        for (var i = 0; i < 4; i++) {
            scheduler.pollDue();
            clock.advance(Duration.ofMinutes(1));
        }

        // Then
        var failed = scheduler.find(ACME, ReminderAggregate.sendKey("reminder-1")).get();
        assertThat(failed.status).isEqualTo(ScheduledCommandStatus.FAILED);
        assertThat(failed.dispatchAttempts).isEqualTo(3);
        assertThat(failed.lastError).isPresent();
        assertThat(eventTypesOf(ACME, "reminder-1")).containsExactly(EventType.of("ReminderScheduled"));
    }

    @Test
    void a_rejected_command_is_a_permanent_failure() {
        // Given
        registrar.register(ACME, new DeferredCommand(clock.now(), new SendReminder("unknown-reminder"), "reminder:unknown-reminder:send"), CorrelationId.random(), Optional.empty());

        // When
        scheduler.pollDue();

        // Then
        var failed = scheduler.find(ACME, "reminder:unknown-reminder:send").get();
        assertThat(failed.status).isEqualTo(ScheduledCommandStatus.FAILED);
        assertThat(failed.dispatchAttempts).isEqualTo(1);
        assertThat(failed.lastError).hasValueSatisfying(error -> assertThat(error).contains("Permanent").contains("Reminder not found"));
    }

    @Test
    void an_unknown_command_type_is_a_permanent_failure() {
        // Given
        store.register(ScheduledCommand.pending(ACME,
                                                "unknown-command",
                                                "dk.cloudcreate.bookstore.scheduler.DoesNotExist",
                                                "{}",
                                                clock.now(),
                                                CorrelationId.random(),
                                                Optional.empty(),
                                                clock.now()));

        // When
        scheduler.pollDue();

        // Then
        var failed = scheduler.find(ACME, "unknown-command").get();
        assertThat(failed.status).isEqualTo(ScheduledCommandStatus.FAILED);
        assertThat(failed.lastError).hasValueSatisfying(error -> assertThat(error).contains("Unknown command type"));
    }

    @Test
    void the_started_scheduler_dispatches_due_commands_for_every_tenant() {
        // Given
        for (var i = 0; i < 10; i++) {
            scheduleReminder(ACME, "reminder-" + i, clock.now());
            scheduleReminder(GLOBEX, "reminder-" + i, clock.now().plusDays(1));
        }

        // When
        scheduler.start();

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(scheduler.findAll(ACME)).allMatch(entry -> entry.status == ScheduledCommandStatus.EXECUTED));
        assertThat(scheduler.findAll(GLOBEX)).allMatch(entry -> entry.status == ScheduledCommandStatus.PENDING);

        // And when
        clock.advance(Duration.ofDays(1));

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(scheduler.findAll(GLOBEX)).allMatch(entry -> entry.status == ScheduledCommandStatus.EXECUTED));
        for (var i = 0; i < 10; i++) {
            assertThat(eventTypesOf(GLOBEX, "reminder-" + i)).containsExactly(EventType.of("ReminderScheduled"), EventType.of("ReminderSent"));
        }
    }

    protected static class FlakyEventStore extends InMemoryEventStore {
        volatile int transientFailuresRemaining;

        FlakyEventStore() {
            super(ReminderAggregate.eventTypes());
        }

        @Override
        public synchronized AppendResult append(TenantId tenantId, StreamId streamId, StreamVersion expectedVersion, List<PersistableEvent> events) {
            if (transientFailuresRemaining > 0) {
                transientFailuresRemaining--;
                throw new AppendToStreamException("Simulated connection reset", new RuntimeException("connection reset"));
            }
            return super.append(tenantId, streamId, expectedVersion, events);
        }
    }
}
