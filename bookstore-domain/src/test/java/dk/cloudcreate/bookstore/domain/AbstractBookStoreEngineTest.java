package dk.cloudcreate.bookstore.domain;

import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.common.tenant.InvalidTenantException;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.domain.author.AuthorCommands.*;
import dk.cloudcreate.bookstore.domain.book.*;
import dk.cloudcreate.bookstore.domain.book.BookCommands.*;
import dk.cloudcreate.bookstore.domain.projection.*;
import dk.cloudcreate.bookstore.domain.publisher.PublisherCommands.*;
import dk.cloudcreate.bookstore.domain.test_data.MutableClock;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;
import dk.cloudcreate.bookstore.projection.*;
import dk.cloudcreate.bookstore.projection.notification.EntityChangedNotification;
import dk.cloudcreate.bookstore.scheduler.*;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

public abstract class AbstractBookStoreEngineTest {
    protected static final TenantId ACME = TenantId.of("acme");

    private static final Map<String, BigDecimal> PRICES = Map.of("EUR", new BigDecimal("20.00"));

    protected MutableClock    clock;
    protected BookStoreEngine engine;

    protected abstract BookStoreEngine createEngine(BookStoreEngineConfiguration configuration, MutableClock clock);

    @BeforeEach
    void setUpEngine() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        engine = createEngine(BookStoreEngineConfiguration.builder()
                                                          .projectionEngine(ProjectionEngineConfiguration.builder()
                                                                                                         .pollingInterval(Duration.ofMillis(50))
                                                                                                         .build())
                                                          .commandScheduler(CommandSchedulerConfiguration.builder()
                                                                                                         .pollingInterval(Duration.ofMillis(50))
                                                                                                         .build())
                                                          .build(),
                              clock);
        engine.registerTenant(ACME, "Acme Books");
    }

    @AfterEach
    void stopEngine() {
        engine.stop();
    }

    @Test
    void registering_a_tenant_twice_is_a_no_op() {
        // When
        var registeredAgain = engine.registerTenant(ACME, "Another name");

        // Then
        assertThat(registeredAgain).isFalse();
        assertThat(engine.tenantRegistry().registeredTenants()).containsExactly(ACME);
        assertThat(engine.tenantRegistry().nameOf(ACME)).hasValue("Acme Books");
    }

    @Test
    void commands_for_unknown_tenants_and_the_system_tenant_are_rejected() {
        assertThatThrownBy(() -> engine.submit(TenantId.of("initech"), new AddBook("book-1", dune(), PRICES)))
                .isInstanceOf(InvalidTenantException.class);
        assertThatThrownBy(() -> engine.submit(TenantId.SYSTEM, new AddBook("book-1", dune(), PRICES)))
                .isInstanceOf(InvalidTenantException.class);
    }

    @Test
    void resolved_tenant_header_must_be_registered() {
        assertThat((Object) engine.tenantResolver().resolve(Map.of("x-tenant-id", "acme"))).isEqualTo(ACME);
        assertThatThrownBy(() -> engine.tenantResolver().resolve(Map.of("X-Tenant-ID", "initech")))
                .isInstanceOf(InvalidTenantException.class);
    }

    @Test
    void a_price_change_with_a_stale_etag_is_a_precondition_failure() {
        // Given
        var added = engine.submit(ACME, new AddBook("book-1", dune(), PRICES));

        // When
        var changed = engine.submit(CommandEnvelope.builder(ACME, new ChangeBookPrice("book-1", Map.of("EUR", new BigDecimal("18.00"))))
                                                   .ifMatch(added.etag())
                                                   .build());

        // Then
        assertThat(changed.isChanged()).isTrue();
        assertThat(engine.eventStore().readStream(ACME, StreamId.of("book-1")))
                .extracting(event -> event.eventType().toString())
                .containsExactly("BookAdded", "BookPriceChanged");
        assertThatThrownBy(() -> engine.submit(CommandEnvelope.builder(ACME, new ChangeBookPrice("book-1", Map.of("EUR", new BigDecimal("15.00"))))
                                                              .ifMatch(added.etag())
                                                              .build()))
                .isInstanceOf(PreconditionFailedException.class);
    }

    @Test
    void rejected_commands_report_their_field_errors() {
        // When
        var thrown = catchThrowable(() -> engine.submit(ACME, new AddBook("book-1", BookDetails.of("", "123", "en"), PRICES)));

        // Then
        assertThat(thrown).isInstanceOfSatisfying(ValidationFailedException.class,
                                                  e -> assertThat(e.failure.fieldErrors).containsOnlyKeys("title", "isbn"));
        assertThat(CommandFailures.httpStatusOf(thrown)).isEqualTo(400);
    }

    @Test
    void book_search_carries_author_and_publisher_names() {
        // Given
        engine.start();
        engine.submit(ACME, new AddAuthor("author-1", "Frank Herbert", null));
        engine.submit(ACME, new AddPublisher("publisher-1", "Chilton Books"));

        // When
        engine.submit(ACME, new AddBook("book-1", dune(), PRICES));

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> {
                           assertThat(result.document.getAuthorNames()).containsExactly("Frank Herbert");
                           assertThat(result.document.getPublisherName()).hasValue("Chilton Books");
                           assertThat(result.version).isEqualTo(1);
                       }));
        assertThat(engine.queries().searchBooks(ACME, "HERBERT")).extracting(result -> result.document.getBookId()).containsExactly("book-1");

        // When
        engine.submit(ACME, new UpdateAuthor("author-1", "Frank Patrick Herbert", null));

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> assertThat(result.document.getAuthorNames()).containsExactly("Frank Patrick Herbert")));
    }

    @Test
    void changes_are_announced_after_the_read_model_committed() {
        // Given
        engine.start();
        var bookNotifications = engine.notifications(ACME).filter(notification -> notification.entityType.equals("Book"));

        // Then
        StepVerifier.create(bookNotifications)
                    .then(() -> engine.submit(ACME, new AddBook("book-1", dune(), PRICES)))
                    .assertNext(notification -> {
                        assertThat(notification.entityId).isEqualTo("book-1");
                        assertThat(notification.changeKind).isEqualTo(EntityChangedNotification.ChangeKind.CREATED);
                        assertThat(engine.queries().getBook(ACME, "book-1")).isPresent();
                    })
                    .then(() -> engine.submit(ACME, new SoftDeleteBook("book-1")))
                    .assertNext(notification -> assertThat(notification.changeKind).isEqualTo(EntityChangedNotification.ChangeKind.DELETED))
                    .thenCancel()
                    .verify(Duration.ofSeconds(10));
        assertThat(engine.queries().getBook(ACME, "book-1")).isEmpty();
        assertThat(engine.queries().listBooks(ACME, true)).hasSize(1);
    }

    @Test
    void author_statistics_count_distinct_active_books() {
        // Given
        engine.start();
        engine.submit(ACME, new AddAuthor("author-1", "Frank Herbert", null));
        engine.submit(ACME, new AddBook("book-1", dune(), PRICES));
        engine.submit(ACME, new AddBook("book-2", dune().withTitle("Dune Messiah"), PRICES));
        engine.submit(ACME, new UpdateBook("book-2", dune().withTitle("Dune Messiah").withDescription("en", "The sequel")));

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(engine.queries().authorStatistics(ACME, "author-1").getBookIds()).containsExactly("book-1", "book-2"));

        // When
        engine.submit(ACME, new SoftDeleteBook("book-1"));

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(engine.queries().authorStatistics(ACME, "author-1").getBookCount()).isEqualTo(1));
    }

    @Test
    void a_scheduled_sale_is_applied_and_removed_by_the_scheduler() {
        // Given
        var saleStart = clock.now().plusDays(1);
        var saleEnd   = saleStart.plusDays(2);
        engine.submit(ACME, new AddBook("book-1", dune(), PRICES));
        engine.submit(ACME, new ScheduleBookSale("book-1", new BigDecimal("25"), saleStart, saleEnd));
        engine.start();

        // When
        clock.advance(Duration.ofDays(1));

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> assertThat(result.document.getCurrentPrices().get("EUR")).isEqualByComparingTo("15.00")));
        assertThat(engine.scheduledCommand(ACME, BookAggregate.applyDiscountKey("book-1", saleStart)))
                .hasValueSatisfying(command -> assertThat(command.status).isEqualTo(ScheduledCommandStatus.EXECUTED));

        // When
        clock.advance(Duration.ofDays(2));

        // Then
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> assertThat(result.document.getCurrentPrices().get("EUR")).isEqualByComparingTo("20.00")));
        var book = engine.commandBus().rehydrator().load(ACME, StreamId.of("book-1"), BookAggregate.DEFINITION);
        assertThat(book.state.discountPercentage).isEqualByComparingTo("0");
        assertThat(book.version.longValue()).isEqualTo(4);
    }

    @Test
    void a_cancelled_sale_is_never_applied() {
        // Given
        var saleStart = clock.now().plusDays(1);
        engine.submit(ACME, new AddBook("book-1", dune(), PRICES));
        engine.submit(ACME, new ScheduleBookSale("book-1", new BigDecimal("25"), saleStart, saleStart.plusDays(2)));
        engine.submit(ACME, new CancelBookSale("book-1", saleStart));

        // When
        clock.advance(Duration.ofDays(4));
        engine.commandScheduler().pollDue();

        // Then
        assertThat(engine.scheduledCommands(ACME)).extracting(command -> command.status)
                                                  .containsOnly(ScheduledCommandStatus.EXECUTED);
        assertThat(engine.eventStore().readStream(ACME, StreamId.of("book-1")))
                .extracting(event -> event.eventType().toString())
                .containsExactly("BookAdded", "BookSaleScheduled", "BookSaleCancelled");
    }

    @Test
    void rebuilding_one_projection_keeps_the_others_serving() {
        // Given
        engine.start();
        engine.submit(ACME, new AddAuthor("author-1", "Frank Herbert", null));
        engine.submit(ACME, new AddBook("book-1", dune(), PRICES));
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> {
                   assertThat(engine.queries().getBook(ACME, "book-1")).isPresent();
                   assertThat(engine.queries().getAuthor(ACME, "author-1")).isPresent();
               });

        // When
        engine.rebuildProjection(BookSearchProjection.NAME, ACME);

        // Then
        assertThat(engine.queries().getAuthor(ACME, "author-1")).isPresent();
        assertThat(engine.projectionStatus(AuthorProjection.NAME, ACME)).isNotEqualTo(ProjectionStatus.REBUILDING);
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> {
                   assertThat(engine.projectionStatus(BookSearchProjection.NAME, ACME)).isEqualTo(ProjectionStatus.LIVE);
                   assertThat(engine.queries().getBook(ACME, "book-1"))
                           .hasValueSatisfying(result -> assertThat(result.document.getAuthorNames()).containsExactly("Frank Herbert"));
               });
        assertThat(engine.projectionLastError(BookSearchProjection.NAME, ACME)).isEmpty();
    }

    @Test
    void every_projection_document_has_a_cache_mapping() {
        assertThat(engine.verifyMappings()).isEmpty();
        assertThat(engine.projectionEngine().projections().stream().map(projection -> projection.name().toString()).collect(Collectors.toList()))
                .containsExactlyInAnyOrder("book-search", "authors", "categories", "publishers", "author-statistics",
                                           "category-statistics", "publisher-statistics");
    }

    protected static BookDetails dune() {
        return BookDetails.of("Dune", "978-0-441-17271-9", "en").withAuthors("author-1").withPublisher("publisher-1");
    }
}
