package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.domain.*;
import dk.cloudcreate.bookstore.domain.author.AuthorCommands.*;
import dk.cloudcreate.bookstore.domain.book.BookCommands.*;
import dk.cloudcreate.bookstore.domain.book.BookDetails;
import dk.cloudcreate.bookstore.domain.category.CategoryCommands.*;
import dk.cloudcreate.bookstore.domain.publisher.PublisherCommands.*;
import dk.cloudcreate.bookstore.domain.test_data.MutableClock;
import dk.cloudcreate.bookstore.projection.*;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.time.*;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class BookStoreProjectionsTest {
    private static final TenantId ACME    = TenantId.of("acme");
    private static final TenantId GLOBEX  = TenantId.of("globex");
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private MutableClock    clock;
    private BookStoreEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        engine = BookStoreEngine.inMemory(BookStoreEngineConfiguration.builder()
                                                                      .projectionEngine(ProjectionEngineConfiguration.builder()
                                                                                                                     .pollingInterval(Duration.ofMillis(50))
                                                                                                                     .build())
                                                                      .build(),
                                          clock);
        engine.registerTenant(ACME, "Acme Books");
        engine.registerTenant(GLOBEX, "Globex Books");
        engine.start();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    void categories_and_publishers_follow_their_lifecycle() {
        // Given
        engine.submit(ACME, new AddCategory("category-1", "Science Fiction", "Spaceships and such"));
        engine.submit(ACME, new AddPublisher("publisher-1", "Chilton Books"));
        engine.submit(ACME, new UpdateCategory("category-1", "Sci-Fi", "Spaceships and such"));

        // When
        engine.submit(ACME, new SoftDeletePublisher("publisher-1"));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> {
                   assertThat(engine.queries().getCategory(ACME, "category-1"))
                           .hasValueSatisfying(result -> {
                               assertThat(result.document.getName()).isEqualTo("Sci-Fi");
                               assertThat(result.version).isEqualTo(2);
                           });
                   assertThat(engine.queries().getPublisher(ACME, "publisher-1")).isEmpty();
                   assertThat(engine.queries().listPublishers(ACME, true))
                           .singleElement()
                           .satisfies(result -> assertThat(result.softDeleted).isTrue());
               });

        // When
        engine.submit(ACME, new RestorePublisher("publisher-1"));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> assertThat(engine.queries().listPublishers(ACME, false)).hasSize(1));
    }

    @Test
    void book_search_reflects_prices_covers_and_categories() {
        // Given
        var details = BookDetails.of("Dune", "0441172717", "en").withCategories("category-1");
        engine.submit(ACME, new AddBook("book-1", details, Map.of("EUR", new BigDecimal("20.00"), "USD", new BigDecimal("22.50"))));
        engine.submit(ACME, new AddBook("book-2", BookDetails.of("Emma", null, "en"), Map.of("EUR", new BigDecimal("9.00"))));

        // When
        engine.submit(ACME, new ChangeBookPrice("book-1", Map.of("EUR", new BigDecimal("18.00"))));
        engine.submit(ACME, new UpdateBookCover("book-1", "https://covers.example/dune.jpg"));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> {
                           assertThat(result.document.getPrices()).containsOnlyKeys("EUR");
                           assertThat(result.document.getCurrentPrices().get("EUR")).isEqualByComparingTo("18.00");
                           assertThat(result.document.getCoverImageUrl()).hasValue("https://covers.example/dune.jpg");
                           assertThat(result.version).isEqualTo(3);
                       }));
        assertThat(engine.queries().booksInCategory(ACME, "category-1")).extracting(result -> result.document.getBookId()).containsExactly("book-1");
        assertThat(engine.queries().searchBooks(ACME, "emma")).extracting(result -> result.document.getBookId()).containsExactly("book-2");
    }

    @Test
    void category_and_publisher_statistics_count_distinct_active_books() {
        // Given
        var dune = BookDetails.of("Dune", null, "en").withCategories("category-1", "category-2").withPublisher("publisher-1");
        engine.submit(ACME, new AddBook("book-1", dune, Map.of("EUR", BigDecimal.TEN)));
        engine.submit(ACME, new AddBook("book-2", BookDetails.of("Emma", null, "en").withCategories("category-1").withPublisher("publisher-1"),
                                        Map.of("EUR", BigDecimal.ONE)));
        engine.submit(ACME, new UpdateBook("book-1", dune.withDescription("en", "Spice")));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> {
                   assertThat(engine.queries().categoryStatistics(ACME, "category-1").getBookIds()).containsExactly("book-1", "book-2");
                   assertThat(engine.queries().categoryStatistics(ACME, "category-2").getBookCount()).isEqualTo(1);
                   assertThat(engine.queries().publisherStatistics(ACME, "publisher-1").getBookIds()).containsExactly("book-1", "book-2");
               });

        // When
        engine.submit(ACME, new UpdateBook("book-1", dune.withCategories("category-2").withPublisher("publisher-2")));
        engine.submit(ACME, new SoftDeleteBook("book-2"));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> {
                   assertThat(engine.queries().categoryStatistics(ACME, "category-1").getBookCount()).isZero();
                   assertThat(engine.queries().categoryStatistics(ACME, "category-2").getBookIds()).containsExactly("book-1");
                   assertThat(engine.queries().publisherStatistics(ACME, "publisher-1").getBookCount()).isZero();
                   assertThat(engine.queries().publisherStatistics(ACME, "publisher-2").getBookIds()).containsExactly("book-1");
               });

        // When
        engine.submit(ACME, new RestoreBook("book-2"));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> {
                   assertThat(engine.queries().categoryStatistics(ACME, "category-1").getBookIds()).containsExactly("book-2");
                   assertThat(engine.queries().publisherStatistics(ACME, "publisher-1").getBookIds()).containsExactly("book-2");
               });
        assertThat(engine.queries().publisherStatistics(ACME, "publisher-3").getBookIds()).isEmpty();
    }

    @Test
    void every_author_rename_reaches_the_cached_book() {
        // Given
        engine.submit(ACME, new AddAuthor("author-1", "A", null));
        engine.submit(ACME, new AddBook("book-1", BookDetails.of("Dune", null, "en").withAuthors("author-1"), Map.of("EUR", BigDecimal.TEN)));
        await().atMost(TIMEOUT)
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> assertThat(result.document.getAuthorNames()).containsExactly("A")));

        // When
        engine.submit(ACME, new UpdateAuthor("author-1", "B", null));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> assertThat(result.document.getAuthorNames()).containsExactly("B")));

        // When
        engine.submit(ACME, new UpdateAuthor("author-1", "C", null));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> assertThat(engine.queries().getBook(ACME, "book-1"))
                       .hasValueSatisfying(result -> {
                           assertThat(result.document.getAuthorNames()).containsExactly("C");
                           assertThat(result.version).isEqualTo(1);
                       }));
    }

    @Test
    void read_models_are_isolated_per_tenant() {
        // When
        engine.submit(ACME, new AddBook("book-1", BookDetails.of("Dune", null, "en"), Map.of("EUR", BigDecimal.TEN)));
        engine.submit(GLOBEX, new AddBook("book-1", BookDetails.of("Emma", null, "en"), Map.of("EUR", BigDecimal.ONE)));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> {
                   assertThat(engine.queries().getBook(ACME, "book-1")).hasValueSatisfying(result -> assertThat(result.document.getTitle()).isEqualTo("Dune"));
                   assertThat(engine.queries().getBook(GLOBEX, "book-1")).hasValueSatisfying(result -> assertThat(result.document.getTitle()).isEqualTo("Emma"));
               });
        assertThat(engine.queries().searchBooks(GLOBEX, "dune")).isEmpty();
    }

    @Test
    void a_restored_book_is_searchable_again() {
        // Given
        engine.submit(ACME, new AddBook("book-1", BookDetails.of("Dune", null, "en"), Map.of("EUR", BigDecimal.TEN)));
        engine.submit(ACME, new SoftDeleteBook("book-1"));
        await().atMost(TIMEOUT)
               .untilAsserted(() -> assertThat(engine.queries().searchBooks(ACME, "dune")).isEmpty());

        // When
        engine.submit(ACME, new RestoreBook("book-1"));

        // Then
        await().atMost(TIMEOUT)
               .untilAsserted(() -> assertThat(engine.queries().searchBooks(ACME, "dune")).hasSize(1));
    }

    @Test
    void rebuilding_one_tenant_keeps_the_other_tenant_serving() {
        // Given
        engine.submit(ACME, new AddBook("book-1", BookDetails.of("Dune", null, "en"), Map.of("EUR", BigDecimal.TEN)));
        engine.submit(GLOBEX, new AddBook("book-2", BookDetails.of("Emma", null, "en"), Map.of("EUR", BigDecimal.ONE)));
        await().atMost(TIMEOUT)
               .untilAsserted(() -> {
                   assertThat(engine.queries().getBook(ACME, "book-1")).isPresent();
                   assertThat(engine.queries().getBook(GLOBEX, "book-2")).isPresent();
               });

        // When
        engine.rebuildProjection(BookSearchProjection.NAME, ACME);

        // Then
        assertThat(engine.queries().getBook(GLOBEX, "book-2")).isPresent();
        assertThat(engine.projectionStatus(BookSearchProjection.NAME, GLOBEX)).isNotEqualTo(ProjectionStatus.REBUILDING);
        await().atMost(TIMEOUT)
               .untilAsserted(() -> {
                   assertThat(engine.projectionStatus(BookSearchProjection.NAME, ACME)).isEqualTo(ProjectionStatus.LIVE);
                   assertThat(engine.queries().getBook(ACME, "book-1")).isPresent();
               });
        assertThat(engine.projectionCheckpoint(BookSearchProjection.NAME, ACME).longValue()).isPositive();
    }
}
