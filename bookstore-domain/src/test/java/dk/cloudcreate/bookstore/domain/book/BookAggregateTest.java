package dk.cloudcreate.bookstore.domain.book;

import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.domain.book.BookEvent.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;

import static dk.cloudcreate.bookstore.domain.book.BookCommands.*;
import static org.assertj.core.api.Assertions.*;

class BookAggregateTest {
    private static final String                  BOOK_ID    = "book-1";
    private static final Map<String, BigDecimal> PRICES     = Map.of("EUR", new BigDecimal("20.00"), "USD", new BigDecimal("22.00"));
    private static final OffsetDateTime          SALE_START = OffsetDateTime.of(2026, 6, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime          SALE_END   = SALE_START.plusDays(7);

    @Test
    void adding_a_book_requires_title_language_and_a_price() {
        // When
        var decision = BookAggregate.addBook(new AddBook(BOOK_ID, BookDetails.of(" ", null, ""), Map.of()), Optional.empty());

        // Then
        assertThat(decision.isRejected()).isTrue();
        var failure = decision.rejection().get();
        assertThat(failure.kind).isEqualTo(ValidationFailure.Kind.INVALID);
        assertThat(failure.fieldErrors).containsOnlyKeys("title", "language", "prices");
    }

    @Test
    void a_title_longer_than_500_characters_is_rejected() {
        // When
        var decision = BookAggregate.addBook(new AddBook(BOOK_ID, BookDetails.of("x".repeat(501), null, "en"), PRICES), Optional.empty());

        // Then
        assertThat(decision.rejection()).hasValueSatisfying(failure -> assertThat(failure.fieldErrors).containsOnlyKeys("title"));
    }

    @Test
    void isbn_must_have_10_or_13_digits_ignoring_hyphens_and_spaces() {
        assertThat(BookAggregate.addBook(new AddBook(BOOK_ID, BookDetails.of("Dune", "978-0-441-17271-9", "en"), PRICES), Optional.empty()).isRejected()).isFalse();
        assertThat(BookAggregate.addBook(new AddBook(BOOK_ID, BookDetails.of("Dune", "0 441 17271 7", "en"), PRICES), Optional.empty()).isRejected()).isFalse();
        assertThat(BookAggregate.addBook(new AddBook(BOOK_ID, BookDetails.of("Dune", "978-0-441", "en"), PRICES), Optional.empty()).isRejected()).isTrue();
        assertThat(BookAggregate.addBook(new AddBook(BOOK_ID, BookDetails.of("Dune", "97804411727X9", "en"), PRICES), Optional.empty()).isRejected()).isTrue();
    }

    @Test
    void prices_must_use_iso_currency_codes_and_cannot_be_negative() {
        // When
        var unknownCurrency = BookAggregate.addBook(new AddBook(BOOK_ID, dune(), Map.of("XYZ1", BigDecimal.TEN)), Optional.empty());
        var negativePrice   = BookAggregate.addBook(new AddBook(BOOK_ID, dune(), Map.of("EUR", new BigDecimal("-1"))), Optional.empty());

        // Then
        assertThat(unknownCurrency.isRejected()).isTrue();
        assertThat(negativePrice.isRejected()).isTrue();
    }

    @Test
    void adding_an_existing_book_is_a_conflict() {
        // Given
        var book = existingBook();

        // When
        var decision = BookAggregate.addBook(new AddBook(BOOK_ID, dune(), PRICES), Optional.of(book));

        // Then
        assertThat(decision.rejection()).hasValueSatisfying(failure -> assertThat(failure.kind).isEqualTo(ValidationFailure.Kind.CONFLICT));
    }

    @Test
    void updating_with_identical_details_is_no_change() {
        // Given
        var book = existingBook();

        // When
        var decision = BookAggregate.updateBook(new UpdateBook(BOOK_ID, dune()), Optional.of(book));

        // Then
        assertThat(decision.isNoChange()).isTrue();
    }

    @Test
    void a_deleted_book_cannot_be_updated_deleted_twice_or_restored_while_active() {
        // Given
        var book    = existingBook();
        var deleted = apply(book, BookAggregate.softDeleteBook(new SoftDeleteBook(BOOK_ID), Optional.of(book)));

        // Then
        assertThat(deleted.deleted).isTrue();
        assertThat(BookAggregate.updateBook(new UpdateBook(BOOK_ID, dune().withTitle("Dune Messiah")), Optional.of(deleted)).rejection())
                .hasValueSatisfying(failure -> assertThat(failure.kind).isEqualTo(ValidationFailure.Kind.NOT_FOUND));
        assertThat(BookAggregate.softDeleteBook(new SoftDeleteBook(BOOK_ID), Optional.of(deleted)).rejection())
                .hasValueSatisfying(failure -> assertThat(failure.kind).isEqualTo(ValidationFailure.Kind.CONFLICT));
        assertThat(BookAggregate.restoreBook(new RestoreBook(BOOK_ID), Optional.of(book)).rejection())
                .hasValueSatisfying(failure -> assertThat(failure.kind).isEqualTo(ValidationFailure.Kind.CONFLICT));
        assertThat(apply(deleted, BookAggregate.restoreBook(new RestoreBook(BOOK_ID), Optional.of(deleted))).deleted).isFalse();
    }

    @Test
    void scheduling_a_sale_registers_the_discount_start_and_end() {
        // Given
        var book = existingBook();

        // When
        var decision = BookAggregate.scheduleBookSale(new ScheduleBookSale(BOOK_ID, new BigDecimal("25"), SALE_START, SALE_END), Optional.of(book));

        // Then
        assertThat(decision.events()).singleElement().isInstanceOf(BookSaleScheduled.class);
        assertThat(decision.deferredCommands()).extracting(deferred -> deferred.idempotencyKey)
                                               .containsExactly("book-sale:book-1:2026-06-01T00:00:00Z:apply",
                                                                "book-sale:book-1:2026-06-01T00:00:00Z:remove");
        assertThat(decision.deferredCommands()).extracting(deferred -> deferred.dueAt).containsExactly(SALE_START, SALE_END);
        assertThat(decision.deferredCommands().get(0).command).isInstanceOf(ApplyBookDiscount.class);
        assertThat(decision.deferredCommands().get(1).command).isInstanceOf(RemoveBookDiscount.class);
    }

    @Test
    void sale_percentage_must_be_between_0_and_100_and_start_before_end() {
        // Given
        var book = Optional.of(existingBook());

        // Then
        assertThat(BookAggregate.scheduleBookSale(new ScheduleBookSale(BOOK_ID, BigDecimal.ZERO, SALE_START, SALE_END), book).isRejected()).isTrue();
        assertThat(BookAggregate.scheduleBookSale(new ScheduleBookSale(BOOK_ID, new BigDecimal("100"), SALE_START, SALE_END), book).isRejected()).isTrue();
        assertThat(BookAggregate.scheduleBookSale(new ScheduleBookSale(BOOK_ID, new BigDecimal("99.5"), SALE_START, SALE_END), book).isRejected()).isFalse();
        assertThat(BookAggregate.scheduleBookSale(new ScheduleBookSale(BOOK_ID, BigDecimal.TEN, SALE_END, SALE_START), book).rejection())
                .hasValueSatisfying(failure -> assertThat(failure.fieldErrors).containsKey("start"));
    }

    @Test
    void overlapping_sales_are_a_conflict() {
        // Given
        var book = withSale(existingBook());

        // When
        var decision = BookAggregate.scheduleBookSale(new ScheduleBookSale(BOOK_ID, BigDecimal.TEN, SALE_END.minusDays(1), SALE_END.plusDays(3)), Optional.of(book));

        // Then
        assertThat(decision.rejection()).hasValueSatisfying(failure -> assertThat(failure.kind).isEqualTo(ValidationFailure.Kind.CONFLICT));
    }

    @Test
    void cancelling_an_unknown_sale_is_not_found() {
        // When
        var decision = BookAggregate.cancelBookSale(new CancelBookSale(BOOK_ID, SALE_START), Optional.of(existingBook()));

        // Then
        assertThat(decision.rejection()).hasValueSatisfying(failure -> assertThat(failure.kind).isEqualTo(ValidationFailure.Kind.NOT_FOUND));
    }

    @Test
    void applying_and_removing_a_discount_happens_once() {
        // Given
        var book = withSale(existingBook());

        // When
        var applied = apply(book, BookAggregate.applyBookDiscount(new ApplyBookDiscount(BOOK_ID, SALE_START), Optional.of(book)));

        // Then
        assertThat(applied.discountPercentage).isEqualByComparingTo("25");
        assertThat(BookAggregate.applyBookDiscount(new ApplyBookDiscount(BOOK_ID, SALE_START), Optional.of(applied)).isNoChange()).isTrue();

        // When
        var removed = apply(applied, BookAggregate.removeBookDiscount(new RemoveBookDiscount(BOOK_ID, SALE_START), Optional.of(applied)));

        // Then
        assertThat(removed.discountPercentage).isEqualByComparingTo("0");
        assertThat(BookAggregate.removeBookDiscount(new RemoveBookDiscount(BOOK_ID, SALE_START), Optional.of(removed)).isNoChange()).isTrue();
        assertThat(BookAggregate.applyBookDiscount(new ApplyBookDiscount(BOOK_ID, SALE_START), Optional.of(removed)).isNoChange()).isTrue();
    }

    @Test
    void a_cancelled_sale_is_neither_applied_nor_removed() {
        // Given
        var book      = withSale(existingBook());
        var cancelled = apply(book, BookAggregate.cancelBookSale(new CancelBookSale(BOOK_ID, SALE_START), Optional.of(book)));

        // Then
        assertThat(cancelled.sales).isEmpty();
        assertThat(BookAggregate.applyBookDiscount(new ApplyBookDiscount(BOOK_ID, SALE_START), Optional.of(cancelled)).isNoChange()).isTrue();
        assertThat(BookAggregate.removeBookDiscount(new RemoveBookDiscount(BOOK_ID, SALE_START), Optional.of(cancelled)).isNoChange()).isTrue();
    }

    @Test
    void cancelling_the_active_sale_removes_its_discount() {
        // Given
        var book    = withSale(existingBook());
        var applied = apply(book, BookAggregate.applyBookDiscount(new ApplyBookDiscount(BOOK_ID, SALE_START), Optional.of(book)));

        // When
        var decision = BookAggregate.cancelBookSale(new CancelBookSale(BOOK_ID, SALE_START), Optional.of(applied));

        // Then
        assertThat(decision.events()).hasSize(2);
        assertThat(decision.events().get(1)).isInstanceOfSatisfying(BookDiscountUpdated.class, event -> assertThat(event.isRemoval()).isTrue());
        assertThat(apply(applied, decision).discountPercentage).isEqualByComparingTo("0");
    }

    private static BookDetails dune() {
        return BookDetails.of("Dune", "978-0-441-17271-9", "en").withAuthors("author-1").withPublisher("publisher-1");
    }

    private static BookState existingBook() {
        return BookState.initial(BOOK_ID).apply(new BookAdded(BOOK_ID, dune(), PRICES));
    }

    private static BookState withSale(BookState book) {
        return apply(book, BookAggregate.scheduleBookSale(new ScheduleBookSale(BOOK_ID, new BigDecimal("25"), SALE_START, SALE_END), Optional.of(book)));
    }

    private static BookState apply(BookState state, Decision decision) {
        assertThat(decision.isRejected()).as("%s", decision).isFalse();
        var result = state;
        for (var event : decision.events()) {
            result = result.apply((BookEvent) event);
        }
        return result;
    }
}
