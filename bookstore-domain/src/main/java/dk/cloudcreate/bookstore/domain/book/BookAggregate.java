package dk.cloudcreate.bookstore.domain.book;

import dk.cloudcreate.bookstore.aggregates.AggregateDefinition;
import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.domain.Rules;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;

import static dk.cloudcreate.bookstore.domain.book.BookCommands.*;
import static dk.cloudcreate.bookstore.domain.book.BookEvent.*;

/**
 * Command handlers of the Book aggregate
 */
public final class BookAggregate {
    public static final AggregateDefinition<BookState, BookEvent> DEFINITION =
            AggregateDefinition.of("Book",
                                   BookEvent.class,
                                   streamId -> BookState.initial(streamId.toString()),
                                   BookState::apply);

    public static final int MAX_TITLE_LENGTH       = 500;
    public static final int MAX_DESCRIPTION_LENGTH = 5000;

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private BookAggregate() {
    }

    public static List<Class<?>> eventTypes() {
        return List.of(BookAdded.class,
                       BookUpdated.class,
                       BookPriceChanged.class,
                       BookCoverUpdated.class,
                       BookSoftDeleted.class,
                       BookRestored.class,
                       BookSaleScheduled.class,
                       BookSaleCancelled.class,
                       BookDiscountUpdated.class);
    }

    public static CommandHandlerRegistry.Builder registerHandlers(CommandHandlerRegistry.Builder builder) {
        return builder.register(AddBook.class, DEFINITION, BookAggregate::addBook)
                      .register(UpdateBook.class, DEFINITION, BookAggregate::updateBook)
                      .register(ChangeBookPrice.class, DEFINITION, BookAggregate::changeBookPrice)
                      .register(UpdateBookCover.class, DEFINITION, BookAggregate::updateBookCover)
                      .register(SoftDeleteBook.class, DEFINITION, BookAggregate::softDeleteBook)
                      .register(RestoreBook.class, DEFINITION, BookAggregate::restoreBook)
                      .register(ScheduleBookSale.class, DEFINITION, BookAggregate::scheduleBookSale)
                      .register(CancelBookSale.class, DEFINITION, BookAggregate::cancelBookSale)
                      .register(ApplyBookDiscount.class, DEFINITION, BookAggregate::applyBookDiscount)
                      .register(RemoveBookDiscount.class, DEFINITION, BookAggregate::removeBookDiscount);
    }

    public static String applyDiscountKey(String bookId, OffsetDateTime saleStart) {
        return "book-sale:" + bookId + ":" + saleStart.toInstant() + ":apply";
    }

    public static String removeDiscountKey(String bookId, OffsetDateTime saleStart) {
        return "book-sale:" + bookId + ":" + saleStart.toInstant() + ":remove";
    }

    static Decision addBook(AddBook command, Optional<BookState> state) {
        if (state.isPresent()) {
            return Decision.rejected(ValidationFailure.conflict("Book already exists"));
        }
        var validation = ValidationFailure.builder();
        validateDetails(validation, command.getDetails());
        Rules.prices(validation, command.getPrices());
        if (validation.hasErrors()) {
            return Decision.rejected(validation.build());
        }
        return Decision.events(new BookAdded(command.getBookId(), command.getDetails(), command.getPrices()));
    }

    static Decision updateBook(UpdateBook command, Optional<BookState> state) {
        if (isMissing(state)) {
            return notFound();
        }
        var validation = ValidationFailure.builder();
        validateDetails(validation, command.getDetails());
        if (validation.hasErrors()) {
            return Decision.rejected(validation.build());
        }
        if (command.getDetails().equals(state.get().details)) {
            return Decision.noChange();
        }
        return Decision.events(new BookUpdated(command.getBookId(), command.getDetails()));
    }

    static Decision changeBookPrice(ChangeBookPrice command, Optional<BookState> state) {
        if (isMissing(state)) {
            return notFound();
        }
        var validation = ValidationFailure.builder();
        Rules.prices(validation, command.getPrices());
        if (validation.hasErrors()) {
            return Decision.rejected(validation.build());
        }
        if (samePrices(command.getPrices(), state.get().prices)) {
            return Decision.noChange();
        }
        return Decision.events(new BookPriceChanged(command.getBookId(), command.getPrices()));
    }

    static Decision updateBookCover(UpdateBookCover command, Optional<BookState> state) {
        if (isMissing(state)) {
            return notFound();
        }
        if (Rules.isBlank(command.getCoverImageUrl())) {
            return Decision.rejected(ValidationFailure.invalid("coverImageUrl", "Cover image URL is required"));
        }
        if (state.get().coverImageUrl.equals(Optional.of(command.getCoverImageUrl()))) {
            return Decision.noChange();
        }
        return Decision.events(new BookCoverUpdated(command.getBookId(), command.getCoverImageUrl()));
    }

    static Decision softDeleteBook(SoftDeleteBook command, Optional<BookState> state) {
        if (state.isEmpty()) {
            return notFound();
        }
        if (state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Book is already deleted"));
        }
        return Decision.events(new BookSoftDeleted(command.getBookId()));
    }

    static Decision restoreBook(RestoreBook command, Optional<BookState> state) {
        if (state.isEmpty()) {
            return notFound();
        }
        if (!state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Book is not deleted"));
        }
        return Decision.events(new BookRestored(command.getBookId()));
    }

    static Decision scheduleBookSale(ScheduleBookSale command, Optional<BookState> state) {
        if (isMissing(state)) {
            return notFound();
        }
        var percentage = command.getPercentage();
        var start      = command.getStart();
        var end        = command.getEnd();
        var validation = ValidationFailure.builder()
                                          .fieldErrorIf(percentage == null || percentage.signum() <= 0 || percentage.compareTo(ONE_HUNDRED) >= 0,
                                                        "percentage", "Sale percentage must be greater than 0 and less than 100")
                                          .fieldErrorIf(start == null, "start", "Sale start is required")
                                          .fieldErrorIf(end == null, "end", "Sale end is required")
                                          .fieldErrorIf(start != null && end != null && !start.isBefore(end), "start", "Sale start time must be before end time");
        if (validation.hasErrors()) {
            return Decision.rejected(validation.build());
        }
        if (state.get().sales.stream().anyMatch(sale -> sale.overlaps(start, end))) {
            return Decision.rejected(ValidationFailure.conflict("Sale period overlaps with an existing sale"));
        }
        var bookId = command.getBookId();
        var sale   = new BookSale(percentage, start, end);
        return Decision.events(new BookSaleScheduled(bookId, sale))
                       .andSchedule(new DeferredCommand(sale.getStart(), new ApplyBookDiscount(bookId, sale.getStart()), applyDiscountKey(bookId, sale.getStart())))
                       .andSchedule(new DeferredCommand(sale.getEnd(), new RemoveBookDiscount(bookId, sale.getStart()), removeDiscountKey(bookId, sale.getStart())));
    }

    static Decision cancelBookSale(CancelBookSale command, Optional<BookState> state) {
        if (isMissing(state)) {
            return notFound();
        }
        if (command.getSaleStart() == null || state.get().saleStartingAt(command.getSaleStart()).isEmpty()) {
            return Decision.rejected(ValidationFailure.notFound("No sale found with the specified start time"));
        }
        var bookId    = command.getBookId();
        var saleStart = command.getSaleStart();
        if (isActiveSale(state.get(), saleStart)) {
            return Decision.events(new BookSaleCancelled(bookId, saleStart),
                                   new BookDiscountUpdated(bookId, BigDecimal.ZERO, saleStart));
        }
        return Decision.events(new BookSaleCancelled(bookId, saleStart));
    }

    static Decision applyBookDiscount(ApplyBookDiscount command, Optional<BookState> state) {
        if (state.isEmpty()) {
            return notFound();
        }
        var book      = state.get();
        var saleStart = command.getSaleStart();
        var sale      = book.saleStartingAt(saleStart);
        if (sale.isEmpty() || isActiveSale(book, saleStart) || book.endedSales.contains(saleStart.toInstant())) {
            // Cancelled, already applied or already over
            return Decision.noChange();
        }
        return Decision.events(new BookDiscountUpdated(command.getBookId(), sale.get().getPercentage(), sale.get().getStart()));
    }

    static Decision removeBookDiscount(RemoveBookDiscount command, Optional<BookState> state) {
        if (state.isEmpty()) {
            return notFound();
        }
        var book      = state.get();
        var saleStart = command.getSaleStart();
        if (book.endedSales.contains(saleStart.toInstant())) {
            return Decision.noChange();
        }
        if (!isActiveSale(book, saleStart) && book.saleStartingAt(saleStart).isEmpty()) {
            // Cancelled before it started
            return Decision.noChange();
        }
        // Also ends a sale whose discount was never applied, so a late ApplyBookDiscount stays a no-op
        return Decision.events(new BookDiscountUpdated(command.getBookId(), BigDecimal.ZERO, saleStart.withOffsetSameInstant(ZoneOffset.UTC)));
    }

    private static boolean isActiveSale(BookState book, OffsetDateTime saleStart) {
        return book.activeSale.map(active -> active.equals(saleStart.toInstant())).orElse(false);
    }

    private static void validateDetails(ValidationFailure.Builder validation, BookDetails details) {
        if (details == null) {
            validation.fieldError("details", "Book details are required");
            return;
        }
        Rules.requiredText(validation, "title", "Title", details.title, MAX_TITLE_LENGTH);
        validation.fieldErrorIf(!Rules.isValidIsbn(details.isbn), "isbn", "ISBN must be 10 or 13 digits");
        validation.fieldErrorIf(Rules.isBlank(details.language), "language", "Language is required");
        details.descriptions.forEach((language, description) ->
                                             Rules.optionalText(validation, "descriptions." + language, "Description for language '" + language + "'",
                                                                description, MAX_DESCRIPTION_LENGTH));
    }

    private static boolean samePrices(Map<String, BigDecimal> requested, Map<String, BigDecimal> current) {
        if (!requested.keySet().equals(current.keySet())) {
            return false;
        }
        return requested.entrySet().stream().allMatch(entry -> entry.getValue().compareTo(current.get(entry.getKey())) == 0);
    }

    private static boolean isMissing(Optional<BookState> state) {
        return state.isEmpty() || state.get().deleted;
    }

    private static Decision notFound() {
        return Decision.rejected(ValidationFailure.notFound("Book not found"));
    }
}
