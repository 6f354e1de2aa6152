package dk.cloudcreate.bookstore.domain.book;

import dk.cloudcreate.bookstore.domain.book.BookEvent.*;

/**
 * Adding an event to the {@link BookEvent} family adds a method here, so every fold over book events fails to compile until
 * it handles the new event
 */
public interface BookEventVisitor<R> {
    R visit(BookAdded event);

    R visit(BookUpdated event);

    R visit(BookPriceChanged event);

    R visit(BookCoverUpdated event);

    R visit(BookSoftDeleted event);

    R visit(BookRestored event);

    R visit(BookSaleScheduled event);

    R visit(BookSaleCancelled event);

    R visit(BookDiscountUpdated event);
}
