package dk.cloudcreate.bookstore.domain.book;

import dk.cloudcreate.bookstore.aggregates.command.Command;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;

public final class BookCommands {
    public static final List<Class<? extends Command>> ALL = List.of(AddBook.class,
                                                                     UpdateBook.class,
                                                                     ChangeBookPrice.class,
                                                                     UpdateBookCover.class,
                                                                     SoftDeleteBook.class,
                                                                     RestoreBook.class,
                                                                     ScheduleBookSale.class,
                                                                     CancelBookSale.class,
                                                                     ApplyBookDiscount.class,
                                                                     RemoveBookDiscount.class);

    private BookCommands() {
    }

    public abstract static class BookCommand implements Command {
        private String bookId;

        protected BookCommand() {
        }

        protected BookCommand(String bookId) {
            this.bookId = bookId;
        }

        public String getBookId() {
            return bookId;
        }

        @Override
        public StreamId streamId() {
            return StreamId.of(bookId);
        }
    }

    public static class AddBook extends BookCommand {
        private BookDetails             details;
        private Map<String, BigDecimal> prices;

        AddBook() {
        }

        public AddBook(String bookId, BookDetails details, Map<String, BigDecimal> prices) {
            super(bookId);
            this.details = details;
            this.prices = prices;
        }

        public BookDetails getDetails() {
            return details;
        }

        public Map<String, BigDecimal> getPrices() {
            return prices;
        }
    }

    public static class UpdateBook extends BookCommand {
        private BookDetails details;

        UpdateBook() {
        }

        public UpdateBook(String bookId, BookDetails details) {
            super(bookId);
            this.details = details;
        }

        public BookDetails getDetails() {
            return details;
        }
    }

    public static class ChangeBookPrice extends BookCommand {
        private Map<String, BigDecimal> prices;

        ChangeBookPrice() {
        }

        public ChangeBookPrice(String bookId, Map<String, BigDecimal> prices) {
            super(bookId);
            this.prices = prices;
        }

        public Map<String, BigDecimal> getPrices() {
            return prices;
        }
    }

    public static class UpdateBookCover extends BookCommand {
        private String coverImageUrl;

        UpdateBookCover() {
        }

        public UpdateBookCover(String bookId, String coverImageUrl) {
            super(bookId);
            this.coverImageUrl = coverImageUrl;
        }

        public String getCoverImageUrl() {
            return coverImageUrl;
        }
    }

    public static class SoftDeleteBook extends BookCommand {
        SoftDeleteBook() {
        }

        public SoftDeleteBook(String bookId) {
            super(bookId);
        }
    }

    public static class RestoreBook extends BookCommand {
        RestoreBook() {
        }

        public RestoreBook(String bookId) {
            super(bookId);
        }
    }

    public static class ScheduleBookSale extends BookCommand {
        private BigDecimal     percentage;
        private OffsetDateTime start;
        private OffsetDateTime end;

        ScheduleBookSale() {
        }

        public ScheduleBookSale(String bookId, BigDecimal percentage, OffsetDateTime start, OffsetDateTime end) {
            super(bookId);
            this.percentage = percentage;
            this.start = start;
            this.end = end;
        }

        public BigDecimal getPercentage() {
            return percentage;
        }

        public OffsetDateTime getStart() {
            return start;
        }

        public OffsetDateTime getEnd() {
            return end;
        }
    }

    public static class CancelBookSale extends BookCommand {
        private OffsetDateTime saleStart;

        CancelBookSale() {
        }

        public CancelBookSale(String bookId, OffsetDateTime saleStart) {
            super(bookId);
            this.saleStart = saleStart;
        }

        public OffsetDateTime getSaleStart() {
            return saleStart;
        }
    }

    /**
     * Scheduled at the start of a sale. Takes the percentage from the sale, so a redelivery after the sale was cancelled
     * or already applied changes nothing
     */
    public static class ApplyBookDiscount extends BookCommand {
        private OffsetDateTime saleStart;

        ApplyBookDiscount() {
        }

        public ApplyBookDiscount(String bookId, OffsetDateTime saleStart) {
            super(bookId);
            this.saleStart = saleStart;
        }

        public OffsetDateTime getSaleStart() {
            return saleStart;
        }
    }

    /**
     * Scheduled at the end of a sale
     */
    public static class RemoveBookDiscount extends BookCommand {
        private OffsetDateTime saleStart;

        RemoveBookDiscount() {
        }

        public RemoveBookDiscount(String bookId, OffsetDateTime saleStart) {
            super(bookId);
            this.saleStart = saleStart;
        }

        public OffsetDateTime getSaleStart() {
            return saleStart;
        }
    }
}
