package dk.cloudcreate.bookstore.domain.book;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;

/**
 * The events of a book stream. The stream id is the book id
 */
public abstract class BookEvent {
    private String bookId;

    protected BookEvent() {
    }

    protected BookEvent(String bookId) {
        this.bookId = bookId;
    }

    public String getBookId() {
        return bookId;
    }

    public abstract <R> R accept(BookEventVisitor<R> visitor);

    /**
     * Fields shared by {@link BookAdded} and {@link BookUpdated}
     */
    public abstract static class BookDetailsEvent extends BookEvent {
        private String              title;
        private String              isbn;
        private String              language;
        private Map<String, String> descriptions;
        private LocalDate           publicationDate;
        private String              publisherId;
        private List<String>        authorIds;
        private List<String>        categoryIds;

        protected BookDetailsEvent() {
        }

        protected BookDetailsEvent(String bookId, BookDetails details) {
            super(bookId);
            this.title = details.title;
            this.isbn = details.isbn;
            this.language = details.language;
            this.descriptions = new TreeMap<>(details.descriptions);
            this.publicationDate = details.publicationDate;
            this.publisherId = details.publisherId;
            this.authorIds = new ArrayList<>(details.authorIds);
            this.categoryIds = new ArrayList<>(details.categoryIds);
        }

        public BookDetails details() {
            return new BookDetails(title, isbn, language, descriptions, publicationDate, publisherId, authorIds, categoryIds);
        }
    }

    public static class BookAdded extends BookDetailsEvent {
        private Map<String, BigDecimal> prices;

        public BookAdded() {
        }

        public BookAdded(String bookId, BookDetails details, Map<String, BigDecimal> prices) {
            super(bookId, details);
            this.prices = new TreeMap<>(prices);
        }

        public Map<String, BigDecimal> getPrices() {
            return prices;
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BookUpdated extends BookDetailsEvent {
        public BookUpdated() {
        }

        public BookUpdated(String bookId, BookDetails details) {
            super(bookId, details);
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BookPriceChanged extends BookEvent {
        private Map<String, BigDecimal> prices;

        public BookPriceChanged() {
        }

        public BookPriceChanged(String bookId, Map<String, BigDecimal> prices) {
            super(bookId);
            this.prices = new TreeMap<>(prices);
        }

        public Map<String, BigDecimal> getPrices() {
            return prices;
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BookCoverUpdated extends BookEvent {
        private String coverImageUrl;

        public BookCoverUpdated() {
        }

        public BookCoverUpdated(String bookId, String coverImageUrl) {
            super(bookId);
            this.coverImageUrl = coverImageUrl;
        }

        public String getCoverImageUrl() {
            return coverImageUrl;
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BookSoftDeleted extends BookEvent {
        public BookSoftDeleted() {
        }

        public BookSoftDeleted(String bookId) {
            super(bookId);
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BookRestored extends BookEvent {
        public BookRestored() {
        }

        public BookRestored(String bookId) {
            super(bookId);
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BookSaleScheduled extends BookEvent {
        private BookSale sale;

        public BookSaleScheduled() {
        }

        public BookSaleScheduled(String bookId, BookSale sale) {
            super(bookId);
            this.sale = sale;
        }

        public BookSale getSale() {
            return sale;
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BookSaleCancelled extends BookEvent {
        private OffsetDateTime saleStart;

        public BookSaleCancelled() {
        }

        public BookSaleCancelled(String bookId, OffsetDateTime saleStart) {
            super(bookId);
            this.saleStart = saleStart;
        }

        public OffsetDateTime getSaleStart() {
            return saleStart;
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * The discount of the sale starting at {@link #getSaleStart()} was applied (percentage above zero) or removed
     * (percentage zero)
     */
    public static class BookDiscountUpdated extends BookEvent {
        private BigDecimal     discountPercentage;
        private OffsetDateTime saleStart;

        public BookDiscountUpdated() {
        }

        public BookDiscountUpdated(String bookId, BigDecimal discountPercentage, OffsetDateTime saleStart) {
            super(bookId);
            this.discountPercentage = discountPercentage;
            this.saleStart = saleStart;
        }

        public BigDecimal getDiscountPercentage() {
            return discountPercentage;
        }

        public OffsetDateTime getSaleStart() {
            return saleStart;
        }

        public boolean isRemoval() {
            return discountPercentage.signum() == 0;
        }

        @Override
        public <R> R accept(BookEventVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
