package dk.cloudcreate.bookstore.domain.book;

import java.math.BigDecimal;
import java.time.*;
import java.util.Objects;

/**
 * A discount of {@link #getPercentage()} percent between {@link #getStart()} (inclusive) and {@link #getEnd()} (exclusive).
 * A sale is identified by its start within a book
 */
public final class BookSale {
    private BigDecimal     percentage;
    private OffsetDateTime start;
    private OffsetDateTime end;

    BookSale() {
    }

    public BookSale(BigDecimal percentage, OffsetDateTime start, OffsetDateTime end) {
        this.percentage = percentage;
        this.start = start.withOffsetSameInstant(ZoneOffset.UTC);
        this.end = end.withOffsetSameInstant(ZoneOffset.UTC);
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

    public boolean startsAt(OffsetDateTime instant) {
        return start.toInstant().equals(instant.toInstant());
    }

    public boolean overlaps(OffsetDateTime otherStart, OffsetDateTime otherEnd) {
        return otherStart.isBefore(end) && otherEnd.isAfter(start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BookSale)) return false;
        var that = (BookSale) o;
        return percentage.compareTo(that.percentage) == 0 &&
                start.toInstant().equals(that.start.toInstant()) &&
                end.toInstant().equals(that.end.toInstant());
    }

    @Override
    public int hashCode() {
        return Objects.hash(percentage.stripTrailingZeros(), start.toInstant(), end.toInstant());
    }

    @Override
    public String toString() {
        return percentage + "% [" + start + ", " + end + ")";
    }
}
