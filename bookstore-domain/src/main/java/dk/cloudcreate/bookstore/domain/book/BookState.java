package dk.cloudcreate.bookstore.domain.book;

import dk.cloudcreate.bookstore.domain.book.BookEvent.*;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;

/**
 * Immutable state of a book. Every {@link #apply(BookEvent)} returns a new instance
 */
public final class BookState {
    public final String                  bookId;
    public final BookDetails             details;
    public final Map<String, BigDecimal> prices;
    public final Optional<String>        coverImageUrl;
    public final boolean                 deleted;
    /**
     * Scheduled sales that weren't cancelled, in start order
     */
    public final List<BookSale>          sales;
    public final BigDecimal              discountPercentage;
    /**
     * Start of the sale whose discount is currently applied
     */
    public final Optional<Instant>       activeSale;
    /**
     * Starts of the sales whose discount has been removed
     */
    public final Set<Instant>            endedSales;

    private BookState(String bookId,
                      BookDetails details,
                      Map<String, BigDecimal> prices,
                      Optional<String> coverImageUrl,
                      boolean deleted,
                      List<BookSale> sales,
                      BigDecimal discountPercentage,
                      Optional<Instant> activeSale,
                      Set<Instant> endedSales) {
        this.bookId = bookId;
        this.details = details;
        this.prices = Collections.unmodifiableMap(new TreeMap<>(prices));
        this.coverImageUrl = coverImageUrl;
        this.deleted = deleted;
        this.sales = List.copyOf(sales);
        this.discountPercentage = discountPercentage;
        this.activeSale = activeSale;
        this.endedSales = Set.copyOf(endedSales);
    }

    public static BookState initial(String bookId) {
        return new BookState(bookId, null, Map.of(), Optional.empty(), false, List.of(), BigDecimal.ZERO, Optional.empty(), Set.of());
    }

    public Optional<BookSale> saleStartingAt(OffsetDateTime start) {
        return sales.stream().filter(sale -> sale.startsAt(start)).findFirst();
    }

    public BookState apply(BookEvent event) {
        return event.accept(new BookEventVisitor<>() {
            @Override
            public BookState visit(BookAdded e) {
                return new BookState(bookId, e.details(), e.getPrices(), Optional.empty(), false, List.of(), BigDecimal.ZERO, Optional.empty(), Set.of());
            }

            @Override
            public BookState visit(BookUpdated e) {
                return new BookState(bookId, e.details(), prices, coverImageUrl, deleted, sales, discountPercentage, activeSale, endedSales);
            }

            @Override
            public BookState visit(BookPriceChanged e) {
                return new BookState(bookId, details, e.getPrices(), coverImageUrl, deleted, sales, discountPercentage, activeSale, endedSales);
            }

            @Override
            public BookState visit(BookCoverUpdated e) {
                return new BookState(bookId, details, prices, Optional.of(e.getCoverImageUrl()), deleted, sales, discountPercentage, activeSale, endedSales);
            }

            @Override
            public BookState visit(BookSoftDeleted e) {
                return new BookState(bookId, details, prices, coverImageUrl, true, sales, discountPercentage, activeSale, endedSales);
            }

            @Override
            public BookState visit(BookRestored e) {
                return new BookState(bookId, details, prices, coverImageUrl, false, sales, discountPercentage, activeSale, endedSales);
            }

            @Override
            public BookState visit(BookSaleScheduled e) {
                var updatedSales = new ArrayList<BookSale>();
                sales.stream().filter(sale -> !sale.startsAt(e.getSale().getStart())).forEach(updatedSales::add);
                updatedSales.add(e.getSale());
                updatedSales.sort(Comparator.comparing(BookSale::getStart));
                return new BookState(bookId, details, prices, coverImageUrl, deleted, updatedSales, discountPercentage, activeSale, endedSales);
            }

            @Override
            public BookState visit(BookSaleCancelled e) {
                var updatedSales = new ArrayList<BookSale>();
                sales.stream().filter(sale -> !sale.startsAt(e.getSaleStart())).forEach(updatedSales::add);
                return new BookState(bookId, details, prices, coverImageUrl, deleted, updatedSales, discountPercentage, activeSale, endedSales);
            }

            @Override
            public BookState visit(BookDiscountUpdated e) {
                var saleStart = e.getSaleStart().toInstant();
                if (e.isRemoval()) {
                    var updatedEndedSales = new HashSet<>(endedSales);
                    updatedEndedSales.add(saleStart);
                    return new BookState(bookId, details, prices, coverImageUrl, deleted, sales, BigDecimal.ZERO, Optional.empty(), updatedEndedSales);
                }
                return new BookState(bookId, details, prices, coverImageUrl, deleted, sales, e.getDiscountPercentage(), Optional.of(saleStart), endedSales);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BookState)) return false;
        var that = (BookState) o;
        return deleted == that.deleted &&
                bookId.equals(that.bookId) &&
                Objects.equals(details, that.details) &&
                prices.equals(that.prices) &&
                coverImageUrl.equals(that.coverImageUrl) &&
                sales.equals(that.sales) &&
                discountPercentage.compareTo(that.discountPercentage) == 0 &&
                activeSale.equals(that.activeSale) &&
                endedSales.equals(that.endedSales);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, details, prices, deleted, sales, activeSale);
    }

    @Override
    public String toString() {
        return "BookState{" + bookId + ", " + details + ", prices=" + prices + ", deleted=" + deleted + ", sales=" + sales +
                ", discountPercentage=" + discountPercentage + '}';
    }
}
