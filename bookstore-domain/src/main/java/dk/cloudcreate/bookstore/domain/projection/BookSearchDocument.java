package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.book.BookDetails;
import dk.cloudcreate.bookstore.projection.SoftDeletable;

import java.math.*;
import java.time.*;
import java.util.*;
import java.util.stream.*;

/**
 * A book with the names of its authors and publisher, and the prices after the active sale discount.<br>
 * The fields are only changed by {@link BookSearchProjection} while it applies an event
 */
public class BookSearchDocument implements SoftDeletable {
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private String                  bookId;
    private String                  title;
    private String                  isbn;
    private String                  language;
    private Map<String, String>     descriptions = new TreeMap<>();
    private LocalDate               publicationDate;
    private String                  publisherId;
    private String                  publisherName;
    private List<String>            authorIds    = new ArrayList<>();
    private List<String>            authorNames  = new ArrayList<>();
    private List<String>            categoryIds  = new ArrayList<>();
    private Map<String, BigDecimal> prices       = new TreeMap<>();
    private Map<String, BigDecimal> currentPrices = new TreeMap<>();
    private BigDecimal              discountPercentage = BigDecimal.ZERO;
    private String                  coverImageUrl;
    private boolean                 deleted;
    private String                  searchText;
    private OffsetDateTime          lastModified;

    BookSearchDocument() {
    }

    BookSearchDocument(String bookId) {
        this.bookId = bookId;
    }

    public String getBookId() {
        return bookId;
    }

    public String getTitle() {
        return title;
    }

    public String getIsbn() {
        return isbn;
    }

    public String getLanguage() {
        return language;
    }

    public Map<String, String> getDescriptions() {
        return Collections.unmodifiableMap(descriptions);
    }

    public LocalDate getPublicationDate() {
        return publicationDate;
    }

    public Optional<String> getPublisherId() {
        return Optional.ofNullable(publisherId);
    }

    public Optional<String> getPublisherName() {
        return Optional.ofNullable(publisherName);
    }

    public List<String> getAuthorIds() {
        return Collections.unmodifiableList(authorIds);
    }

    public List<String> getAuthorNames() {
        return Collections.unmodifiableList(authorNames);
    }

    public List<String> getCategoryIds() {
        return Collections.unmodifiableList(categoryIds);
    }

    /**
     * @return list prices per currency
     */
    public Map<String, BigDecimal> getPrices() {
        return Collections.unmodifiableMap(prices);
    }

    /**
     * @return prices per currency after the active discount
     */
    public Map<String, BigDecimal> getCurrentPrices() {
        return Collections.unmodifiableMap(currentPrices);
    }

    public BigDecimal getDiscountPercentage() {
        return discountPercentage;
    }

    public Optional<String> getCoverImageUrl() {
        return Optional.ofNullable(coverImageUrl);
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    /**
     * @return lower cased title, ISBN, author names and publisher name
     */
    public String getSearchText() {
        return searchText;
    }

    public OffsetDateTime getLastModified() {
        return lastModified;
    }

    public boolean matches(String text) {
        return text == null || text.isBlank() || searchText.contains(text.trim().toLowerCase(Locale.ROOT));
    }

    void details(BookDetails details) {
        this.title = details.title;
        this.isbn = details.isbn;
        this.language = details.language;
        this.descriptions = new TreeMap<>(details.descriptions);
        this.publicationDate = details.publicationDate;
        this.publisherId = details.publisherId;
        this.authorIds = new ArrayList<>(details.authorIds);
        this.categoryIds = new ArrayList<>(details.categoryIds);
    }

    void prices(Map<String, BigDecimal> prices) {
        this.prices = new TreeMap<>(prices);
        recalculateCurrentPrices();
    }

    void discountPercentage(BigDecimal discountPercentage) {
        this.discountPercentage = discountPercentage;
        recalculateCurrentPrices();
    }

    void coverImageUrl(String coverImageUrl) {
        this.coverImageUrl = coverImageUrl;
    }

    void deleted(boolean deleted) {
        this.deleted = deleted;
    }

    void names(List<String> authorNames, String publisherName) {
        this.authorNames = new ArrayList<>(authorNames);
        this.publisherName = publisherName;
        this.searchText = Stream.concat(Stream.of(title, isbn, publisherName), authorNames.stream())
                                .filter(Objects::nonNull)
                                .map(value -> value.toLowerCase(Locale.ROOT))
                                .collect(Collectors.joining(" "));
    }

    void lastModified(OffsetDateTime lastModified) {
        this.lastModified = lastModified;
    }

    private void recalculateCurrentPrices() {
        var factor = ONE_HUNDRED.subtract(discountPercentage).divide(ONE_HUNDRED, 4, RoundingMode.HALF_UP);
        currentPrices = new TreeMap<>();
        prices.forEach((currency, price) -> currentPrices.put(currency, price.multiply(factor).setScale(2, RoundingMode.HALF_UP)));
    }
}
