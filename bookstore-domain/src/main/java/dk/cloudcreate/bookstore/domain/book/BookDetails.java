package dk.cloudcreate.bookstore.domain.book;

import java.time.LocalDate;
import java.util.*;

/**
 * The descriptive part of a book, as supplied by {@link BookCommands.AddBook} and {@link BookCommands.UpdateBook}
 */
public final class BookDetails {
    public final String              title;
    public final String              isbn;
    public final String              language;
    /**
     * Description per language code
     */
    public final Map<String, String> descriptions;
    public final LocalDate           publicationDate;
    public final String              publisherId;
    public final List<String>        authorIds;
    public final List<String>        categoryIds;

    public BookDetails(String title,
                       String isbn,
                       String language,
                       Map<String, String> descriptions,
                       LocalDate publicationDate,
                       String publisherId,
                       List<String> authorIds,
                       List<String> categoryIds) {
        this.title = title;
        this.isbn = isbn;
        this.language = language;
        this.descriptions = descriptions == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(descriptions));
        this.publicationDate = publicationDate;
        this.publisherId = publisherId;
        this.authorIds = authorIds == null ? List.of() : List.copyOf(authorIds);
        this.categoryIds = categoryIds == null ? List.of() : List.copyOf(categoryIds);
    }

    public static BookDetails of(String title, String isbn, String language) {
        return new BookDetails(title, isbn, language, Map.of(), null, null, List.of(), List.of());
    }

    public BookDetails withPublisher(String publisherId) {
        return new BookDetails(title, isbn, language, descriptions, publicationDate, publisherId, authorIds, categoryIds);
    }

    public BookDetails withAuthors(String... authorIds) {
        return new BookDetails(title, isbn, language, descriptions, publicationDate, publisherId, List.of(authorIds), categoryIds);
    }

    public BookDetails withCategories(String... categoryIds) {
        return new BookDetails(title, isbn, language, descriptions, publicationDate, publisherId, authorIds, List.of(categoryIds));
    }

    public BookDetails withTitle(String title) {
        return new BookDetails(title, isbn, language, descriptions, publicationDate, publisherId, authorIds, categoryIds);
    }

    public BookDetails withDescription(String language, String description) {
        var updated = new TreeMap<>(descriptions);
        updated.put(language, description);
        return new BookDetails(title, isbn, this.language, updated, publicationDate, publisherId, authorIds, categoryIds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BookDetails)) return false;
        var that = (BookDetails) o;
        return Objects.equals(title, that.title) &&
                Objects.equals(isbn, that.isbn) &&
                Objects.equals(language, that.language) &&
                descriptions.equals(that.descriptions) &&
                Objects.equals(publicationDate, that.publicationDate) &&
                Objects.equals(publisherId, that.publisherId) &&
                authorIds.equals(that.authorIds) &&
                categoryIds.equals(that.categoryIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, isbn, language, descriptions, publicationDate, publisherId, authorIds, categoryIds);
    }

    @Override
    public String toString() {
        return "BookDetails{'" + title + "', isbn=" + isbn + ", language=" + language + ", publisherId=" + publisherId +
                ", authorIds=" + authorIds + ", categoryIds=" + categoryIds + '}';
    }
}
