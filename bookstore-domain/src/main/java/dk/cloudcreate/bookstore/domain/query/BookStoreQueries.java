package dk.cloudcreate.bookstore.domain.query;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.domain.projection.*;
import dk.cloudcreate.bookstore.projection.query.*;

import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Read side of the bookstore. Soft deleted entities are hidden unless <code>includeDeleted</code> is requested
 */
public class BookStoreQueries {
    private final ProjectionQueries queries;

    public BookStoreQueries(ProjectionQueries queries) {
        this.queries = checkNotNull(queries, "No queries provided");
    }

    public Optional<QueryResult<BookSearchDocument>> getBook(TenantId tenantId, String bookId) {
        return active(queries.findById(BookSearchProjection.NAME, tenantId, BookSearchDocument.class, bookId));
    }

    public List<QueryResult<BookSearchDocument>> listBooks(TenantId tenantId, boolean includeDeleted) {
        return filter(queries.findAll(BookSearchProjection.NAME, tenantId, BookSearchDocument.class), includeDeleted);
    }

    /**
     * Case insensitive search in title, ISBN, author names and publisher name
     */
    public List<QueryResult<BookSearchDocument>> searchBooks(TenantId tenantId, String text) {
        return filter(queries.search(BookSearchProjection.NAME, tenantId, BookSearchDocument.class, book -> book.matches(text)), false);
    }

    public List<QueryResult<BookSearchDocument>> booksByAuthor(TenantId tenantId, String authorId) {
        checkNotNull(authorId, "No authorId provided");
        return filter(queries.search(BookSearchProjection.NAME, tenantId, BookSearchDocument.class, book -> book.getAuthorIds().contains(authorId)), false);
    }

    public List<QueryResult<BookSearchDocument>> booksInCategory(TenantId tenantId, String categoryId) {
        checkNotNull(categoryId, "No categoryId provided");
        return filter(queries.search(BookSearchProjection.NAME, tenantId, BookSearchDocument.class, book -> book.getCategoryIds().contains(categoryId)), false);
    }

    public Optional<QueryResult<AuthorDocument>> getAuthor(TenantId tenantId, String authorId) {
        return active(queries.findById(AuthorProjection.NAME, tenantId, AuthorDocument.class, authorId));
    }

    public List<QueryResult<AuthorDocument>> listAuthors(TenantId tenantId, boolean includeDeleted) {
        return filter(queries.findAll(AuthorProjection.NAME, tenantId, AuthorDocument.class), includeDeleted);
    }

    public Optional<QueryResult<CategoryDocument>> getCategory(TenantId tenantId, String categoryId) {
        return active(queries.findById(CategoryProjection.NAME, tenantId, CategoryDocument.class, categoryId));
    }

    public List<QueryResult<CategoryDocument>> listCategories(TenantId tenantId, boolean includeDeleted) {
        return filter(queries.findAll(CategoryProjection.NAME, tenantId, CategoryDocument.class), includeDeleted);
    }

    public Optional<QueryResult<PublisherDocument>> getPublisher(TenantId tenantId, String publisherId) {
        return active(queries.findById(PublisherProjection.NAME, tenantId, PublisherDocument.class, publisherId));
    }

    public List<QueryResult<PublisherDocument>> listPublishers(TenantId tenantId, boolean includeDeleted) {
        return filter(queries.findAll(PublisherProjection.NAME, tenantId, PublisherDocument.class), includeDeleted);
    }

    /**
     * @return the statistics, or an empty statistics document if the author has no active books
     */
    public AuthorStatistics authorStatistics(TenantId tenantId, String authorId) {
        return queries.findById(AuthorStatisticsProjection.NAME, tenantId, AuthorStatistics.class, authorId)
                      .map(result -> result.document)
                      .orElseGet(() -> AuthorStatistics.empty(authorId));
    }

    /**
     * @return the statistics, or an empty statistics document if no active book is filed under the category
     */
    public CategoryStatistics categoryStatistics(TenantId tenantId, String categoryId) {
        return queries.findById(CategoryStatisticsProjection.NAME, tenantId, CategoryStatistics.class, categoryId)
                      .map(result -> result.document)
                      .orElseGet(() -> CategoryStatistics.empty(categoryId));
    }

    public PublisherStatistics publisherStatistics(TenantId tenantId, String publisherId) {
        return queries.findById(PublisherStatisticsProjection.NAME, tenantId, PublisherStatistics.class, publisherId)
                      .map(result -> result.document)
                      .orElseGet(() -> PublisherStatistics.empty(publisherId));
    }

    private static <T> Optional<QueryResult<T>> active(Optional<QueryResult<T>> result) {
        return result.filter(found -> !found.softDeleted);
    }

    private static <T> List<QueryResult<T>> filter(List<QueryResult<T>> results, boolean includeDeleted) {
        if (includeDeleted) {
            return results;
        }
        return results.stream().filter(result -> !result.softDeleted).collect(Collectors.toList());
    }
}
