package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.projection.Projection;
import dk.cloudcreate.bookstore.projection.postcommit.CacheInvalidationMappings;

import java.util.List;

/**
 * The read models of the bookstore and the cache tags and notifications their document changes map to
 */
public final class BookStoreProjections {
    public static final String BOOK_TAG_PREFIX                 = "book";
    public static final String BOOKS_LIST_TAG                  = "books";
    public static final String AUTHOR_TAG_PREFIX               = "author";
    public static final String AUTHORS_LIST_TAG                = "authors";
    public static final String CATEGORY_TAG_PREFIX             = "category";
    public static final String CATEGORIES_LIST_TAG             = "categories";
    public static final String PUBLISHER_TAG_PREFIX            = "publisher";
    public static final String PUBLISHERS_LIST_TAG             = "publishers";
    public static final String AUTHOR_STATISTICS_TAG_PREFIX    = "author-statistics";
    public static final String AUTHOR_STATISTICS_LIST_TAG      = "author-statistics";
    public static final String CATEGORY_STATISTICS_TAG_PREFIX  = "category-statistics";
    public static final String CATEGORY_STATISTICS_LIST_TAG    = "category-statistics";
    public static final String PUBLISHER_STATISTICS_TAG_PREFIX = "publisher-statistics";
    public static final String PUBLISHER_STATISTICS_LIST_TAG   = "publisher-statistics";

    private BookStoreProjections() {
    }

    public static List<Projection> all() {
        return List.of(new BookSearchProjection(),
                       new AuthorProjection(),
                       new CategoryProjection(),
                       new PublisherProjection(),
                       new AuthorStatisticsProjection(),
                       new CategoryStatisticsProjection(),
                       new PublisherStatisticsProjection());
    }

    public static CacheInvalidationMappings cacheInvalidationMappings() {
        return CacheInvalidationMappings.builder()
                                        .mapAndNotify(BookSearchProjection.NAME, BookSearchDocument.class, BOOK_TAG_PREFIX, BOOKS_LIST_TAG, "Book")
                                        .ignore(BookSearchProjection.NAME, NameLookup.class)
                                        .mapAndNotify(AuthorProjection.NAME, AuthorDocument.class, AUTHOR_TAG_PREFIX, AUTHORS_LIST_TAG, "Author")
                                        .mapAndNotify(CategoryProjection.NAME, CategoryDocument.class, CATEGORY_TAG_PREFIX, CATEGORIES_LIST_TAG, "Category")
                                        .mapAndNotify(PublisherProjection.NAME, PublisherDocument.class, PUBLISHER_TAG_PREFIX, PUBLISHERS_LIST_TAG, "Publisher")
                                        .map(AuthorStatisticsProjection.NAME, AuthorStatistics.class, AUTHOR_STATISTICS_TAG_PREFIX, AUTHOR_STATISTICS_LIST_TAG)
                                        .ignore(AuthorStatisticsProjection.NAME, BookAuthors.class)
                                        .map(CategoryStatisticsProjection.NAME, CategoryStatistics.class, CATEGORY_STATISTICS_TAG_PREFIX, CATEGORY_STATISTICS_LIST_TAG)
                                        .ignore(CategoryStatisticsProjection.NAME, BookCategories.class)
                                        .map(PublisherStatisticsProjection.NAME, PublisherStatistics.class, PUBLISHER_STATISTICS_TAG_PREFIX, PUBLISHER_STATISTICS_LIST_TAG)
                                        .ignore(PublisherStatisticsProjection.NAME, BookPublisher.class)
                                        .build();
    }
}
