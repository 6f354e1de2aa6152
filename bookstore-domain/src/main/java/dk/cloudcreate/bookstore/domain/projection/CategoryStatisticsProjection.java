package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.book.BookEvent.*;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;

/**
 * Distinct active books per category. Re-applying an event leaves the statistics unchanged
 */
public class CategoryStatisticsProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("category-statistics");

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(CategoryStatistics.class, BookCategories.class);
    }

    @Override
    public boolean handles(Object event) {
        return event instanceof BookAdded || event instanceof BookUpdated || event instanceof BookSoftDeleted || event instanceof BookRestored;
    }

    @Override
    public void apply(PersistedEvent event, ProjectionSession session) {
        var payload = event.event();
        if (payload instanceof BookDetailsEvent) {
            var detailsEvent = (BookDetailsEvent) payload;
            var bookId       = detailsEvent.getBookId();
            var active       = session.load(BookCategories.class, bookId).map(BookCategories::isActive).orElse(true);
            update(session, bookId, detailsEvent.details().categoryIds, active);
        } else if (payload instanceof BookSoftDeleted) {
            var bookId = ((BookSoftDeleted) payload).getBookId();
            session.load(BookCategories.class, bookId)
                   .ifPresent(book -> update(session, bookId, book.getCategoryIds(), false));
        } else if (payload instanceof BookRestored) {
            var bookId = ((BookRestored) payload).getBookId();
            session.load(BookCategories.class, bookId)
                   .ifPresent(book -> update(session, bookId, book.getCategoryIds(), true));
        }
    }

    private static void update(ProjectionSession session, String bookId, List<String> categoryIds, boolean active) {
        var previousCategoryIds = session.load(BookCategories.class, bookId).map(BookCategories::getCategoryIds).orElse(List.of());
        for (var categoryId : previousCategoryIds) {
            if (!active || !categoryIds.contains(categoryId)) {
                session.load(CategoryStatistics.class, categoryId)
                       .ifPresent(statistics -> session.store(categoryId, statistics.withoutBook(bookId)));
            }
        }
        if (active) {
            for (var categoryId : categoryIds) {
                var statistics = session.load(CategoryStatistics.class, categoryId).orElseGet(() -> CategoryStatistics.empty(categoryId));
                session.store(categoryId, statistics.withBook(bookId));
            }
        }
        session.store(bookId, new BookCategories(bookId, categoryIds, active));
    }
}
