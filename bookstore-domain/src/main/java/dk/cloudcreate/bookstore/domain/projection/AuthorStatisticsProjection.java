package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.book.BookEvent.*;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;

/**
 * Distinct active books per author. Re-applying an event leaves the statistics unchanged
 */
public class AuthorStatisticsProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("author-statistics");

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(AuthorStatistics.class, BookAuthors.class);
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
            var active       = session.load(BookAuthors.class, bookId).map(BookAuthors::isActive).orElse(true);
            update(session, bookId, detailsEvent.details().authorIds, active);
        } else if (payload instanceof BookSoftDeleted) {
            var bookId = ((BookSoftDeleted) payload).getBookId();
            session.load(BookAuthors.class, bookId)
                   .ifPresent(book -> update(session, bookId, book.getAuthorIds(), false));
        } else if (payload instanceof BookRestored) {
            var bookId = ((BookRestored) payload).getBookId();
            session.load(BookAuthors.class, bookId)
                   .ifPresent(book -> update(session, bookId, book.getAuthorIds(), true));
        }
    }

    private static void update(ProjectionSession session, String bookId, List<String> authorIds, boolean active) {
        var previousAuthorIds = session.load(BookAuthors.class, bookId).map(BookAuthors::getAuthorIds).orElse(List.of());
        for (var authorId : previousAuthorIds) {
            if (!active || !authorIds.contains(authorId)) {
                session.load(AuthorStatistics.class, authorId)
                       .ifPresent(statistics -> session.store(authorId, statistics.withoutBook(bookId)));
            }
        }
        if (active) {
            for (var authorId : authorIds) {
                var statistics = session.load(AuthorStatistics.class, authorId).orElseGet(() -> AuthorStatistics.empty(authorId));
                session.store(authorId, statistics.withBook(bookId));
            }
        }
        session.store(bookId, new BookAuthors(bookId, authorIds, active));
    }
}
