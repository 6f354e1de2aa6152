package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.book.BookEvent.*;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;

/**
 * Distinct active books per publisher. A book moving to another publisher is counted by the new publisher only
 */
public class PublisherStatisticsProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("publisher-statistics");

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(PublisherStatistics.class, BookPublisher.class);
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
            var active       = session.load(BookPublisher.class, bookId).map(BookPublisher::isActive).orElse(true);
            update(session, bookId, Optional.ofNullable(detailsEvent.details().publisherId), active);
        } else if (payload instanceof BookSoftDeleted) {
            var bookId = ((BookSoftDeleted) payload).getBookId();
            session.load(BookPublisher.class, bookId)
                   .ifPresent(book -> update(session, bookId, book.getPublisherId(), false));
        } else if (payload instanceof BookRestored) {
            var bookId = ((BookRestored) payload).getBookId();
            session.load(BookPublisher.class, bookId)
                   .ifPresent(book -> update(session, bookId, book.getPublisherId(), true));
        }
    }

    private static void update(ProjectionSession session, String bookId, Optional<String> publisherId, boolean active) {
        var previousPublisherId = session.load(BookPublisher.class, bookId).flatMap(BookPublisher::getPublisherId);
        previousPublisherId.filter(previous -> !active || !publisherId.equals(Optional.of(previous)))
                           .ifPresent(previous -> session.load(PublisherStatistics.class, previous)
                                                         .ifPresent(statistics -> session.store(previous, statistics.withoutBook(bookId))));
        if (active) {
            publisherId.ifPresent(current -> {
                var statistics = session.load(PublisherStatistics.class, current).orElseGet(() -> PublisherStatistics.empty(current));
                session.store(current, statistics.withBook(bookId));
            });
        }
        session.store(bookId, new BookPublisher(bookId, publisherId.orElse(null), active));
    }
}
