package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.author.AuthorEvent.*;
import dk.cloudcreate.bookstore.domain.book.*;
import dk.cloudcreate.bookstore.domain.book.BookEvent.*;
import dk.cloudcreate.bookstore.domain.publisher.PublisherEvent.*;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Maintains a {@link BookSearchDocument} per book.<br>
 * Author and publisher names are tracked as {@link NameLookup} documents, and a rename rewrites every book that references
 * the author or publisher
 */
public class BookSearchProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("book-search");

    private static final String AUTHOR_PREFIX    = "author:";
    private static final String PUBLISHER_PREFIX = "publisher:";

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(BookSearchDocument.class, NameLookup.class);
    }

    @Override
    public boolean handles(Object event) {
        return event instanceof BookEvent ||
                event instanceof AuthorAdded || event instanceof AuthorUpdated ||
                event instanceof PublisherAdded || event instanceof PublisherUpdated;
    }

    @Override
    public void apply(PersistedEvent event, ProjectionSession session) {
        var payload = event.event();
        if (payload instanceof BookEvent) {
            applyBookEvent((BookEvent) payload, event, session);
        } else if (payload instanceof AuthorAdded) {
            var added = (AuthorAdded) payload;
            authorRenamed(added.getAuthorId(), added.getName(), event, session);
        } else if (payload instanceof AuthorUpdated) {
            var updated = (AuthorUpdated) payload;
            authorRenamed(updated.getAuthorId(), updated.getName(), event, session);
        } else if (payload instanceof PublisherAdded) {
            var added = (PublisherAdded) payload;
            publisherRenamed(added.getPublisherId(), added.getName(), event, session);
        } else if (payload instanceof PublisherUpdated) {
            var updated = (PublisherUpdated) payload;
            publisherRenamed(updated.getPublisherId(), updated.getName(), event, session);
        }
    }

    private void applyBookEvent(BookEvent bookEvent, PersistedEvent event, ProjectionSession session) {
        var bookId = bookEvent.getBookId();
        var existing = session.load(BookSearchDocument.class, bookId);
        if (existing.isEmpty() && !(bookEvent instanceof BookAdded)) {
            return;
        }
        var document = existing.orElseGet(() -> new BookSearchDocument(bookId));
        var changed = bookEvent.accept(new BookEventVisitor<Boolean>() {
            @Override
            public Boolean visit(BookAdded e) {
                document.details(e.details());
                document.prices(e.getPrices());
                return true;
            }

            @Override
            public Boolean visit(BookUpdated e) {
                document.details(e.details());
                return true;
            }

            @Override
            public Boolean visit(BookPriceChanged e) {
                document.prices(e.getPrices());
                return true;
            }

            @Override
            public Boolean visit(BookCoverUpdated e) {
                document.coverImageUrl(e.getCoverImageUrl());
                return true;
            }

            @Override
            public Boolean visit(BookSoftDeleted e) {
                document.deleted(true);
                return true;
            }

            @Override
            public Boolean visit(BookRestored e) {
                document.deleted(false);
                return true;
            }

            @Override
            public Boolean visit(BookSaleScheduled e) {
                return false;
            }

            @Override
            public Boolean visit(BookSaleCancelled e) {
                return false;
            }

            @Override
            public Boolean visit(BookDiscountUpdated e) {
                document.discountPercentage(e.getDiscountPercentage());
                return true;
            }
        });
        if (changed) {
            refreshNames(document, session);
            document.lastModified(event.timestamp());
            session.store(bookId, document);
        }
    }

    private void authorRenamed(String authorId, String name, PersistedEvent event, ProjectionSession session) {
        session.store(AUTHOR_PREFIX + authorId, new NameLookup(authorId, name));
        session.query(BookSearchDocument.class, book -> book.getAuthorIds().contains(authorId))
               .forEach(book -> restoreWithNames(book, event, session));
    }

    private void publisherRenamed(String publisherId, String name, PersistedEvent event, ProjectionSession session) {
        session.store(PUBLISHER_PREFIX + publisherId, new NameLookup(publisherId, name));
        session.query(BookSearchDocument.class, book -> book.getPublisherId().map(publisherId::equals).orElse(false))
               .forEach(book -> restoreWithNames(book, event, session));
    }

    private void restoreWithNames(BookSearchDocument book, PersistedEvent event, ProjectionSession session) {
        refreshNames(book, session);
        book.lastModified(event.timestamp());
        session.store(book.getBookId(), book);
    }

    private static void refreshNames(BookSearchDocument document, ProjectionSession session) {
        var authorNames = document.getAuthorIds()
                                  .stream()
                                  .map(authorId -> session.load(NameLookup.class, AUTHOR_PREFIX + authorId))
                                  .flatMap(Optional::stream)
                                  .map(NameLookup::getName)
                                  .collect(Collectors.toList());
        var publisherName = document.getPublisherId()
                                    .flatMap(publisherId -> session.load(NameLookup.class, PUBLISHER_PREFIX + publisherId))
                                    .map(NameLookup::getName)
                                    .orElse(null);
        document.names(authorNames, publisherName);
    }
}
