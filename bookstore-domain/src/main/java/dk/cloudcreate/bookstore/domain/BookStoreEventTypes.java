package dk.cloudcreate.bookstore.domain;

import dk.cloudcreate.bookstore.domain.author.AuthorAggregate;
import dk.cloudcreate.bookstore.domain.book.BookAggregate;
import dk.cloudcreate.bookstore.domain.category.CategoryAggregate;
import dk.cloudcreate.bookstore.domain.publisher.PublisherAggregate;
import dk.cloudcreate.bookstore.domain.tenant.TenantRegistered;
import dk.cloudcreate.bookstore.eventstore.EventTypeRegistry;

/**
 * Every persisted event type of the bookstore, tagged with its simple class name
 */
public final class BookStoreEventTypes {
    private BookStoreEventTypes() {
    }

    public static EventTypeRegistry create() {
        return new EventTypeRegistry().registerAll(BookAggregate.eventTypes())
                                      .registerAll(AuthorAggregate.eventTypes())
                                      .registerAll(CategoryAggregate.eventTypes())
                                      .registerAll(PublisherAggregate.eventTypes())
                                      .register(TenantRegistered.class);
    }
}
