package dk.cloudcreate.bookstore.domain.projection;

import java.util.Optional;

/**
 * Internal bookkeeping of {@link PublisherStatisticsProjection}: the publisher of a book, if any, and whether the book is active
 */
public class BookPublisher {
    private String  bookId;
    private String  publisherId;
    private boolean active;

    BookPublisher() {
    }

    public BookPublisher(String bookId, String publisherId, boolean active) {
        this.bookId = bookId;
        this.publisherId = publisherId;
        this.active = active;
    }

    public String getBookId() {
        return bookId;
    }

    public Optional<String> getPublisherId() {
        return Optional.ofNullable(publisherId);
    }

    public boolean isActive() {
        return active;
    }
}
