package dk.cloudcreate.bookstore.domain.projection;

import java.util.*;

/**
 * The active books of a publisher
 */
public class PublisherStatistics {
    private String          publisherId;
    private TreeSet<String> bookIds;

    PublisherStatistics() {
    }

    public PublisherStatistics(String publisherId, Set<String> bookIds) {
        this.publisherId = publisherId;
        this.bookIds = new TreeSet<>(bookIds);
    }

    public static PublisherStatistics empty(String publisherId) {
        return new PublisherStatistics(publisherId, Set.of());
    }

    public String getPublisherId() {
        return publisherId;
    }

    public Set<String> getBookIds() {
        return Collections.unmodifiableSet(bookIds);
    }

    public int getBookCount() {
        return bookIds.size();
    }

    public PublisherStatistics withBook(String bookId) {
        var updated = new TreeSet<>(bookIds);
        updated.add(bookId);
        return new PublisherStatistics(publisherId, updated);
    }

    public PublisherStatistics withoutBook(String bookId) {
        var updated = new TreeSet<>(bookIds);
        updated.remove(bookId);
        return new PublisherStatistics(publisherId, updated);
    }
}
