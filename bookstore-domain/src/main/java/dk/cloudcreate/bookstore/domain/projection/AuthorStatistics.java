package dk.cloudcreate.bookstore.domain.projection;

import java.util.*;

/**
 * The active (not soft deleted) books of an author. Adding or removing a book id is idempotent
 */
public class AuthorStatistics {
    private String          authorId;
    private TreeSet<String> bookIds;

    AuthorStatistics() {
    }

    public AuthorStatistics(String authorId, Set<String> bookIds) {
        this.authorId = authorId;
        this.bookIds = new TreeSet<>(bookIds);
    }

    public static AuthorStatistics empty(String authorId) {
        return new AuthorStatistics(authorId, Set.of());
    }

    public String getAuthorId() {
        return authorId;
    }

    public Set<String> getBookIds() {
        return Collections.unmodifiableSet(bookIds);
    }

    public int getBookCount() {
        return bookIds.size();
    }

    public AuthorStatistics withBook(String bookId) {
        var updated = new TreeSet<>(bookIds);
        updated.add(bookId);
        return new AuthorStatistics(authorId, updated);
    }

    public AuthorStatistics withoutBook(String bookId) {
        var updated = new TreeSet<>(bookIds);
        updated.remove(bookId);
        return new AuthorStatistics(authorId, updated);
    }
}
