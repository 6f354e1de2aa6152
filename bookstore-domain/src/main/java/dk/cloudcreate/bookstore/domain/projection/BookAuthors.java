package dk.cloudcreate.bookstore.domain.projection;

import java.util.*;

/**
 * Internal bookkeeping of {@link AuthorStatisticsProjection}: the authors of a book and whether the book is active
 */
public class BookAuthors {
    private String       bookId;
    private List<String> authorIds;
    private boolean      active;

    BookAuthors() {
    }

    public BookAuthors(String bookId, List<String> authorIds, boolean active) {
        this.bookId = bookId;
        this.authorIds = new ArrayList<>(authorIds);
        this.active = active;
    }

    public String getBookId() {
        return bookId;
    }

    public List<String> getAuthorIds() {
        return Collections.unmodifiableList(authorIds);
    }

    public boolean isActive() {
        return active;
    }
}
