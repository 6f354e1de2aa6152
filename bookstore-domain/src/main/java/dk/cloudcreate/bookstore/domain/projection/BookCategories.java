package dk.cloudcreate.bookstore.domain.projection;

import java.util.*;

/**
 * Internal bookkeeping of {@link CategoryStatisticsProjection}: the categories of a book and whether the book is active
 */
public class BookCategories {
    private String       bookId;
    private List<String> categoryIds;
    private boolean      active;

    BookCategories() {
    }

    public BookCategories(String bookId, List<String> categoryIds, boolean active) {
        this.bookId = bookId;
        this.categoryIds = new ArrayList<>(categoryIds);
        this.active = active;
    }

    public String getBookId() {
        return bookId;
    }

    public List<String> getCategoryIds() {
        return Collections.unmodifiableList(categoryIds);
    }

    public boolean isActive() {
        return active;
    }
}
