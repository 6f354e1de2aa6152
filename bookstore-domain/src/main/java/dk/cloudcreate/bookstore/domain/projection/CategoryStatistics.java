package dk.cloudcreate.bookstore.domain.projection;

import java.util.*;

/**
 * The active books filed under a category. Adding or removing a book id is idempotent
 */
public class CategoryStatistics {
    private String          categoryId;
    private TreeSet<String> bookIds;

    CategoryStatistics() {
    }

    public CategoryStatistics(String categoryId, Set<String> bookIds) {
        this.categoryId = categoryId;
        this.bookIds = new TreeSet<>(bookIds);
    }

    public static CategoryStatistics empty(String categoryId) {
        return new CategoryStatistics(categoryId, Set.of());
    }

    public String getCategoryId() {
        return categoryId;
    }

    public Set<String> getBookIds() {
        return Collections.unmodifiableSet(bookIds);
    }

    public int getBookCount() {
        return bookIds.size();
    }

    public CategoryStatistics withBook(String bookId) {
        var updated = new TreeSet<>(bookIds);
        updated.add(bookId);
        return new CategoryStatistics(categoryId, updated);
    }

    public CategoryStatistics withoutBook(String bookId) {
        var updated = new TreeSet<>(bookIds);
        updated.remove(bookId);
        return new CategoryStatistics(categoryId, updated);
    }
}
