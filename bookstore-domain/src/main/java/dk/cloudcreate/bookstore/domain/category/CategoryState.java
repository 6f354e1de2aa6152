package dk.cloudcreate.bookstore.domain.category;

import dk.cloudcreate.bookstore.domain.category.CategoryEvent.*;

import java.util.Objects;

public final class CategoryState {
    public final String  categoryId;
    public final String  name;
    public final String  description;
    public final boolean deleted;

    private CategoryState(String categoryId, String name, String description, boolean deleted) {
        this.categoryId = categoryId;
        this.name = name;
        this.description = description;
        this.deleted = deleted;
    }

    public static CategoryState initial(String categoryId) {
        return new CategoryState(categoryId, null, null, false);
    }

    public CategoryState apply(CategoryEvent event) {
        return event.accept(new CategoryEvent.Visitor<>() {
            @Override
            public CategoryState visit(CategoryAdded e) {
                return new CategoryState(categoryId, e.getName(), e.getDescription(), false);
            }

            @Override
            public CategoryState visit(CategoryUpdated e) {
                return new CategoryState(categoryId, e.getName(), e.getDescription(), deleted);
            }

            @Override
            public CategoryState visit(CategorySoftDeleted e) {
                return new CategoryState(categoryId, name, description, true);
            }

            @Override
            public CategoryState visit(CategoryRestored e) {
                return new CategoryState(categoryId, name, description, false);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoryState)) return false;
        var that = (CategoryState) o;
        return deleted == that.deleted && categoryId.equals(that.categoryId) && Objects.equals(name, that.name) && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(categoryId, name, description, deleted);
    }

    @Override
    public String toString() {
        return "CategoryState{" + categoryId + ", name='" + name + "', deleted=" + deleted + '}';
    }
}
