package dk.cloudcreate.bookstore.domain.category;

/**
 * The events of an category stream. The stream id is the category id
 */
public abstract class CategoryEvent {
    private String categoryId;

    protected CategoryEvent() {
    }

    protected CategoryEvent(String categoryId) {
        this.categoryId = categoryId;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visit(CategoryAdded event);

        R visit(CategoryUpdated event);

        R visit(CategorySoftDeleted event);

        R visit(CategoryRestored event);
    }

    public static class CategoryAdded extends CategoryEvent {
        private String name;
        private String description;

        public CategoryAdded() {
        }

        public CategoryAdded(String categoryId, String name, String description) {
            super(categoryId);
            this.name = name;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class CategoryUpdated extends CategoryEvent {
        private String name;
        private String description;

        public CategoryUpdated() {
        }

        public CategoryUpdated(String categoryId, String name, String description) {
            super(categoryId);
            this.name = name;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class CategorySoftDeleted extends CategoryEvent {
        public CategorySoftDeleted() {
        }

        public CategorySoftDeleted(String categoryId) {
            super(categoryId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class CategoryRestored extends CategoryEvent {
        public CategoryRestored() {
        }

        public CategoryRestored(String categoryId) {
            super(categoryId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
