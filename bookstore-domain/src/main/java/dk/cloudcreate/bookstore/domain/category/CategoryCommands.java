package dk.cloudcreate.bookstore.domain.category;

import dk.cloudcreate.bookstore.aggregates.command.Command;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import java.util.List;

public final class CategoryCommands {
    public static final List<Class<? extends Command>> ALL = List.of(AddCategory.class,
                                                                     UpdateCategory.class,
                                                                     SoftDeleteCategory.class,
                                                                     RestoreCategory.class);

    private CategoryCommands() {
    }

    public abstract static class CategoryCommand implements Command {
        private String categoryId;

        protected CategoryCommand() {
        }

        protected CategoryCommand(String categoryId) {
            this.categoryId = categoryId;
        }

        public String getCategoryId() {
            return categoryId;
        }

        @Override
        public StreamId streamId() {
            return StreamId.of(categoryId);
        }
    }

    public static class AddCategory extends CategoryCommand {
        private String name;
        private String description;

        AddCategory() {
        }

        public AddCategory(String categoryId, String name, String description) {
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
    }

    public static class UpdateCategory extends CategoryCommand {
        private String name;
        private String description;

        UpdateCategory() {
        }

        public UpdateCategory(String categoryId, String name, String description) {
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
    }

    public static class SoftDeleteCategory extends CategoryCommand {
        SoftDeleteCategory() {
        }

        public SoftDeleteCategory(String categoryId) {
            super(categoryId);
        }
    }

    public static class RestoreCategory extends CategoryCommand {
        RestoreCategory() {
        }

        public RestoreCategory(String categoryId) {
            super(categoryId);
        }
    }
}
