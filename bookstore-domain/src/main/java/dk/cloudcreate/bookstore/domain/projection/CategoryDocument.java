package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.projection.SoftDeletable;

import java.time.OffsetDateTime;

public class CategoryDocument implements SoftDeletable {
    private String         categoryId;
    private String         name;
    private String         description;
    private boolean        deleted;
    private OffsetDateTime lastModified;

    CategoryDocument() {
    }

    public CategoryDocument(String categoryId, String name, String description, boolean deleted, OffsetDateTime lastModified) {
        this.categoryId = categoryId;
        this.name = name;
        this.description = description;
        this.deleted = deleted;
        this.lastModified = lastModified;
    }

    public String getCategoryId() {
        return categoryId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    public OffsetDateTime getLastModified() {
        return lastModified;
    }
}
