package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.projection.SoftDeletable;

import java.time.OffsetDateTime;

public class AuthorDocument implements SoftDeletable {
    private String         authorId;
    private String         name;
    private String         biography;
    private boolean        deleted;
    private OffsetDateTime lastModified;

    AuthorDocument() {
    }

    public AuthorDocument(String authorId, String name, String biography, boolean deleted, OffsetDateTime lastModified) {
        this.authorId = authorId;
        this.name = name;
        this.biography = biography;
        this.deleted = deleted;
        this.lastModified = lastModified;
    }

    public String getAuthorId() {
        return authorId;
    }

    public String getName() {
        return name;
    }

    public String getBiography() {
        return biography;
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    public OffsetDateTime getLastModified() {
        return lastModified;
    }
}
