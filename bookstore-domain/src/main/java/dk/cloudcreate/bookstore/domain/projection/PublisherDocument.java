package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.projection.SoftDeletable;

import java.time.OffsetDateTime;

public class PublisherDocument implements SoftDeletable {
    private String         publisherId;
    private String         name;
    private boolean        deleted;
    private OffsetDateTime lastModified;

    PublisherDocument() {
    }

    public PublisherDocument(String publisherId, String name, boolean deleted, OffsetDateTime lastModified) {
        this.publisherId = publisherId;
        this.name = name;
        this.deleted = deleted;
        this.lastModified = lastModified;
    }

    public String getPublisherId() {
        return publisherId;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    public OffsetDateTime getLastModified() {
        return lastModified;
    }
}
