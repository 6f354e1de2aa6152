package dk.cloudcreate.bookstore.projection.store;

import java.time.OffsetDateTime;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A stored read model document in its serialized form
 */
public final class ProjectionDocument {
    public final String         documentType;
    public final String         documentId;
    public final long           version;
    public final boolean        softDeleted;
    public final String         json;
    public final OffsetDateTime updatedAt;

    public ProjectionDocument(String documentType, String documentId, long version, boolean softDeleted, String json, OffsetDateTime updatedAt) {
        this.documentType = checkNotNull(documentType, "No documentType provided");
        this.documentId = checkNotNull(documentId, "No documentId provided");
        this.version = version;
        this.softDeleted = softDeleted;
        this.json = checkNotNull(json, "No json provided");
        this.updatedAt = checkNotNull(updatedAt, "No updatedAt provided");
    }

    @Override
    public String toString() {
        return "ProjectionDocument{" + documentType + ":" + documentId + "@" + version + (softDeleted ? ", softDeleted" : "") + "}";
    }
}
