package dk.cloudcreate.bookstore.projection;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The net change of one document caused by a committed projection batch
 */
public final class DocumentChange {
    public enum Kind {
        INSERT,
        UPDATE,
        DELETE
    }

    public final ProjectionName   projectionName;
    public final TenantId         tenantId;
    public final String           documentType;
    public final String           documentId;
    public final Kind             kind;
    /**
     * The document version after the change (for {@link Kind#DELETE} the last version)
     */
    public final long             version;
    public final boolean          softDeleted;
    public final boolean          previouslySoftDeleted;
    /**
     * Global order of the last event in the batch that wrote the document. Denormalized updates keep the document version,
     * so this is what tells two changes of the same document version apart
     */
    public final GlobalEventOrder causedBy;

    public DocumentChange(ProjectionName projectionName,
                          TenantId tenantId,
                          String documentType,
                          String documentId,
                          Kind kind,
                          long version,
                          boolean softDeleted,
                          boolean previouslySoftDeleted,
                          GlobalEventOrder causedBy) {
        this.projectionName = checkNotNull(projectionName, "No projectionName provided");
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.documentType = checkNotNull(documentType, "No documentType provided");
        this.documentId = checkNotNull(documentId, "No documentId provided");
        this.kind = checkNotNull(kind, "No kind provided");
        this.version = version;
        this.softDeleted = softDeleted;
        this.previouslySoftDeleted = previouslySoftDeleted;
        this.causedBy = checkNotNull(causedBy, "No causedBy provided");
    }

    /**
     * @return true if this change moved the document into the soft deleted state
     */
    public boolean isSoftDeletion() {
        return kind != Kind.DELETE && softDeleted && !previouslySoftDeleted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentChange)) return false;
        var that = (DocumentChange) o;
        return version == that.version &&
                softDeleted == that.softDeleted &&
                previouslySoftDeleted == that.previouslySoftDeleted &&
                projectionName.equals(that.projectionName) &&
                tenantId.equals(that.tenantId) &&
                documentType.equals(that.documentType) &&
                documentId.equals(that.documentId) &&
                kind == that.kind &&
                causedBy.equals(that.causedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectionName, tenantId, documentType, documentId, kind, version, softDeleted, previouslySoftDeleted, causedBy);
    }

    @Override
    public String toString() {
        return kind + " " + documentType + ":" + documentId + "@" + version + " by event " + causedBy + (softDeleted ? " (soft deleted)" : "");
    }
}
