package dk.cloudcreate.bookstore.projection.store;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An upsert or (when {@link #json} is empty) a delete of one document
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class DocumentWrite {
    public final String           documentType;
    public final String           documentId;
    public final Optional<String> json;
    public final long             version;
    public final boolean          softDeleted;

    private DocumentWrite(String documentType, String documentId, Optional<String> json, long version, boolean softDeleted) {
        this.documentType = checkNotNull(documentType, "No documentType provided");
        this.documentId = checkNotNull(documentId, "No documentId provided");
        this.json = json;
        this.version = version;
        this.softDeleted = softDeleted;
    }

    public static DocumentWrite upsert(String documentType, String documentId, String json, long version, boolean softDeleted) {
        return new DocumentWrite(documentType, documentId, Optional.of(checkNotNull(json, "No json provided")), version, softDeleted);
    }

    public static DocumentWrite delete(String documentType, String documentId) {
        return new DocumentWrite(documentType, documentId, Optional.empty(), 0, false);
    }

    public boolean isDelete() {
        return json.isEmpty();
    }

    @Override
    public String toString() {
        return (isDelete() ? "delete " : "upsert ") + documentType + ":" + documentId;
    }
}
