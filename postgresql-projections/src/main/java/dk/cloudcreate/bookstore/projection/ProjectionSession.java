package dk.cloudcreate.bookstore.projection;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JSONSerializer;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.store.*;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.*;

/**
 * Document access for a {@link Projection} while it applies a batch of events.<br>
 * Writes are buffered: the writes of an event only become part of the batch when the event applied successfully, and the
 * batch is committed together with the checkpoint. Reads see the buffered writes.<br>
 * <br>
 * A document's type is the simple name of its class. Its version is the stream version of the event that last wrote it when
 * the event's stream id equals the document id; denormalized updates caused by other streams keep the version unchanged.
 */
public final class ProjectionSession {
    private final ProjectionStore     projectionStore;
    private final ProjectionName      projectionName;
    private final TenantId            tenantId;
    private final int                 generation;
    private final JSONSerializer      jsonSerializer;
    private final Map<DocumentKey, PendingDocument> batchDocuments = new LinkedHashMap<>();
    private final Map<DocumentKey, PendingDocument> eventDocuments = new LinkedHashMap<>();
    private PersistedEvent currentEvent;

    public ProjectionSession(ProjectionStore projectionStore, ProjectionName projectionName, TenantId tenantId, int generation, JSONSerializer jsonSerializer) {
        this.projectionStore = checkNotNull(projectionStore, "No projectionStore provided");
        this.projectionName = checkNotNull(projectionName, "No projectionName provided");
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.generation = generation;
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
    }

    public static String documentTypeOf(Class<?> documentType) {
        return checkNotNull(documentType, "No documentType provided").getSimpleName();
    }

    public ProjectionName projectionName() {
        return projectionName;
    }

    public TenantId tenantId() {
        return tenantId;
    }

    /**
     * @return the event currently being applied
     */
    public PersistedEvent currentEvent() {
        checkState(currentEvent != null, "No event is being applied");
        return currentEvent;
    }

    public <T> Optional<T> load(Class<T> documentType, String documentId) {
        checkNotNull(documentId, "No documentId provided");
        var key     = new DocumentKey(documentTypeOf(documentType), documentId);
        var pending = pendingOf(key);
        if (pending != null) {
            return pending.json == null ? Optional.empty() : Optional.of(jsonSerializer.deserialize(pending.json, documentType));
        }
        return projectionStore.findDocument(projectionName, tenantId, generation, key.documentType, documentId)
                              .map(document -> jsonSerializer.deserialize(document.json, documentType));
    }

    /**
     * Store the document, deriving its version from the current event
     */
    public void store(String documentId, Object document) {
        checkNotNull(documentId, "No documentId provided");
        checkNotNull(document, "No document provided");
        var event = currentEvent();
        var key   = new DocumentKey(documentTypeOf(document.getClass()), documentId);
        long version;
        if (event.streamId().toString().equals(documentId)) {
            version = event.version().longValue();
        } else {
            version = currentVersionOf(key);
        }
        store(key, document, version);
    }

    /**
     * Store the document with an explicit version
     */
    public void store(String documentId, Object document, long version) {
        checkNotNull(documentId, "No documentId provided");
        checkNotNull(document, "No document provided");
        checkArgument(version >= 0, "version must be >= 0");
        store(new DocumentKey(documentTypeOf(document.getClass()), documentId), document, version);
    }

    private void store(DocumentKey key, Object document, long version) {
        currentEvent();
        var pending = eventDocuments.computeIfAbsent(key, this::newPendingDocument);
        pending.json = jsonSerializer.serialize(document);
        pending.version = version;
        pending.softDeleted = document instanceof SoftDeletable && ((SoftDeletable) document).isDeleted();
        pending.causedBy = currentEvent.globalEventOrder();
    }

    public void delete(Class<?> documentType, String documentId) {
        checkNotNull(documentId, "No documentId provided");
        currentEvent();
        var key     = new DocumentKey(documentTypeOf(documentType), documentId);
        var pending = eventDocuments.computeIfAbsent(key, this::newPendingDocument);
        pending.json = null;
        pending.softDeleted = false;
        pending.causedBy = currentEvent.globalEventOrder();
    }

    /**
     * @return every document of the type (including buffered writes) ordered by document id
     */
    public <T> List<T> query(Class<T> documentType) {
        return query(documentType, document -> true);
    }

    public <T> List<T> query(Class<T> documentType, Predicate<T> filter) {
        checkNotNull(filter, "No filter provided");
        var typeName = documentTypeOf(documentType);
        var jsonById = new TreeMap<String, String>();
        projectionStore.findDocuments(projectionName, tenantId, generation, typeName)
                       .forEach(document -> jsonById.put(document.documentId, document.json));
        overlay(batchDocuments, typeName, jsonById);
        overlay(eventDocuments, typeName, jsonById);
        return jsonById.values()
                       .stream()
                       .map(json -> jsonSerializer.deserialize(json, documentType))
                       .filter(filter)
                       .collect(Collectors.toList());
    }

    private static void overlay(Map<DocumentKey, PendingDocument> pendingDocuments, String typeName, Map<String, String> jsonById) {
        pendingDocuments.forEach((key, pending) -> {
            if (key.documentType.equals(typeName)) {
                if (pending.json == null) {
                    jsonById.remove(key.documentId);
                } else {
                    jsonById.put(key.documentId, pending.json);
                }
            }
        });
    }

    void beginEvent(PersistedEvent event) {
        checkState(eventDocuments.isEmpty(), "The previous event wasn't completed or discarded");
        currentEvent = checkNotNull(event, "No event provided");
    }

    void completeEvent() {
        batchDocuments.putAll(eventDocuments);
        eventDocuments.clear();
        currentEvent = null;
    }

    void discardEvent() {
        eventDocuments.clear();
        currentEvent = null;
    }

    /**
     * @return the writes needed to bring the store in line with the completed events of the batch
     */
    List<DocumentWrite> writes() {
        var writes = new ArrayList<DocumentWrite>();
        for (var entry : batchDocuments.entrySet()) {
            var key     = entry.getKey();
            var pending = entry.getValue();
            if (!isChange(pending)) {
                continue;
            }
            if (pending.json == null) {
                writes.add(DocumentWrite.delete(key.documentType, key.documentId));
            } else {
                writes.add(DocumentWrite.upsert(key.documentType, key.documentId, pending.json, pending.version, pending.softDeleted));
            }
        }
        return writes;
    }

    /**
     * @return the net change per document of the completed events of the batch
     */
    List<DocumentChange> changes() {
        var changes = new ArrayList<DocumentChange>();
        for (var entry : batchDocuments.entrySet()) {
            var key     = entry.getKey();
            var pending = entry.getValue();
            if (!isChange(pending)) {
                continue;
            }
            var original = pending.original;
            DocumentChange.Kind kind;
            long version;
            if (pending.json == null) {
                kind = DocumentChange.Kind.DELETE;
                version = original.get().version;
            } else {
                kind = original.isPresent() ? DocumentChange.Kind.UPDATE : DocumentChange.Kind.INSERT;
                version = pending.version;
            }
            changes.add(new DocumentChange(projectionName,
                                           tenantId,
                                           key.documentType,
                                           key.documentId,
                                           kind,
                                           version,
                                           pending.softDeleted,
                                           original.map(document -> document.softDeleted).orElse(false),
                                           pending.causedBy));
        }
        return changes;
    }

    private boolean isChange(PendingDocument pending) {
        if (pending.original.isEmpty()) {
            return pending.json != null;
        }
        var document = pending.original.get();
        if (pending.json == null || pending.version != document.version || pending.softDeleted != document.softDeleted) {
            return true;
        }
        // The store may normalize the stored JSON (key order, whitespace), so compare structurally
        return !pending.json.equals(document.json) &&
                !Objects.equals(jsonSerializer.deserialize(pending.json, Object.class), jsonSerializer.deserialize(document.json, Object.class));
    }

    private PendingDocument pendingOf(DocumentKey key) {
        var pending = eventDocuments.get(key);
        return pending != null ? pending : batchDocuments.get(key);
    }

    private long currentVersionOf(DocumentKey key) {
        var pending = pendingOf(key);
        if (pending != null) {
            return pending.json != null ? pending.version : 0;
        }
        return projectionStore.findDocument(projectionName, tenantId, generation, key.documentType, key.documentId)
                              .map(document -> document.version)
                              .orElse(0L);
    }

    private PendingDocument newPendingDocument(DocumentKey key) {
        var existing = batchDocuments.get(key);
        if (existing != null) {
            return existing.copy();
        }
        var original = projectionStore.findDocument(projectionName, tenantId, generation, key.documentType, key.documentId);
        var pending  = new PendingDocument(original);
        original.ifPresent(document -> {
            pending.json = document.json;
            pending.version = document.version;
            pending.softDeleted = document.softDeleted;
        });
        return pending;
    }

    private static final class DocumentKey {
        private final String documentType;
        private final String documentId;

        private DocumentKey(String documentType, String documentId) {
            this.documentType = documentType;
            this.documentId = documentId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DocumentKey)) return false;
            var that = (DocumentKey) o;
            return documentType.equals(that.documentType) && documentId.equals(that.documentId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(documentType, documentId);
        }
    }

    /**
     * Buffered state of a document. <code>json == null</code> means deleted
     */
    private static final class PendingDocument {
        private final Optional<ProjectionDocument> original;
        private       String                       json;
        private       long                         version;
        private       boolean                      softDeleted;
        private       GlobalEventOrder             causedBy;

        private PendingDocument(Optional<ProjectionDocument> original) {
            this.original = original;
        }

        private PendingDocument copy() {
            var copy = new PendingDocument(original);
            copy.json = json;
            copy.version = version;
            copy.causedBy = causedBy;
            copy.softDeleted = softDeleted;
            return copy;
        }
    }
}
