package dk.cloudcreate.bookstore.projection.query;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JSONSerializer;
import dk.cloudcreate.bookstore.projection.*;
import dk.cloudcreate.bookstore.projection.cache.*;
import dk.cloudcreate.bookstore.projection.postcommit.CacheInvalidationMappings;
import dk.cloudcreate.bookstore.projection.store.*;

import java.time.Duration;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Cached reads of the active generation of projection documents.<br>
 * Cached entries carry the tags the {@link dk.cloudcreate.bookstore.projection.postcommit.PostCommitCoordinator} invalidates,
 * so a read that follows an invalidation never returns the previous value. Every call returns freshly deserialized documents.
 */
public class ProjectionQueries {
    private final ProjectionStore           projectionStore;
    private final TaggedCache               cache;
    private final CacheInvalidationMappings mappings;
    private final JSONSerializer            jsonSerializer;
    private final Duration                  ttl;

    public ProjectionQueries(ProjectionStore projectionStore,
                             TaggedCache cache,
                             CacheInvalidationMappings mappings,
                             JSONSerializer jsonSerializer,
                             Duration ttl) {
        this.projectionStore = checkNotNull(projectionStore, "No projectionStore provided");
        this.cache = checkNotNull(cache, "No cache provided");
        this.mappings = checkNotNull(mappings, "No mappings provided");
        this.jsonSerializer = checkNotNull(jsonSerializer, "No jsonSerializer provided");
        this.ttl = checkNotNull(ttl, "No ttl provided");
    }

    public <T> Optional<QueryResult<T>> findById(ProjectionName projectionName, TenantId tenantId, Class<T> documentType, String documentId) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(documentId, "No documentId provided");
        var typeName = ProjectionSession.documentTypeOf(documentType);
        var tags     = new HashSet<String>();
        tags.add(CacheTags.projectionTag(tenantId, projectionName));
        mappings.lookup(projectionName, typeName)
                .filter(mapping -> !mapping.ignored)
                .ifPresent(mapping -> tags.add(CacheTags.itemTag(tenantId, mapping.itemTagPrefix, documentId)));

        ProjectionDocument document = cache.getOrCreate(cacheKey(projectionName, tenantId, typeName, documentId),
                                                        () -> projectionStore.findDocument(projectionName,
                                                                                           tenantId,
                                                                                           activeGeneration(projectionName, tenantId),
                                                                                           typeName,
                                                                                           documentId)
                                                                             .orElse(null),
                                                        tags,
                                                        ttl);
        return Optional.ofNullable(document).map(found -> toResult(found, documentType));
    }

    /**
     * @return every document of the type ordered by document id
     */
    public <T> List<QueryResult<T>> findAll(ProjectionName projectionName, TenantId tenantId, Class<T> documentType) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(tenantId, "No tenantId provided");
        var typeName = ProjectionSession.documentTypeOf(documentType);
        var tags     = new HashSet<String>();
        tags.add(CacheTags.projectionTag(tenantId, projectionName));
        mappings.lookup(projectionName, typeName)
                .filter(mapping -> !mapping.ignored)
                .ifPresent(mapping -> tags.add(CacheTags.listTag(tenantId, mapping.listTag)));

        List<ProjectionDocument> documents = cache.getOrCreate(cacheKey(projectionName, tenantId, typeName, "*"),
                                                               () -> List.copyOf(projectionStore.findDocuments(projectionName,
                                                                                                               tenantId,
                                                                                                               activeGeneration(projectionName, tenantId),
                                                                                                               typeName)),
                                                               tags,
                                                               ttl);
        return documents.stream()
                        .map(document -> toResult(document, documentType))
                        .collect(Collectors.toList());
    }

    public <T> List<QueryResult<T>> search(ProjectionName projectionName, TenantId tenantId, Class<T> documentType, Predicate<T> filter) {
        checkNotNull(filter, "No filter provided");
        return findAll(projectionName, tenantId, documentType).stream()
                                                              .filter(result -> filter.test(result.document))
                                                              .collect(Collectors.toList());
    }

    private int activeGeneration(ProjectionName projectionName, TenantId tenantId) {
        return projectionStore.checkpoint(projectionName, tenantId).activeGeneration;
    }

    private <T> QueryResult<T> toResult(ProjectionDocument document, Class<T> documentType) {
        return new QueryResult<>(jsonSerializer.deserialize(document.json, documentType), document.version, document.softDeleted);
    }

    private static String cacheKey(ProjectionName projectionName, TenantId tenantId, String documentType, String documentId) {
        return tenantId + "|" + projectionName + "|" + documentType + "|" + documentId;
    }
}
