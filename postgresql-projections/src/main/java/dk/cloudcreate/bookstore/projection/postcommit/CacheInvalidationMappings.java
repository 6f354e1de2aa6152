package dk.cloudcreate.bookstore.projection.postcommit;

import dk.cloudcreate.bookstore.projection.*;

import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.*;

/**
 * Maps the documents of each projection to the cache tags that must be invalidated when they change, and to the entity type
 * announced to clients (if any). Every document type written by a projection must be either mapped or explicitly ignored
 */
public final class CacheInvalidationMappings {
    private final Map<String, Mapping> mappings;

    private CacheInvalidationMappings(Map<String, Mapping> mappings) {
        this.mappings = Map.copyOf(mappings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Mapping> lookup(ProjectionName projectionName, String documentType) {
        checkNotNull(projectionName, "No projectionName provided");
        checkNotNull(documentType, "No documentType provided");
        return Optional.ofNullable(mappings.get(key(projectionName, documentType)));
    }

    public List<Mapping> mappingsFor(ProjectionName projectionName) {
        checkNotNull(projectionName, "No projectionName provided");
        return mappings.values()
                       .stream()
                       .filter(mapping -> mapping.projectionName.equals(projectionName))
                       .collect(Collectors.toList());
    }

    /**
     * @return <code>projection/documentType</code> for every document type of the projections that is neither mapped nor ignored
     */
    public List<String> unmapped(Collection<? extends Projection> projections) {
        checkNotNull(projections, "No projections provided");
        var unmapped = new ArrayList<String>();
        for (var projection : projections) {
            for (var documentType : projection.documentTypes()) {
                var typeName = ProjectionSession.documentTypeOf(documentType);
                if (!mappings.containsKey(key(projection.name(), typeName))) {
                    unmapped.add(projection.name() + "/" + typeName);
                }
            }
        }
        return unmapped;
    }

    private static String key(ProjectionName projectionName, String documentType) {
        return projectionName + "/" + documentType;
    }

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static final class Mapping {
        public final ProjectionName   projectionName;
        public final String           documentType;
        public final String           itemTagPrefix;
        public final String           listTag;
        public final Optional<String> notificationEntityType;
        public final boolean          ignored;

        private Mapping(ProjectionName projectionName, String documentType, String itemTagPrefix, String listTag, Optional<String> notificationEntityType, boolean ignored) {
            this.projectionName = projectionName;
            this.documentType = documentType;
            this.itemTagPrefix = itemTagPrefix;
            this.listTag = listTag;
            this.notificationEntityType = notificationEntityType;
            this.ignored = ignored;
        }

        @Override
        public String toString() {
            if (ignored) {
                return projectionName + "/" + documentType + " (ignored)";
            }
            return projectionName + "/" + documentType + " -> " + itemTagPrefix + ":{id}, " + listTag +
                    notificationEntityType.map(entityType -> ", notifies " + entityType).orElse("");
        }
    }

    public static final class Builder {
        private final Map<String, Mapping> mappings = new LinkedHashMap<>();

        /**
         * Invalidate <code>{itemTagPrefix}:{documentId}</code> and <code>listTag</code> on changes, without notifying clients
         */
        public Builder map(ProjectionName projectionName, Class<?> documentType, String itemTagPrefix, String listTag) {
            return add(projectionName, documentType, itemTagPrefix, listTag, Optional.empty(), false);
        }

        /**
         * Invalidate <code>{itemTagPrefix}:{documentId}</code> and <code>listTag</code> on changes and notify clients using <code>entityType</code>
         */
        public Builder mapAndNotify(ProjectionName projectionName, Class<?> documentType, String itemTagPrefix, String listTag, String entityType) {
            checkNotNull(entityType, "No entityType provided");
            return add(projectionName, documentType, itemTagPrefix, listTag, Optional.of(entityType), false);
        }

        /**
         * Changes of the document type neither affect the cache nor clients
         */
        public Builder ignore(ProjectionName projectionName, Class<?> documentType) {
            return add(projectionName, documentType, null, null, Optional.empty(), true);
        }

        private Builder add(ProjectionName projectionName, Class<?> documentType, String itemTagPrefix, String listTag, Optional<String> entityType, boolean ignored) {
            checkNotNull(projectionName, "No projectionName provided");
            var typeName = ProjectionSession.documentTypeOf(documentType);
            if (!ignored) {
                checkNotNull(itemTagPrefix, "No itemTagPrefix provided");
                checkNotNull(listTag, "No listTag provided");
            }
            var mapping = new Mapping(projectionName, typeName, itemTagPrefix, listTag, entityType, ignored);
            checkArgument(mappings.putIfAbsent(key(projectionName, typeName), mapping) == null,
                          "Duplicate mapping for %s/%s", projectionName, typeName);
            return this;
        }

        public CacheInvalidationMappings build() {
            return new CacheInvalidationMappings(mappings);
        }
    }
}
