package dk.cloudcreate.bookstore.projection.postcommit;

import com.github.benmanes.caffeine.cache.*;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.projection.*;
import dk.cloudcreate.bookstore.projection.cache.*;
import dk.cloudcreate.bookstore.projection.notification.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Runs the side effects of committed projection batches: first the cache tags of every changed document are invalidated,
 * then clients are notified. A notification is never published for a change whose cache invalidation failed, so a client
 * reacting to a notification can't read a stale cached value.<br>
 * Redelivered changes (same document, kind and causing event) are recognized and skipped.
 */
public class PostCommitCoordinator implements ProjectionCommitListener {
    private static final Logger log = LoggerFactory.getLogger(PostCommitCoordinator.class);

    private final TaggedCache               cache;
    private final NotificationPublisher     notificationPublisher;
    private final CacheInvalidationMappings mappings;
    private final Clock                     clock;
    private final Cache<String, Boolean>    processedChanges;

    public PostCommitCoordinator(TaggedCache cache, NotificationPublisher notificationPublisher, CacheInvalidationMappings mappings) {
        this(cache, notificationPublisher, mappings, Clock.systemUTC(), 10_000);
    }

    public PostCommitCoordinator(TaggedCache cache,
                                 NotificationPublisher notificationPublisher,
                                 CacheInvalidationMappings mappings,
                                 Clock clock,
                                 long maxRememberedChanges) {
        this.cache = checkNotNull(cache, "No cache provided");
        this.notificationPublisher = checkNotNull(notificationPublisher, "No notificationPublisher provided");
        this.mappings = checkNotNull(mappings, "No mappings provided");
        this.clock = checkNotNull(clock, "No clock provided");
        this.processedChanges = Caffeine.newBuilder()
                                        .maximumSize(maxRememberedChanges)
                                        .build();
    }

    /**
     * Log a warning for every document type of the projections that has no mapping
     *
     * @return the unmapped <code>projection/documentType</code> pairs
     */
    public List<String> verifyMappings(Collection<? extends Projection> projections) {
        var unmapped = mappings.unmapped(projections);
        unmapped.forEach(pair -> log.warn("No cache invalidation mapping for '{}', cached reads may be stale and clients won't be notified", pair));
        return unmapped;
    }

    @Override
    public void onCommitted(ProjectionName projectionName, TenantId tenantId, List<DocumentChange> changes) {
        checkNotNull(changes, "No changes provided");
        for (var change : changes) {
            var changeKey = changeKey(change);
            if (processedChanges.getIfPresent(changeKey) != null) {
                log.debug("[{}:{}] Skipping already processed change {}", projectionName, tenantId, change);
                continue;
            }
            var mapping = mappings.lookup(projectionName, change.documentType);
            if (mapping.isEmpty()) {
                log.warn("[{}:{}] No cache invalidation mapping for document type '{}', skipping side effects of {}",
                         projectionName, tenantId, change.documentType, change);
                continue;
            }
            if (mapping.get().ignored) {
                processedChanges.put(changeKey, Boolean.TRUE);
                continue;
            }

            try {
                cache.invalidateByTag(CacheTags.itemTag(tenantId, mapping.get().itemTagPrefix, change.documentId));
                cache.invalidateByTag(CacheTags.listTag(tenantId, mapping.get().listTag));
            } catch (RuntimeException e) {
                log.error("[{}:{}] Cache invalidation failed for {}, no notification is published", projectionName, tenantId, change, e);
                continue;
            }

            var entityType = mapping.get().notificationEntityType;
            if (entityType.isPresent()) {
                var notification = new EntityChangedNotification(tenantId,
                                                                 entityType.get(),
                                                                 change.documentId,
                                                                 changeKindOf(change),
                                                                 change.version,
                                                                 OffsetDateTime.now(clock));
                try {
                    notificationPublisher.publish(notification);
                } catch (RuntimeException e) {
                    log.error("[{}:{}] Failed to publish {}", projectionName, tenantId, notification, e);
                }
            }
            processedChanges.put(changeKey, Boolean.TRUE);
        }
    }

    @Override
    public void onRebuildCompleted(ProjectionName projectionName, TenantId tenantId) {
        log.debug("[{}:{}] Invalidating cached reads after rebuild", projectionName, tenantId);
        cache.invalidateByTag(CacheTags.projectionTag(tenantId, projectionName));
        for (var mapping : mappings.mappingsFor(projectionName)) {
            if (!mapping.ignored) {
                cache.invalidateByTag(CacheTags.listTag(tenantId, mapping.listTag));
            }
        }
    }

    static EntityChangedNotification.ChangeKind changeKindOf(DocumentChange change) {
        if (change.kind == DocumentChange.Kind.DELETE || change.isSoftDeletion()) {
            return EntityChangedNotification.ChangeKind.DELETED;
        }
        if (change.kind == DocumentChange.Kind.INSERT) {
            return EntityChangedNotification.ChangeKind.CREATED;
        }
        return EntityChangedNotification.ChangeKind.UPDATED;
    }

    private static String changeKey(DocumentChange change) {
        return change.tenantId + "|" + change.projectionName + "|" + change.documentType + "|" + change.documentId + "|" + change.causedBy + "|" + change.kind + "|" + change.softDeleted;
    }
}
