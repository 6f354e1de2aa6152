package dk.cloudcreate.bookstore.projection.cache;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.projection.ProjectionName;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tenant qualified cache tag names. Tags of different tenants never collide
 */
public final class CacheTags {
    private CacheTags() {
    }

    /**
     * @return <code>{tenant}:{itemTagPrefix}:{documentId}</code>, e.g. <code>acme:book:42</code>
     */
    public static String itemTag(TenantId tenantId, String itemTagPrefix, String documentId) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(itemTagPrefix, "No itemTagPrefix provided");
        checkNotNull(documentId, "No documentId provided");
        return tenantId + ":" + itemTagPrefix + ":" + documentId;
    }

    /**
     * @return <code>{tenant}:{listTag}</code>, e.g. <code>acme:books</code>
     */
    public static String listTag(TenantId tenantId, String listTag) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(listTag, "No listTag provided");
        return tenantId + ":" + listTag;
    }

    /**
     * Carried by every cached read of the projection, invalidated when a rebuilt generation replaces the active one
     */
    public static String projectionTag(TenantId tenantId, ProjectionName projectionName) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(projectionName, "No projectionName provided");
        return tenantId + ":projection:" + projectionName;
    }
}
