package dk.cloudcreate.bookstore.projection.notification;

import dk.cloudcreate.bookstore.common.types.TenantId;

import java.time.OffsetDateTime;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Tells clients that an entity visible through a read model changed. Only published after the change is committed
 * and the affected cache entries are invalidated
 */
public final class EntityChangedNotification {
    public enum ChangeKind {
        CREATED,
        UPDATED,
        DELETED
    }

    public final TenantId       tenantId;
    public final String         entityType;
    public final String         entityId;
    public final ChangeKind     changeKind;
    public final long           version;
    public final OffsetDateTime occurredAt;

    public EntityChangedNotification(TenantId tenantId, String entityType, String entityId, ChangeKind changeKind, long version, OffsetDateTime occurredAt) {
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.entityType = checkNotNull(entityType, "No entityType provided");
        this.entityId = checkNotNull(entityId, "No entityId provided");
        this.changeKind = checkNotNull(changeKind, "No changeKind provided");
        this.version = version;
        this.occurredAt = checkNotNull(occurredAt, "No occurredAt provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityChangedNotification)) return false;
        var that = (EntityChangedNotification) o;
        return version == that.version &&
                tenantId.equals(that.tenantId) &&
                entityType.equals(that.entityType) &&
                entityId.equals(that.entityId) &&
                changeKind == that.changeKind &&
                occurredAt.equals(that.occurredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, entityType, entityId, changeKind, version, occurredAt);
    }

    @Override
    public String toString() {
        return "EntityChangedNotification{" +
                tenantId + ":" + entityType + ":" + entityId +
                ", changeKind=" + changeKind +
                ", version=" + version +
                ", occurredAt=" + occurredAt +
                '}';
    }
}
