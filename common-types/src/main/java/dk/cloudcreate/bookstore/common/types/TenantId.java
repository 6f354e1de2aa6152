package dk.cloudcreate.bookstore.common.types;

/**
 * Identifies the tenant that owns a stream, a checkpoint, a read-model document or a cache entry.<br>
 * The {@link #SYSTEM} tenant is reserved for cross tenant administrative data such as the tenant registry
 */
public class TenantId extends CharSequenceType<TenantId> {
    public static final TenantId SYSTEM = new TenantId("*SYSTEM*");

    public TenantId(CharSequence value) {
        super(value);
    }

    public static TenantId of(CharSequence value) {
        return new TenantId(value);
    }

    public boolean isSystemTenant() {
        return SYSTEM.equals(this);
    }
}
