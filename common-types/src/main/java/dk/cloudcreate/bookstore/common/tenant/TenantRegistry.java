package dk.cloudcreate.bookstore.common.tenant;

import dk.cloudcreate.bookstore.common.types.TenantId;

import java.util.*;

/**
 * The registry of known tenants. The registry itself belongs to {@link TenantId#SYSTEM} and is not partitioned
 */
public interface TenantRegistry {
    /**
     * @param tenantId the tenant
     * @return true if the tenant is registered (the {@link TenantId#SYSTEM} tenant is always valid)
     */
    boolean isValid(TenantId tenantId);

    /**
     * Register a tenant. Registering an already registered tenant is a no-op
     *
     * @param tenantId the tenant
     * @param name     display name of the tenant
     * @return true if the tenant was added, false if it was already registered
     */
    boolean register(TenantId tenantId, String name);

    /**
     * @return all registered tenants, excluding {@link TenantId#SYSTEM}
     */
    Set<TenantId> registeredTenants();

    Optional<String> nameOf(TenantId tenantId);
}
