package dk.cloudcreate.bookstore.common.tenant;

import dk.cloudcreate.bookstore.common.types.TenantId;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.*;

public class InMemoryTenantRegistry implements TenantRegistry {
    private final Map<TenantId, String> tenants = new ConcurrentHashMap<>();

    @Override
    public boolean isValid(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return tenantId.isSystemTenant() || tenants.containsKey(tenantId);
    }

    @Override
    public boolean register(TenantId tenantId, String name) {
        checkNotNull(tenantId, "No tenantId provided");
        checkArgument(!tenantId.isSystemTenant(), "The system tenant cannot be registered");
        return tenants.putIfAbsent(tenantId, name == null ? tenantId.toString() : name) == null;
    }

    @Override
    public Set<TenantId> registeredTenants() {
        return Set.copyOf(tenants.keySet());
    }

    @Override
    public Optional<String> nameOf(TenantId tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }
}
