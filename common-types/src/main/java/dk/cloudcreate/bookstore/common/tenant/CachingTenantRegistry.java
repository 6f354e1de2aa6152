package dk.cloudcreate.bookstore.common.tenant;

import com.github.benmanes.caffeine.cache.*;
import dk.cloudcreate.bookstore.common.types.TenantId;

import java.time.Duration;
import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Caches the outcome of {@link TenantRegistry#isValid(TenantId)} lookups. Tenant validation happens on every request,
 * while the set of tenants changes rarely.<br>
 * Registering through this instance refreshes the cached entry immediately
 */
public class CachingTenantRegistry implements TenantRegistry {
    public static final Duration DEFAULT_VALIDITY = Duration.ofMinutes(5);

    private final TenantRegistry                delegate;
    private final LoadingCache<TenantId, Boolean> validTenants;

    public CachingTenantRegistry(TenantRegistry delegate) {
        this(delegate, DEFAULT_VALIDITY);
    }

    public CachingTenantRegistry(TenantRegistry delegate, Duration validity) {
        this.delegate = checkNotNull(delegate, "No delegate provided");
        checkNotNull(validity, "No validity provided");
        this.validTenants = Caffeine.newBuilder()
                                    .maximumSize(10_000)
                                    .expireAfterWrite(validity)
                                    .build(delegate::isValid);
    }

    @Override
    public boolean isValid(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return Boolean.TRUE.equals(validTenants.get(tenantId));
    }

    @Override
    public boolean register(TenantId tenantId, String name) {
        var added = delegate.register(tenantId, name);
        validTenants.invalidate(tenantId);
        return added;
    }

    @Override
    public Set<TenantId> registeredTenants() {
        return delegate.registeredTenants();
    }

    @Override
    public Optional<String> nameOf(TenantId tenantId) {
        return delegate.nameOf(tenantId);
    }
}
