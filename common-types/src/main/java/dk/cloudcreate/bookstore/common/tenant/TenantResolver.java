package dk.cloudcreate.bookstore.common.tenant;

import dk.cloudcreate.bookstore.common.types.TenantId;
import org.slf4j.*;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolves the {@link TenantId} of an inbound operation from request headers or a message envelope.<br>
 * A missing tenant is a {@link MissingTenantException}, an unregistered tenant is an {@link InvalidTenantException}.
 * Header names are matched case-insensitively
 */
public class TenantResolver {
    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    public static final String TENANT_HEADER = "X-Tenant-ID";

    private final TenantRegistry tenantRegistry;

    public TenantResolver(TenantRegistry tenantRegistry) {
        this.tenantRegistry = checkNotNull(tenantRegistry, "No tenantRegistry provided");
    }

    /**
     * @param headersOrEnvelope request headers or message envelope attributes
     * @return the validated tenant
     */
    public TenantId resolve(Map<String, String> headersOrEnvelope) {
        checkNotNull(headersOrEnvelope, "No headersOrEnvelope provided");
        var rawTenant = headersOrEnvelope.entrySet()
                                         .stream()
                                         .filter(entry -> TENANT_HEADER.equalsIgnoreCase(entry.getKey()))
                                         .map(Map.Entry::getValue)
                                         .filter(Objects::nonNull)
                                         .map(String::trim)
                                         .filter(value -> !value.isEmpty())
                                         .findFirst()
                                         .orElseThrow(() -> new MissingTenantException(String.format("No '%s' provided", TENANT_HEADER)));
        return validate(rawTenant);
    }

    /**
     * Validate a raw tenant value taken from an external source
     */
    public TenantId validate(String rawTenant) {
        checkNotNull(rawTenant, "No rawTenant provided");
        var tenantId = TenantId.of(rawTenant);
        if (tenantId.isSystemTenant()) {
            throw new InvalidTenantException(rawTenant, "the system tenant cannot be addressed by external callers");
        }
        if (!tenantRegistry.isValid(tenantId)) {
            log.warn("Rejecting unknown tenant '{}'", rawTenant);
            throw InvalidTenantException.unknownTenant(tenantId);
        }
        return tenantId;
    }
}
