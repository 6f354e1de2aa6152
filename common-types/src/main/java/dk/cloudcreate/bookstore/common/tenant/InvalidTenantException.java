package dk.cloudcreate.bookstore.common.tenant;

import dk.cloudcreate.bookstore.common.types.TenantId;

public class InvalidTenantException extends TenantException {
    public final String tenantValue;

    public InvalidTenantException(String tenantValue, String reason) {
        super(String.format("Invalid tenant '%s': %s", tenantValue, reason));
        this.tenantValue = tenantValue;
    }

    public static InvalidTenantException unknownTenant(TenantId tenantId) {
        return new InvalidTenantException(tenantId.toString(), "tenant is not registered");
    }
}
