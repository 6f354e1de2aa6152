package dk.cloudcreate.bookstore.domain.tenant;

/**
 * Appended to the stream of the tenant inside the system tenant partition
 */
public class TenantRegistered {
    private String tenantId;
    private String name;

    public TenantRegistered() {
    }

    public TenantRegistered(String tenantId, String name) {
        this.tenantId = tenantId;
        this.name = name;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getName() {
        return name;
    }
}
