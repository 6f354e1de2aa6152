package dk.cloudcreate.bookstore.domain.tenant;

import dk.cloudcreate.bookstore.aggregates.command.Command;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

/**
 * Must be submitted for {@link dk.cloudcreate.bookstore.common.types.TenantId#SYSTEM}
 */
public class RegisterTenant implements Command {
    private String tenantId;
    private String name;

    RegisterTenant() {
    }

    public RegisterTenant(String tenantId, String name) {
        this.tenantId = tenantId;
        this.name = name;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getName() {
        return name;
    }

    @Override
    public StreamId streamId() {
        return StreamId.of(tenantId);
    }
}
