package dk.cloudcreate.bookstore.domain.tenant;

import dk.cloudcreate.bookstore.aggregates.AggregateDefinition;
import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.domain.Rules;

import java.util.*;

/**
 * The tenant registry as an aggregate: one stream per tenant inside the {@link TenantId#SYSTEM} partition.
 * The state is the tenant's display name
 */
public final class TenantAggregate {
    public static final AggregateDefinition<String, TenantRegistered> DEFINITION =
            AggregateDefinition.of("Tenant",
                                   TenantRegistered.class,
                                   streamId -> "",
                                   (name, event) -> event.getName());

    public static final int MAX_TENANT_ID_LENGTH = 100;

    public static final List<Class<? extends Command>> COMMANDS = List.of(RegisterTenant.class);

    private TenantAggregate() {
    }

    public static CommandHandlerRegistry.Builder registerHandlers(CommandHandlerRegistry.Builder builder) {
        return builder.register(RegisterTenant.class, DEFINITION, TenantAggregate::registerTenant);
    }

    static Decision registerTenant(RegisterTenant command, Optional<String> state) {
        var tenantId = command.getTenantId();
        var validation = ValidationFailure.builder();
        Rules.requiredText(validation, "tenantId", "Tenant id", tenantId, MAX_TENANT_ID_LENGTH);
        validation.fieldErrorIf(tenantId != null && TenantId.of(tenantId).isSystemTenant(), "tenantId", "The system tenant cannot be registered");
        if (validation.hasErrors()) {
            return Decision.rejected(validation.build());
        }
        if (state.isPresent()) {
            return Decision.noChange();
        }
        var name = Rules.isBlank(command.getName()) ? tenantId : command.getName();
        return Decision.events(new TenantRegistered(tenantId, name));
    }
}
