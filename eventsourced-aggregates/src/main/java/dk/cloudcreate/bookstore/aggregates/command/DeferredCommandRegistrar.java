package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.common.types.*;

import java.util.Optional;

/**
 * Port through which the {@link CommandBus} hands {@link DeferredCommand}'s to the scheduler.<br>
 * When the {@link CommandBus} is configured with a unit of work factory the registration is called inside the same
 * unit of work as the event append, so both commit (or roll back) together
 */
public interface DeferredCommandRegistrar {
    DeferredCommandRegistrar NONE = (tenantId, deferredCommand, correlationId, causationId) -> {
        throw new CommandException("No DeferredCommandRegistrar configured, cannot register " + deferredCommand);
    };

    void register(TenantId tenantId, DeferredCommand deferredCommand, CorrelationId correlationId, Optional<EventId> causationId);
}
