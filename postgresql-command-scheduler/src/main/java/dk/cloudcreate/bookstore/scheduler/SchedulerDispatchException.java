package dk.cloudcreate.bookstore.scheduler;

import dk.cloudcreate.bookstore.common.types.TenantId;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Dispatching a {@link ScheduledCommand} failed. A transient failure is redelivered according to the {@link RedeliveryPolicy},
 * a permanent failure marks the entry {@link ScheduledCommandStatus#FAILED}
 */
public class SchedulerDispatchException extends ScheduledCommandException {
    public final TenantId           tenantId;
    public final ScheduledCommandId scheduledCommandId;
    public final String             idempotencyKey;
    public final boolean            permanent;

    public SchedulerDispatchException(ScheduledCommand scheduledCommand, boolean permanent, Throwable cause) {
        super(lenientFormat("[%s:%s] %s failure dispatching %s: %s",
                            scheduledCommand.tenantId,
                            scheduledCommand.idempotencyKey,
                            permanent ? "Permanent" : "Transient",
                            scheduledCommand.commandType,
                            cause.getMessage()),
              cause);
        this.tenantId = scheduledCommand.tenantId;
        this.scheduledCommandId = scheduledCommand.id;
        this.idempotencyKey = scheduledCommand.idempotencyKey;
        this.permanent = permanent;
    }
}
