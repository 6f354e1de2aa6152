package dk.cloudcreate.bookstore.scheduler;

import dk.cloudcreate.bookstore.common.types.*;

import java.time.OffsetDateTime;
import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A persisted deferred command. The command is stored as JSON together with the fully qualified name of its class
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class ScheduledCommand {
    public final ScheduledCommandId       id;
    public final TenantId                 tenantId;
    public final String                   idempotencyKey;
    public final String                   commandType;
    public final String                   commandJson;
    public final OffsetDateTime           dueAt;
    public final CorrelationId            correlationId;
    public final Optional<EventId>        causationId;
    public final ScheduledCommandStatus   status;
    /**
     * Number of times the command has been claimed for dispatch
     */
    public final int                      dispatchAttempts;
    public final Optional<String>         lastError;
    public final Optional<OffsetDateTime> claimedAt;
    public final OffsetDateTime           createdAt;
    public final Optional<OffsetDateTime> completedAt;

    public ScheduledCommand(ScheduledCommandId id,
                            TenantId tenantId,
                            String idempotencyKey,
                            String commandType,
                            String commandJson,
                            OffsetDateTime dueAt,
                            CorrelationId correlationId,
                            Optional<EventId> causationId,
                            ScheduledCommandStatus status,
                            int dispatchAttempts,
                            Optional<String> lastError,
                            Optional<OffsetDateTime> claimedAt,
                            OffsetDateTime createdAt,
                            Optional<OffsetDateTime> completedAt) {
        this.id = checkNotNull(id, "No id provided");
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.idempotencyKey = checkNotNull(idempotencyKey, "No idempotencyKey provided");
        this.commandType = checkNotNull(commandType, "No commandType provided");
        this.commandJson = checkNotNull(commandJson, "No commandJson provided");
        this.dueAt = checkNotNull(dueAt, "No dueAt provided");
        this.correlationId = checkNotNull(correlationId, "No correlationId provided");
        this.causationId = checkNotNull(causationId, "No causationId option provided");
        this.status = checkNotNull(status, "No status provided");
        this.dispatchAttempts = dispatchAttempts;
        this.lastError = checkNotNull(lastError, "No lastError option provided");
        this.claimedAt = checkNotNull(claimedAt, "No claimedAt option provided");
        this.createdAt = checkNotNull(createdAt, "No createdAt provided");
        this.completedAt = checkNotNull(completedAt, "No completedAt option provided");
    }

    /**
     * A new {@link ScheduledCommandStatus#PENDING} entry
     */
    public static ScheduledCommand pending(TenantId tenantId,
                                           String idempotencyKey,
                                           String commandType,
                                           String commandJson,
                                           OffsetDateTime dueAt,
                                           CorrelationId correlationId,
                                           Optional<EventId> causationId,
                                           OffsetDateTime createdAt) {
        return new ScheduledCommand(ScheduledCommandId.random(),
                                    tenantId,
                                    idempotencyKey,
                                    commandType,
                                    commandJson,
                                    dueAt,
                                    correlationId,
                                    causationId,
                                    ScheduledCommandStatus.PENDING,
                                    0,
                                    Optional.empty(),
                                    Optional.empty(),
                                    createdAt,
                                    Optional.empty());
    }

    ScheduledCommand with(ScheduledCommandStatus status,
                          OffsetDateTime dueAt,
                          int dispatchAttempts,
                          Optional<String> lastError,
                          Optional<OffsetDateTime> claimedAt,
                          Optional<OffsetDateTime> completedAt) {
        return new ScheduledCommand(id, tenantId, idempotencyKey, commandType, commandJson, dueAt, correlationId, causationId,
                                    status, dispatchAttempts, lastError, claimedAt, createdAt, completedAt);
    }

    /**
     * @return a copy claimed at <code>now</code> with one more dispatch attempt
     */
    public ScheduledCommand claimed(OffsetDateTime now) {
        return with(ScheduledCommandStatus.CLAIMED, dueAt, dispatchAttempts + 1, lastError, Optional.of(now), Optional.empty());
    }

    public ScheduledCommand executed(OffsetDateTime now) {
        return with(ScheduledCommandStatus.EXECUTED, dueAt, dispatchAttempts, lastError, Optional.empty(), Optional.of(now));
    }

    public ScheduledCommand rescheduled(OffsetDateTime nextDueAt, String error) {
        return with(ScheduledCommandStatus.PENDING, nextDueAt, dispatchAttempts, Optional.of(error), Optional.empty(), Optional.empty());
    }

    public ScheduledCommand failed(OffsetDateTime now, String error) {
        return with(ScheduledCommandStatus.FAILED, dueAt, dispatchAttempts, Optional.of(error), Optional.empty(), Optional.of(now));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduledCommand)) return false;
        var that = (ScheduledCommand) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledCommand{" +
                "id=" + id +
                ", tenantId=" + tenantId +
                ", idempotencyKey='" + idempotencyKey + '\'' +
                ", commandType=" + commandType +
                ", dueAt=" + dueAt +
                ", status=" + status +
                ", dispatchAttempts=" + dispatchAttempts +
                lastError.map(error -> ", lastError='" + error + '\'').orElse("") +
                '}';
    }
}
