package dk.cloudcreate.bookstore.scheduler.store;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.scheduler.*;

import java.time.OffsetDateTime;
import java.util.*;

/**
 * Durable storage of {@link ScheduledCommand}s.<br>
 * An entry is unique per tenant and idempotency key, and a claim is exclusive: two pollers claiming concurrently never receive
 * the same entry.
 */
public interface ScheduledCommandStore {
    /**
     * Persist a new entry. If the caller has an active unit of work the insert joins it, so the entry only exists if the events
     * that caused it were committed
     *
     * @return true if registered, false if an entry with the same tenant and idempotency key already exists
     */
    boolean register(ScheduledCommand scheduledCommand);

    /**
     * Claim up to <code>batchSize</code> entries that are {@link ScheduledCommandStatus#PENDING} and due at <code>now</code>,
     * together with {@link ScheduledCommandStatus#CLAIMED} entries whose claim is older than <code>staleClaimsBefore</code>.
     * Each claimed entry has its dispatch attempts incremented. Entries are returned in due order
     */
    List<ScheduledCommand> claimDue(OffsetDateTime now, OffsetDateTime staleClaimsBefore, int batchSize);

    void markExecuted(ScheduledCommandId id, OffsetDateTime executedAt);

    /**
     * Release a claimed entry back to {@link ScheduledCommandStatus#PENDING} with a new due time
     */
    void reschedule(ScheduledCommandId id, OffsetDateTime nextDueAt, String error);

    void markFailed(ScheduledCommandId id, OffsetDateTime failedAt, String error);

    Optional<ScheduledCommand> find(TenantId tenantId, String idempotencyKey);

    /**
     * All entries of the tenant ordered by due time
     */
    List<ScheduledCommand> findAll(TenantId tenantId);
}
