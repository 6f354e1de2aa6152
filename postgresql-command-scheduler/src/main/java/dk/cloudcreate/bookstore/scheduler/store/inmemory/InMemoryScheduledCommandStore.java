package dk.cloudcreate.bookstore.scheduler.store.inmemory;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.scheduler.*;
import dk.cloudcreate.bookstore.scheduler.store.ScheduledCommandStore;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.lenientFormat;

public class InMemoryScheduledCommandStore implements ScheduledCommandStore {
    private final Map<ScheduledCommandId, ScheduledCommand> entries = new LinkedHashMap<>();

    @Override
    public synchronized boolean register(ScheduledCommand scheduledCommand) {
        checkNotNull(scheduledCommand, "No scheduledCommand provided");
        if (find(scheduledCommand.tenantId, scheduledCommand.idempotencyKey).isPresent()) {
            return false;
        }
        entries.put(scheduledCommand.id, scheduledCommand);
        return true;
    }

    @Override
    public synchronized List<ScheduledCommand> claimDue(OffsetDateTime now, OffsetDateTime staleClaimsBefore, int batchSize) {
        checkNotNull(now, "No now provided");
        checkNotNull(staleClaimsBefore, "No staleClaimsBefore provided");
        var claimable = entries.values()
                               .stream()
                               .filter(entry -> isClaimable(entry, now, staleClaimsBefore))
                               .sorted(Comparator.comparing((ScheduledCommand entry) -> entry.dueAt).thenComparing(entry -> entry.createdAt))
                               .limit(batchSize)
                               .collect(Collectors.toList());
        var claimed = new ArrayList<ScheduledCommand>(claimable.size());
        for (var entry : claimable) {
            var claimedEntry = entry.claimed(now);
            entries.put(entry.id, claimedEntry);
            claimed.add(claimedEntry);
        }
        return claimed;
    }

    private static boolean isClaimable(ScheduledCommand entry, OffsetDateTime now, OffsetDateTime staleClaimsBefore) {
        switch (entry.status) {
            case PENDING:
                return !entry.dueAt.isAfter(now);
            case CLAIMED:
                return entry.claimedAt.map(claimedAt -> claimedAt.isBefore(staleClaimsBefore)).orElse(true);
            default:
                return false;
        }
    }

    @Override
    public synchronized void markExecuted(ScheduledCommandId id, OffsetDateTime executedAt) {
        entries.put(id, get(id).executed(executedAt));
    }

    @Override
    public synchronized void reschedule(ScheduledCommandId id, OffsetDateTime nextDueAt, String error) {
        entries.put(id, get(id).rescheduled(nextDueAt, error));
    }

    @Override
    public synchronized void markFailed(ScheduledCommandId id, OffsetDateTime failedAt, String error) {
        entries.put(id, get(id).failed(failedAt, error));
    }

    @Override
    public synchronized Optional<ScheduledCommand> find(TenantId tenantId, String idempotencyKey) {
        checkNotNull(tenantId, "No tenantId provided");
        checkNotNull(idempotencyKey, "No idempotencyKey provided");
        return entries.values()
                      .stream()
                      .filter(entry -> entry.tenantId.equals(tenantId) && entry.idempotencyKey.equals(idempotencyKey))
                      .findFirst();
    }

    @Override
    public synchronized List<ScheduledCommand> findAll(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return entries.values()
                      .stream()
                      .filter(entry -> entry.tenantId.equals(tenantId))
                      .sorted(Comparator.comparing(entry -> entry.dueAt))
                      .collect(Collectors.toList());
    }

    private ScheduledCommand get(ScheduledCommandId id) {
        checkNotNull(id, "No id provided");
        var entry = entries.get(id);
        if (entry == null) {
            throw new ScheduledCommandException(lenientFormat("Unknown scheduled command '%s'", id));
        }
        return entry;
    }
}
