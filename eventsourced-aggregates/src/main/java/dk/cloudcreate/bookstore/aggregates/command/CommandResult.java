package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.aggregates.ETag;
import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.eventstore.types.*;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

public final class CommandResult {
    public enum Outcome {
        CHANGED,
        NO_CHANGE
    }

    public final TenantId              tenantId;
    public final StreamId              streamId;
    public final Outcome               outcome;
    /**
     * The stream version after the command (unchanged for {@link Outcome#NO_CHANGE})
     */
    public final StreamVersion         version;
    public final List<PersistedEvent>  events;
    public final List<DeferredCommand> deferredCommands;

    CommandResult(TenantId tenantId, StreamId streamId, Outcome outcome, StreamVersion version, List<PersistedEvent> events, List<DeferredCommand> deferredCommands) {
        this.tenantId = checkNotNull(tenantId, "No tenantId provided");
        this.streamId = checkNotNull(streamId, "No streamId provided");
        this.outcome = checkNotNull(outcome, "No outcome provided");
        this.version = checkNotNull(version, "No version provided");
        this.events = List.copyOf(events);
        this.deferredCommands = List.copyOf(deferredCommands);
    }

    /**
     * @return the ETag to return to the caller
     */
    public ETag etag() {
        return ETag.of(version);
    }

    public boolean isChanged() {
        return outcome == Outcome.CHANGED;
    }

    @Override
    public String toString() {
        return "CommandResult{" +
                "tenantId=" + tenantId +
                ", streamId=" + streamId +
                ", outcome=" + outcome +
                ", version=" + version +
                ", events=" + events.size() +
                ", deferredCommands=" + deferredCommands.size() +
                '}';
    }
}
