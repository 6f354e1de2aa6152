package dk.cloudcreate.bookstore.aggregates.command;

import java.time.OffsetDateTime;
import java.util.Objects;

import static com.google.common.base.Preconditions.*;

/**
 * A command that must be dispatched at or after <code>dueAt</code>. The <code>idempotencyKey</code> is unique per tenant;
 * registering the same key twice is ignored
 */
public final class DeferredCommand {
    public final OffsetDateTime dueAt;
    public final Command        command;
    public final String         idempotencyKey;

    public DeferredCommand(OffsetDateTime dueAt, Command command, String idempotencyKey) {
        this.dueAt = checkNotNull(dueAt, "No dueAt provided");
        this.command = checkNotNull(command, "No command provided");
        this.idempotencyKey = checkNotNull(idempotencyKey, "No idempotencyKey provided");
        checkArgument(!idempotencyKey.isBlank(), "idempotencyKey cannot be blank");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeferredCommand)) return false;
        var that = (DeferredCommand) o;
        return dueAt.equals(that.dueAt) && idempotencyKey.equals(that.idempotencyKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dueAt, idempotencyKey);
    }

    @Override
    public String toString() {
        return "DeferredCommand{" +
                "idempotencyKey='" + idempotencyKey + '\'' +
                ", dueAt=" + dueAt +
                ", command=" + command.getClass().getSimpleName() +
                '}';
    }
}
