package dk.cloudcreate.bookstore.aggregates.command;

import java.util.*;

import static com.google.common.base.Preconditions.*;

/**
 * The outcome of a {@link CommandHandler}: either a rejection, no change, or events to append (optionally
 * accompanied by commands to run later)
 */
public final class Decision {
    private static final Decision NO_CHANGE = new Decision(List.of(), List.of(), null);

    private final List<Object>          events;
    private final List<DeferredCommand> deferredCommands;
    private final ValidationFailure     rejection;

    private Decision(List<Object> events, List<DeferredCommand> deferredCommands, ValidationFailure rejection) {
        this.events = events;
        this.deferredCommands = deferredCommands;
        this.rejection = rejection;
    }

    public static Decision events(Object... events) {
        return events(Arrays.asList(events));
    }

    public static Decision events(List<?> events) {
        checkNotNull(events, "No events provided");
        checkArgument(!events.isEmpty(), "At least one event must be provided, use Decision.noChange() instead");
        events.forEach(event -> checkNotNull(event, "Events cannot contain null"));
        return new Decision(List.copyOf(events), List.of(), null);
    }

    /**
     * The command is valid but already satisfied by the current state (idempotent re-delivery)
     */
    public static Decision noChange() {
        return NO_CHANGE;
    }

    public static Decision rejected(ValidationFailure failure) {
        return new Decision(List.of(), List.of(), checkNotNull(failure, "No failure provided"));
    }

    /**
     * Register a command that must be dispatched at or after its due time. The registration is committed together with the events
     */
    public Decision andSchedule(DeferredCommand deferredCommand) {
        checkNotNull(deferredCommand, "No deferredCommand provided");
        checkState(!events.isEmpty(), "Deferred commands can only accompany events");
        var newDeferredCommands = new ArrayList<>(deferredCommands);
        newDeferredCommands.add(deferredCommand);
        return new Decision(events, List.copyOf(newDeferredCommands), null);
    }

    public List<Object> events() {
        return events;
    }

    public List<DeferredCommand> deferredCommands() {
        return deferredCommands;
    }

    public Optional<ValidationFailure> rejection() {
        return Optional.ofNullable(rejection);
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public boolean isNoChange() {
        return rejection == null && events.isEmpty();
    }

    @Override
    public String toString() {
        if (rejection != null) {
            return "Decision{rejected=" + rejection + "}";
        }
        return "Decision{events=" + events.size() + ", deferredCommands=" + deferredCommands.size() + "}";
    }
}
