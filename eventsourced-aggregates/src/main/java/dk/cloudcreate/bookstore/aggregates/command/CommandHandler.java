package dk.cloudcreate.bookstore.aggregates.command;

import java.util.Optional;

/**
 * Pure decision function: given the same command and state it returns the same {@link Decision}.<br>
 * A handler never performs I/O and never holds a reference to a store; the state it receives is an immutable snapshot
 *
 * @param <COMMAND> the command type
 * @param <STATE>   the aggregate state type
 */
@FunctionalInterface
public interface CommandHandler<COMMAND extends Command, STATE> {
    /**
     * @param command      the command
     * @param currentState the rehydrated aggregate state, or {@link Optional#empty()} if the stream doesn't exist yet
     * @return the decision
     */
    Decision handle(COMMAND command, Optional<STATE> currentState);
}
