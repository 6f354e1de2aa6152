package dk.cloudcreate.bookstore.aggregates.command;

import dk.cloudcreate.bookstore.aggregates.AggregateDefinition;

import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.*;

/**
 * Explicit mapping from command type to the {@link CommandHandler} (and the {@link AggregateDefinition} of the aggregate it targets).<br>
 * Built once at startup:
 * <pre>{@code
 * var registry = CommandHandlerRegistry.builder()
 *                                      .register(PlaceOrder.class, OrderAggregate.DEFINITION, OrderAggregate::placeOrder)
 *                                      .register(AcceptOrder.class, OrderAggregate.DEFINITION, OrderAggregate::acceptOrder)
 *                                      .build(OrderCommands.ALL);
 * }</pre>
 * {@link Builder#build(Collection)} fails if any of the expected command types lacks a handler, so a missing handler
 * is detected when the engine is composed instead of when the command is first sent.
 */
public final class CommandHandlerRegistry {
    private final Map<Class<? extends Command>, Registration<?, ?>> registrations;

    private CommandHandlerRegistry(Map<Class<? extends Command>, Registration<?, ?>> registrations) {
        this.registrations = Map.copyOf(registrations);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnknownCommandException if no handler is registered for the command type
     */
    @SuppressWarnings("unchecked")
    public <COMMAND extends Command> Registration<COMMAND, ?> registrationFor(Class<COMMAND> commandType) {
        checkNotNull(commandType, "No commandType provided");
        var registration = registrations.get(commandType);
        if (registration == null) {
            throw new UnknownCommandException(commandType);
        }
        return (Registration<COMMAND, ?>) registration;
    }

    public boolean hasHandlerFor(Class<? extends Command> commandType) {
        return registrations.containsKey(commandType);
    }

    public Set<Class<? extends Command>> commandTypes() {
        return registrations.keySet();
    }

    /**
     * @param <COMMAND> the command type
     * @param <STATE>   the aggregate state type of the targeted aggregate
     */
    public static final class Registration<COMMAND extends Command, STATE> {
        public final Class<COMMAND>                 commandType;
        public final AggregateDefinition<STATE, ?>  definition;
        public final CommandHandler<COMMAND, STATE> handler;

        private Registration(Class<COMMAND> commandType, AggregateDefinition<STATE, ?> definition, CommandHandler<COMMAND, STATE> handler) {
            this.commandType = commandType;
            this.definition = definition;
            this.handler = handler;
        }
    }

    public static final class Builder {
        private final Map<Class<? extends Command>, Registration<?, ?>> registrations = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the command type already has a handler
         */
        public <COMMAND extends Command, STATE> Builder register(Class<COMMAND> commandType,
                                                                 AggregateDefinition<STATE, ?> definition,
                                                                 CommandHandler<COMMAND, STATE> handler) {
            checkNotNull(commandType, "No commandType provided");
            checkNotNull(definition, "No definition provided");
            checkNotNull(handler, "No handler provided");
            checkArgument(!registrations.containsKey(commandType), "Command %s already has a CommandHandler", commandType.getName());
            registrations.put(commandType, new Registration<>(commandType, definition, handler));
            return this;
        }

        public CommandHandlerRegistry build() {
            return new CommandHandlerRegistry(registrations);
        }

        /**
         * @param expectedCommandTypes every command type the application sends
         * @throws IllegalStateException if one or more of the expected command types has no handler
         */
        public CommandHandlerRegistry build(Collection<Class<? extends Command>> expectedCommandTypes) {
            checkNotNull(expectedCommandTypes, "No expectedCommandTypes provided");
            var missing = expectedCommandTypes.stream()
                                              .filter(commandType -> !registrations.containsKey(commandType))
                                              .map(Class::getName)
                                              .sorted()
                                              .collect(Collectors.toList());
            checkState(missing.isEmpty(), "Missing CommandHandler for: %s", missing);
            return build();
        }
    }
}
