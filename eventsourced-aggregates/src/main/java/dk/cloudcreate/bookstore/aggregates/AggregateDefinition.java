package dk.cloudcreate.bookstore.aggregates;

import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import java.util.function.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Describes how the events of one event family are folded into the state of an aggregate.<br>
 * The state type should be immutable: {@link #apply(Object, Object)} returns a new state instead of changing the current one,
 * which allows command handlers to receive the rehydrated state as a snapshot.<br>
 * Implementations typically dispatch on the event through a visitor interface of the event family:
 * <pre>{@code
 * AggregateDefinition.of("Order",
 *                        OrderEvent.class,
 *                        OrderState::initial,
 *                        (state, event) -> event.accept(new OrderStateEvolver(state)));
 * }</pre>
 *
 * @param <STATE> the aggregate state type
 * @param <EVENT> the base type of the event family
 */
public interface AggregateDefinition<STATE, EVENT> {
    /**
     * @return name used in logs and errors, e.g. "Book"
     */
    String aggregateName();

    /**
     * @return the base type of every event that may occur in a stream of this aggregate
     */
    Class<EVENT> eventFamily();

    /**
     * @param streamId the stream being rehydrated
     * @return the state before the first event has been applied
     */
    STATE initialState(StreamId streamId);

    /**
     * Pure function: the same state and event always yields the same new state
     */
    STATE apply(STATE state, EVENT event);

    static <STATE, EVENT> AggregateDefinition<STATE, EVENT> of(String aggregateName,
                                                                Class<EVENT> eventFamily,
                                                                Function<StreamId, STATE> initialState,
                                                                BiFunction<STATE, EVENT, STATE> apply) {
        checkNotNull(aggregateName, "No aggregateName provided");
        checkNotNull(eventFamily, "No eventFamily provided");
        checkNotNull(initialState, "No initialState function provided");
        checkNotNull(apply, "No apply function provided");
        return new AggregateDefinition<>() {
            @Override
            public String aggregateName() {
                return aggregateName;
            }

            @Override
            public Class<EVENT> eventFamily() {
                return eventFamily;
            }

            @Override
            public STATE initialState(StreamId streamId) {
                return initialState.apply(streamId);
            }

            @Override
            public STATE apply(STATE state, EVENT event) {
                return apply.apply(state, event);
            }

            @Override
            public String toString() {
                return "AggregateDefinition{" + aggregateName + "}";
            }
        };
    }
}
