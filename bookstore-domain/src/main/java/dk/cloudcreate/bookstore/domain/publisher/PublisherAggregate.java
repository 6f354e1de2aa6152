package dk.cloudcreate.bookstore.domain.publisher;

import dk.cloudcreate.bookstore.aggregates.AggregateDefinition;
import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.domain.Rules;

import java.util.*;

import static dk.cloudcreate.bookstore.domain.publisher.PublisherCommands.*;
import static dk.cloudcreate.bookstore.domain.publisher.PublisherEvent.*;

public final class PublisherAggregate {
    public static final AggregateDefinition<PublisherState, PublisherEvent> DEFINITION =
            AggregateDefinition.of("Publisher",
                                   PublisherEvent.class,
                                   streamId -> PublisherState.initial(streamId.toString()),
                                   PublisherState::apply);

    public static final int MAX_NAME_LENGTH = 200;

    private PublisherAggregate() {
    }

    public static List<Class<?>> eventTypes() {
        return List.of(PublisherAdded.class, PublisherUpdated.class, PublisherSoftDeleted.class, PublisherRestored.class);
    }

    public static CommandHandlerRegistry.Builder registerHandlers(CommandHandlerRegistry.Builder builder) {
        return builder.register(AddPublisher.class, DEFINITION, PublisherAggregate::addPublisher)
                      .register(UpdatePublisher.class, DEFINITION, PublisherAggregate::updatePublisher)
                      .register(SoftDeletePublisher.class, DEFINITION, PublisherAggregate::softDeletePublisher)
                      .register(RestorePublisher.class, DEFINITION, PublisherAggregate::restorePublisher);
    }

    static Decision addPublisher(AddPublisher command, Optional<PublisherState> state) {
        if (state.isPresent()) {
            return Decision.rejected(ValidationFailure.conflict("Publisher already exists"));
        }
        return validate(command.getName())
                .map(Decision::rejected)
                .orElseGet(() -> Decision.events(new PublisherAdded(command.getPublisherId(), command.getName())));
    }

    static Decision updatePublisher(UpdatePublisher command, Optional<PublisherState> state) {
        if (state.isEmpty() || state.get().deleted) {
            return Decision.rejected(ValidationFailure.notFound("Publisher not found"));
        }
        var failure = validate(command.getName());
        if (failure.isPresent()) {
            return Decision.rejected(failure.get());
        }
        var publisher = state.get();
        if (Objects.equals(publisher.name, command.getName())) {
            return Decision.noChange();
        }
        return Decision.events(new PublisherUpdated(command.getPublisherId(), command.getName()));
    }

    static Decision softDeletePublisher(SoftDeletePublisher command, Optional<PublisherState> state) {
        if (state.isEmpty()) {
            return Decision.rejected(ValidationFailure.notFound("Publisher not found"));
        }
        if (state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Publisher is already deleted"));
        }
        return Decision.events(new PublisherSoftDeleted(command.getPublisherId()));
    }

    static Decision restorePublisher(RestorePublisher command, Optional<PublisherState> state) {
        if (state.isEmpty()) {
            return Decision.rejected(ValidationFailure.notFound("Publisher not found"));
        }
        if (!state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Publisher is not deleted"));
        }
        return Decision.events(new PublisherRestored(command.getPublisherId()));
    }

    private static Optional<ValidationFailure> validate(String name) {
        var validation = ValidationFailure.builder();
        Rules.requiredText(validation, "name", "Name", name, MAX_NAME_LENGTH);
        return validation.buildIfErrors();
    }
}
