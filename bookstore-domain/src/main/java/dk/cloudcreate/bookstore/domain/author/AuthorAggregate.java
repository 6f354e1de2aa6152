package dk.cloudcreate.bookstore.domain.author;

import dk.cloudcreate.bookstore.aggregates.AggregateDefinition;
import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.domain.Rules;

import java.util.*;

import static dk.cloudcreate.bookstore.domain.author.AuthorCommands.*;
import static dk.cloudcreate.bookstore.domain.author.AuthorEvent.*;

public final class AuthorAggregate {
    public static final AggregateDefinition<AuthorState, AuthorEvent> DEFINITION =
            AggregateDefinition.of("Author",
                                   AuthorEvent.class,
                                   streamId -> AuthorState.initial(streamId.toString()),
                                   AuthorState::apply);

    public static final int MAX_NAME_LENGTH      = 200;
    public static final int MAX_BIOGRAPHY_LENGTH = 5000;

    private AuthorAggregate() {
    }

    public static List<Class<?>> eventTypes() {
        return List.of(AuthorAdded.class, AuthorUpdated.class, AuthorSoftDeleted.class, AuthorRestored.class);
    }

    public static CommandHandlerRegistry.Builder registerHandlers(CommandHandlerRegistry.Builder builder) {
        return builder.register(AddAuthor.class, DEFINITION, AuthorAggregate::addAuthor)
                      .register(UpdateAuthor.class, DEFINITION, AuthorAggregate::updateAuthor)
                      .register(SoftDeleteAuthor.class, DEFINITION, AuthorAggregate::softDeleteAuthor)
                      .register(RestoreAuthor.class, DEFINITION, AuthorAggregate::restoreAuthor);
    }

    static Decision addAuthor(AddAuthor command, Optional<AuthorState> state) {
        if (state.isPresent()) {
            return Decision.rejected(ValidationFailure.conflict("Author already exists"));
        }
        return validate(command.getName(), command.getBiography())
                .map(Decision::rejected)
                .orElseGet(() -> Decision.events(new AuthorAdded(command.getAuthorId(), command.getName(), command.getBiography())));
    }

    static Decision updateAuthor(UpdateAuthor command, Optional<AuthorState> state) {
        if (state.isEmpty() || state.get().deleted) {
            return Decision.rejected(ValidationFailure.notFound("Author not found"));
        }
        var failure = validate(command.getName(), command.getBiography());
        if (failure.isPresent()) {
            return Decision.rejected(failure.get());
        }
        var author = state.get();
        if (Objects.equals(author.name, command.getName()) && Objects.equals(author.biography, command.getBiography())) {
            return Decision.noChange();
        }
        return Decision.events(new AuthorUpdated(command.getAuthorId(), command.getName(), command.getBiography()));
    }

    static Decision softDeleteAuthor(SoftDeleteAuthor command, Optional<AuthorState> state) {
        if (state.isEmpty()) {
            return Decision.rejected(ValidationFailure.notFound("Author not found"));
        }
        if (state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Author is already deleted"));
        }
        return Decision.events(new AuthorSoftDeleted(command.getAuthorId()));
    }

    static Decision restoreAuthor(RestoreAuthor command, Optional<AuthorState> state) {
        if (state.isEmpty()) {
            return Decision.rejected(ValidationFailure.notFound("Author not found"));
        }
        if (!state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Author is not deleted"));
        }
        return Decision.events(new AuthorRestored(command.getAuthorId()));
    }

    private static Optional<ValidationFailure> validate(String name, String biography) {
        var validation = ValidationFailure.builder();
        Rules.requiredText(validation, "name", "Name", name, MAX_NAME_LENGTH);
        Rules.optionalText(validation, "biography", "Biography", biography, MAX_BIOGRAPHY_LENGTH);
        return validation.buildIfErrors();
    }
}
