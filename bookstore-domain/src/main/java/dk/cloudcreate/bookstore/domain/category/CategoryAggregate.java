package dk.cloudcreate.bookstore.domain.category;

import dk.cloudcreate.bookstore.aggregates.AggregateDefinition;
import dk.cloudcreate.bookstore.aggregates.command.*;
import dk.cloudcreate.bookstore.domain.Rules;

import java.util.*;

import static dk.cloudcreate.bookstore.domain.category.CategoryCommands.*;
import static dk.cloudcreate.bookstore.domain.category.CategoryEvent.*;

public final class CategoryAggregate {
    public static final AggregateDefinition<CategoryState, CategoryEvent> DEFINITION =
            AggregateDefinition.of("Category",
                                   CategoryEvent.class,
                                   streamId -> CategoryState.initial(streamId.toString()),
                                   CategoryState::apply);

    public static final int MAX_NAME_LENGTH        = 100;
    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private CategoryAggregate() {
    }

    public static List<Class<?>> eventTypes() {
        return List.of(CategoryAdded.class, CategoryUpdated.class, CategorySoftDeleted.class, CategoryRestored.class);
    }

    public static CommandHandlerRegistry.Builder registerHandlers(CommandHandlerRegistry.Builder builder) {
        return builder.register(AddCategory.class, DEFINITION, CategoryAggregate::addCategory)
                      .register(UpdateCategory.class, DEFINITION, CategoryAggregate::updateCategory)
                      .register(SoftDeleteCategory.class, DEFINITION, CategoryAggregate::softDeleteCategory)
                      .register(RestoreCategory.class, DEFINITION, CategoryAggregate::restoreCategory);
    }

    static Decision addCategory(AddCategory command, Optional<CategoryState> state) {
        if (state.isPresent()) {
            return Decision.rejected(ValidationFailure.conflict("Category already exists"));
        }
        return validate(command.getName(), command.getDescription())
                .map(Decision::rejected)
                .orElseGet(() -> Decision.events(new CategoryAdded(command.getCategoryId(), command.getName(), command.getDescription())));
    }

    static Decision updateCategory(UpdateCategory command, Optional<CategoryState> state) {
        if (state.isEmpty() || state.get().deleted) {
            return Decision.rejected(ValidationFailure.notFound("Category not found"));
        }
        var failure = validate(command.getName(), command.getDescription());
        if (failure.isPresent()) {
            return Decision.rejected(failure.get());
        }
        var category = state.get();
        if (Objects.equals(category.name, command.getName()) && Objects.equals(category.description, command.getDescription())) {
            return Decision.noChange();
        }
        return Decision.events(new CategoryUpdated(command.getCategoryId(), command.getName(), command.getDescription()));
    }

    static Decision softDeleteCategory(SoftDeleteCategory command, Optional<CategoryState> state) {
        if (state.isEmpty()) {
            return Decision.rejected(ValidationFailure.notFound("Category not found"));
        }
        if (state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Category is already deleted"));
        }
        return Decision.events(new CategorySoftDeleted(command.getCategoryId()));
    }

    static Decision restoreCategory(RestoreCategory command, Optional<CategoryState> state) {
        if (state.isEmpty()) {
            return Decision.rejected(ValidationFailure.notFound("Category not found"));
        }
        if (!state.get().deleted) {
            return Decision.rejected(ValidationFailure.conflict("Category is not deleted"));
        }
        return Decision.events(new CategoryRestored(command.getCategoryId()));
    }

    private static Optional<ValidationFailure> validate(String name, String description) {
        var validation = ValidationFailure.builder();
        Rules.requiredText(validation, "name", "Name", name, MAX_NAME_LENGTH);
        Rules.optionalText(validation, "description", "Description", description, MAX_DESCRIPTION_LENGTH);
        return validation.buildIfErrors();
    }
}
