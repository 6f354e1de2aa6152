package dk.cloudcreate.bookstore.aggregates.command;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Business rule rejection with field level detail
 */
public final class ValidationFailure {
    public enum Kind {
        /**
         * The command is malformed or violates a business rule (HTTP 400)
         */
        INVALID,
        /**
         * The targeted entity doesn't exist or is deleted (HTTP 404)
         */
        NOT_FOUND,
        /**
         * The command conflicts with the current business state (HTTP 409)
         */
        CONFLICT
    }

    public final Kind                      kind;
    public final String                    message;
    public final Map<String, List<String>> fieldErrors;

    private ValidationFailure(Kind kind, String message, Map<String, List<String>> fieldErrors) {
        this.kind = checkNotNull(kind, "No kind provided");
        this.message = checkNotNull(message, "No message provided");
        this.fieldErrors = checkNotNull(fieldErrors, "No fieldErrors provided");
    }

    public static ValidationFailure invalid(String field, String error) {
        return builder().fieldError(field, error).build();
    }

    public static ValidationFailure notFound(String message) {
        return new ValidationFailure(Kind.NOT_FOUND, message, Map.of());
    }

    public static ValidationFailure conflict(String message) {
        return new ValidationFailure(Kind.CONFLICT, message, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return kind + ": " + message + (fieldErrors.isEmpty() ? "" : " " + fieldErrors);
    }

    /**
     * Collects field errors; {@link #build()} yields an {@link Kind#INVALID} failure
     */
    public static final class Builder {
        private final Map<String, List<String>> fieldErrors = new LinkedHashMap<>();

        public Builder fieldError(String field, String error) {
            checkNotNull(field, "No field provided");
            checkNotNull(error, "No error provided");
            fieldErrors.computeIfAbsent(field, f -> new ArrayList<>()).add(error);
            return this;
        }

        public Builder fieldErrorIf(boolean condition, String field, String error) {
            return condition ? fieldError(field, error) : this;
        }

        public boolean hasErrors() {
            return !fieldErrors.isEmpty();
        }

        public ValidationFailure build() {
            var copy = new LinkedHashMap<String, List<String>>();
            fieldErrors.forEach((field, errors) -> copy.put(field, List.copyOf(errors)));
            return new ValidationFailure(Kind.INVALID, "One or more validation errors occurred", Collections.unmodifiableMap(copy));
        }

        public Optional<ValidationFailure> buildIfErrors() {
            return hasErrors() ? Optional.of(build()) : Optional.empty();
        }
    }
}
