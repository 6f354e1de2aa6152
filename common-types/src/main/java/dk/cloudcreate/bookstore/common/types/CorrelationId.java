package dk.cloudcreate.bookstore.common.types;

import java.util.*;

/**
 * Shared by every event and command that takes part in the same business transaction
 */
public class CorrelationId extends CharSequenceType<CorrelationId> {
    public CorrelationId(CharSequence value) {
        super(value);
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    public static Optional<CorrelationId> optionalFrom(CharSequence value) {
        return value == null ? Optional.empty() : Optional.of(new CorrelationId(value));
    }
}
