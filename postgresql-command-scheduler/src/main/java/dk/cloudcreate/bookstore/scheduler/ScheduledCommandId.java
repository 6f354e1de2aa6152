package dk.cloudcreate.bookstore.scheduler;

import dk.cloudcreate.bookstore.common.types.CharSequenceType;

import java.util.UUID;

public class ScheduledCommandId extends CharSequenceType<ScheduledCommandId> {
    public ScheduledCommandId(CharSequence value) {
        super(value);
    }

    public static ScheduledCommandId of(CharSequence value) {
        return new ScheduledCommandId(value);
    }

    public static ScheduledCommandId random() {
        return new ScheduledCommandId(UUID.randomUUID().toString());
    }
}
