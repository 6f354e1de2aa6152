package dk.cloudcreate.bookstore.scheduler.test_data;

import java.time.OffsetDateTime;

public abstract class ReminderEvent {
    private String reminderId;

    protected ReminderEvent() {
    }

    protected ReminderEvent(String reminderId) {
        this.reminderId = reminderId;
    }

    public String getReminderId() {
        return reminderId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visit(ReminderScheduled event);

        R visit(ReminderSent event);
    }

    public static class ReminderScheduled extends ReminderEvent {
        private OffsetDateTime sendAt;

        public ReminderScheduled() {
        }

        public ReminderScheduled(String reminderId, OffsetDateTime sendAt) {
            super(reminderId);
            this.sendAt = sendAt;
        }

        public OffsetDateTime getSendAt() {
            return sendAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class ReminderSent extends ReminderEvent {
        public ReminderSent() {
        }

        public ReminderSent(String reminderId) {
            super(reminderId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
