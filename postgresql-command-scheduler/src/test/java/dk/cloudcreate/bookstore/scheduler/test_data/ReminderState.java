package dk.cloudcreate.bookstore.scheduler.test_data;

public final class ReminderState {
    public final String  reminderId;
    public final boolean sent;

    private ReminderState(String reminderId, boolean sent) {
        this.reminderId = reminderId;
        this.sent = sent;
    }

    public static ReminderState initial(String reminderId) {
        return new ReminderState(reminderId, false);
    }

    public ReminderState apply(ReminderEvent event) {
        return event.accept(new ReminderEvent.Visitor<>() {
            @Override
            public ReminderState visit(ReminderEvent.ReminderScheduled e) {
                return new ReminderState(reminderId, false);
            }

            @Override
            public ReminderState visit(ReminderEvent.ReminderSent e) {
                return new ReminderState(reminderId, true);
            }
        });
    }
}
