package dk.cloudcreate.bookstore.domain.publisher;

import dk.cloudcreate.bookstore.aggregates.command.Command;
import dk.cloudcreate.bookstore.eventstore.types.StreamId;

import java.util.List;

public final class PublisherCommands {
    public static final List<Class<? extends Command>> ALL = List.of(AddPublisher.class,
                                                                     UpdatePublisher.class,
                                                                     SoftDeletePublisher.class,
                                                                     RestorePublisher.class);

    private PublisherCommands() {
    }

    public abstract static class PublisherCommand implements Command {
        private String publisherId;

        protected PublisherCommand() {
        }

        protected PublisherCommand(String publisherId) {
            this.publisherId = publisherId;
        }

        public String getPublisherId() {
            return publisherId;
        }

        @Override
        public StreamId streamId() {
            return StreamId.of(publisherId);
        }
    }

    public static class AddPublisher extends PublisherCommand {
        private String name;

        AddPublisher() {
        }

        public AddPublisher(String publisherId, String name) {
            super(publisherId);
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    public static class UpdatePublisher extends PublisherCommand {
        private String name;

        UpdatePublisher() {
        }

        public UpdatePublisher(String publisherId, String name) {
            super(publisherId);
            this.name = name;
        }

        public String getName() {
            return name;
        }
    }

    public static class SoftDeletePublisher extends PublisherCommand {
        SoftDeletePublisher() {
        }

        public SoftDeletePublisher(String publisherId) {
            super(publisherId);
        }
    }

    public static class RestorePublisher extends PublisherCommand {
        RestorePublisher() {
        }

        public RestorePublisher(String publisherId) {
            super(publisherId);
        }
    }
}
