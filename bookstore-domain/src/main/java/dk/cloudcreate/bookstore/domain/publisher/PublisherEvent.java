package dk.cloudcreate.bookstore.domain.publisher;

/**
 * The events of an publisher stream. The stream id is the publisher id
 */
public abstract class PublisherEvent {
    private String publisherId;

    protected PublisherEvent() {
    }

    protected PublisherEvent(String publisherId) {
        this.publisherId = publisherId;
    }

    public String getPublisherId() {
        return publisherId;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visit(PublisherAdded event);

        R visit(PublisherUpdated event);

        R visit(PublisherSoftDeleted event);

        R visit(PublisherRestored event);
    }

    public static class PublisherAdded extends PublisherEvent {
        private String name;

        public PublisherAdded() {
        }

        public PublisherAdded(String publisherId, String name) {
            super(publisherId);
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class PublisherUpdated extends PublisherEvent {
        private String name;

        public PublisherUpdated() {
        }

        public PublisherUpdated(String publisherId, String name) {
            super(publisherId);
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class PublisherSoftDeleted extends PublisherEvent {
        public PublisherSoftDeleted() {
        }

        public PublisherSoftDeleted(String publisherId) {
            super(publisherId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class PublisherRestored extends PublisherEvent {
        public PublisherRestored() {
        }

        public PublisherRestored(String publisherId) {
            super(publisherId);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
