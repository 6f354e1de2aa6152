package dk.cloudcreate.bookstore.domain.publisher;

import dk.cloudcreate.bookstore.domain.publisher.PublisherEvent.*;

import java.util.Objects;

public final class PublisherState {
    public final String  publisherId;
    public final String  name;
    public final boolean deleted;

    private PublisherState(String publisherId, String name, boolean deleted) {
        this.publisherId = publisherId;
        this.name = name;
        this.deleted = deleted;
    }

    public static PublisherState initial(String publisherId) {
        return new PublisherState(publisherId, null, false);
    }

    public PublisherState apply(PublisherEvent event) {
        return event.accept(new PublisherEvent.Visitor<>() {
            @Override
            public PublisherState visit(PublisherAdded e) {
                return new PublisherState(publisherId, e.getName(), false);
            }

            @Override
            public PublisherState visit(PublisherUpdated e) {
                return new PublisherState(publisherId, e.getName(), deleted);
            }

            @Override
            public PublisherState visit(PublisherSoftDeleted e) {
                return new PublisherState(publisherId, name, true);
            }

            @Override
            public PublisherState visit(PublisherRestored e) {
                return new PublisherState(publisherId, name, false);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublisherState)) return false;
        var that = (PublisherState) o;
        return deleted == that.deleted && publisherId.equals(that.publisherId) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(publisherId, name, deleted);
    }

    @Override
    public String toString() {
        return "PublisherState{" + publisherId + ", name='" + name + "', deleted=" + deleted + '}';
    }
}
