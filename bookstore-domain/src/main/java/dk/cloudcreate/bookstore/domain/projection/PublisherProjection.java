package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.publisher.PublisherEvent;
import dk.cloudcreate.bookstore.domain.publisher.PublisherEvent.*;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;

public class PublisherProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("publishers");

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(PublisherDocument.class);
    }

    @Override
    public boolean handles(Object event) {
        return event instanceof PublisherEvent;
    }

    @Override
    public void apply(PersistedEvent event, ProjectionSession session) {
        var publisherEvent = (PublisherEvent) event.event();
        var publisherId    = publisherEvent.getPublisherId();
        var timestamp      = event.timestamp();
        var existing       = session.load(PublisherDocument.class, publisherId);
        Optional<PublisherDocument> updated = publisherEvent.accept(new PublisherEvent.Visitor<>() {
            @Override
            public Optional<PublisherDocument> visit(PublisherAdded e) {
                return Optional.of(new PublisherDocument(publisherId, e.getName(), false, timestamp));
            }

            @Override
            public Optional<PublisherDocument> visit(PublisherUpdated e) {
                return existing.map(publisher -> new PublisherDocument(publisherId, e.getName(), publisher.isDeleted(), timestamp));
            }

            @Override
            public Optional<PublisherDocument> visit(PublisherSoftDeleted e) {
                return existing.map(publisher -> new PublisherDocument(publisherId, publisher.getName(), true, timestamp));
            }

            @Override
            public Optional<PublisherDocument> visit(PublisherRestored e) {
                return existing.map(publisher -> new PublisherDocument(publisherId, publisher.getName(), false, timestamp));
            }
        });
        updated.ifPresent(publisher -> session.store(publisherId, publisher));
    }
}
