package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.author.AuthorEvent;
import dk.cloudcreate.bookstore.domain.author.AuthorEvent.*;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;

public class AuthorProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("authors");

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(AuthorDocument.class);
    }

    @Override
    public boolean handles(Object event) {
        return event instanceof AuthorEvent;
    }

    @Override
    public void apply(PersistedEvent event, ProjectionSession session) {
        var authorEvent = (AuthorEvent) event.event();
        var authorId    = authorEvent.getAuthorId();
        var timestamp   = event.timestamp();
        var existing    = session.load(AuthorDocument.class, authorId);
        Optional<AuthorDocument> updated = authorEvent.accept(new AuthorEvent.Visitor<>() {
            @Override
            public Optional<AuthorDocument> visit(AuthorAdded e) {
                return Optional.of(new AuthorDocument(authorId, e.getName(), e.getBiography(), false, timestamp));
            }

            @Override
            public Optional<AuthorDocument> visit(AuthorUpdated e) {
                return existing.map(author -> new AuthorDocument(authorId, e.getName(), e.getBiography(), author.isDeleted(), timestamp));
            }

            @Override
            public Optional<AuthorDocument> visit(AuthorSoftDeleted e) {
                return existing.map(author -> new AuthorDocument(authorId, author.getName(), author.getBiography(), true, timestamp));
            }

            @Override
            public Optional<AuthorDocument> visit(AuthorRestored e) {
                return existing.map(author -> new AuthorDocument(authorId, author.getName(), author.getBiography(), false, timestamp));
            }
        });
        updated.ifPresent(author -> session.store(authorId, author));
    }
}
