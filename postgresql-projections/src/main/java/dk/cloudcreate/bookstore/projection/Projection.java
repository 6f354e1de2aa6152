package dk.cloudcreate.bookstore.projection;

import dk.cloudcreate.bookstore.eventstore.PersistedEvent;

import java.util.Set;

/**
 * A read model built from the events of a single tenant.<br>
 * Projections are partial views: events they don't handle are skipped. {@link #apply(PersistedEvent, ProjectionSession)}
 * must be deterministic and idempotent, because events are delivered at least once and replayed in full on a rebuild.
 * All document access goes through the {@link ProjectionSession}.
 */
public interface Projection {
    ProjectionName name();

    /**
     * @return every document type this projection writes (used to verify that the post commit mappings are complete)
     */
    Set<Class<?>> documentTypes();

    /**
     * @param event the deserialized event payload
     * @return true if {@link #apply(PersistedEvent, ProjectionSession)} should be called for the event
     */
    boolean handles(Object event);

    void apply(PersistedEvent event, ProjectionSession session);
}
