package dk.cloudcreate.bookstore.domain.projection;

import dk.cloudcreate.bookstore.domain.category.CategoryEvent;
import dk.cloudcreate.bookstore.domain.category.CategoryEvent.*;
import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;

import java.util.*;

public class CategoryProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("categories");

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(CategoryDocument.class);
    }

    @Override
    public boolean handles(Object event) {
        return event instanceof CategoryEvent;
    }

    @Override
    public void apply(PersistedEvent event, ProjectionSession session) {
        var categoryEvent = (CategoryEvent) event.event();
        var categoryId    = categoryEvent.getCategoryId();
        var timestamp     = event.timestamp();
        var existing      = session.load(CategoryDocument.class, categoryId);
        Optional<CategoryDocument> updated = categoryEvent.accept(new CategoryEvent.Visitor<>() {
            @Override
            public Optional<CategoryDocument> visit(CategoryAdded e) {
                return Optional.of(new CategoryDocument(categoryId, e.getName(), e.getDescription(), false, timestamp));
            }

            @Override
            public Optional<CategoryDocument> visit(CategoryUpdated e) {
                return existing.map(category -> new CategoryDocument(categoryId, e.getName(), e.getDescription(), category.isDeleted(), timestamp));
            }

            @Override
            public Optional<CategoryDocument> visit(CategorySoftDeleted e) {
                return existing.map(category -> new CategoryDocument(categoryId, category.getName(), category.getDescription(), true, timestamp));
            }

            @Override
            public Optional<CategoryDocument> visit(CategoryRestored e) {
                return existing.map(category -> new CategoryDocument(categoryId, category.getName(), category.getDescription(), false, timestamp));
            }
        });
        updated.ifPresent(category -> session.store(categoryId, category));
    }
}
