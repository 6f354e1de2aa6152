package dk.cloudcreate.bookstore.projection.test_data;

import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import dk.cloudcreate.bookstore.projection.*;
import dk.cloudcreate.bookstore.projection.test_data.ProductEvents.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Products by id plus a denormalized per category count of active products
 */
public class ProductCatalogProjection implements Projection {
    public static final ProjectionName NAME = ProjectionName.of("product-catalog");

    private final Set<String> failingProductIds = ConcurrentHashMap.newKeySet();

    /**
     * Simulates a projection bug: applying any event of the product fails until {@link #stopFailing()}
     */
    public void failFor(String productId) {
        failingProductIds.add(productId);
    }

    public void stopFailing() {
        failingProductIds.clear();
    }

    @Override
    public ProjectionName name() {
        return NAME;
    }

    @Override
    public Set<Class<?>> documentTypes() {
        return Set.of(ProductView.class, CategoryView.class);
    }

    @Override
    public boolean handles(Object event) {
        return event instanceof ProductCreated || event instanceof ProductRenamed || event instanceof ProductDiscontinued;
    }

    @Override
    public void apply(PersistedEvent event, ProjectionSession session) {
        var payload = event.event();
        if (payload instanceof ProductCreated) {
            var created = (ProductCreated) payload;
            failIfRequested(created.getProductId());
            session.store(created.getProductId(), new ProductView(created.getProductId(), created.getName(), created.getCategory(), false));
            updateCategory(session, created.getCategory());
        } else if (payload instanceof ProductRenamed) {
            var renamed = (ProductRenamed) payload;
            failIfRequested(renamed.getProductId());
            session.load(ProductView.class, renamed.getProductId())
                   .ifPresent(product -> session.store(renamed.getProductId(), product.withName(renamed.getName())));
        } else if (payload instanceof ProductDiscontinued) {
            var discontinued = (ProductDiscontinued) payload;
            failIfRequested(discontinued.getProductId());
            session.load(ProductView.class, discontinued.getProductId())
                   .ifPresent(product -> {
                       session.store(discontinued.getProductId(), product.asDeleted());
                       updateCategory(session, product.getCategory());
                   });
        }
    }

    private void updateCategory(ProjectionSession session, String category) {
        var activeProducts = session.query(ProductView.class, product -> category.equals(product.getCategory()) && !product.isDeleted()).size();
        if (activeProducts == 0) {
            session.delete(CategoryView.class, category);
        } else {
            session.store(category, new CategoryView(category, activeProducts));
        }
    }

    private void failIfRequested(String productId) {
        if (failingProductIds.contains(productId)) {
            throw new IllegalStateException("Simulated failure for product " + productId);
        }
    }
}
