package dk.cloudcreate.bookstore.projection.query;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.bookstore.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.bookstore.projection.DocumentChange;
import dk.cloudcreate.bookstore.projection.cache.*;
import dk.cloudcreate.bookstore.projection.postcommit.*;
import dk.cloudcreate.bookstore.projection.store.DocumentWrite;
import dk.cloudcreate.bookstore.projection.store.inmemory.InMemoryProjectionStore;
import dk.cloudcreate.bookstore.projection.test_data.*;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ProjectionQueriesTest {
    private static final TenantId ACME   = TenantId.of("acme");
    private static final TenantId GLOBEX = TenantId.of("globex");

    private InMemoryProjectionStore projectionStore;
    private JacksonJSONSerializer   jsonSerializer;
    private CaffeineTaggedCache     cache;
    private PostCommitCoordinator   coordinator;
    private ProjectionQueries       queries;

    @BeforeEach
    void setUp() {
        projectionStore = new InMemoryProjectionStore();
        jsonSerializer = new JacksonJSONSerializer();
        cache = new CaffeineTaggedCache(1_000, Duration.ofMinutes(5));
        var mappings = CacheInvalidationMappings.builder()
                                                .mapAndNotify(ProductCatalogProjection.NAME, ProductView.class, "product", "products", "Product")
                                                .map(ProductCatalogProjection.NAME, CategoryView.class, "category", "categories")
                                                .build();
        coordinator = new PostCommitCoordinator(cache, notification -> { }, mappings);
        queries = new ProjectionQueries(projectionStore, cache, mappings, jsonSerializer, Duration.ofMinutes(1));
    }

    @Test
    void cached_reads_are_refreshed_by_the_post_commit_invalidation() {
        // Given
        storeProduct(ACME, new ProductView("product-1", "Pencil", "office", false), 1, 1);
        assertThat(queries.findById(ProductCatalogProjection.NAME, ACME, ProductView.class, "product-1"))
                .hasValueSatisfying(result -> assertThat(result.document.getName()).isEqualTo("Pencil"));

        // When the document changes, the stale cached value is still served until the coordinator runs
        storeProduct(ACME, new ProductView("product-1", "Blue pencil", "office", false), 2, 2);
        assertThat(queries.findById(ProductCatalogProjection.NAME, ACME, ProductView.class, "product-1").get().document.getName()).isEqualTo("Pencil");
        coordinator.onCommitted(ProductCatalogProjection.NAME, ACME,
                                List.of(new DocumentChange(ProductCatalogProjection.NAME, ACME, "ProductView", "product-1",
                                                           DocumentChange.Kind.UPDATE, 2, false, false, GlobalEventOrder.of(2))));

        // Then
        var result = queries.findById(ProductCatalogProjection.NAME, ACME, ProductView.class, "product-1");
        assertThat(result).hasValueSatisfying(found -> {
            assertThat(found.document.getName()).isEqualTo("Blue pencil");
            assertThat(found.version).isEqualTo(2);
            assertThat(found.etag()).isEqualTo("\"2\"");
        });
        assertThat(queries.findAll(ProductCatalogProjection.NAME, ACME, ProductView.class)).extracting(found -> found.document.getName())
                                                                                            .containsExactly("Blue pencil");
    }

    @Test
    void tenants_never_see_each_others_documents() {
        // Given
        storeProduct(ACME, new ProductView("product-1", "Pencil", "office", false), 1, 1);
        storeProduct(GLOBEX, new ProductView("product-2", "Chair", "furniture", false), 1, 2);

        // When
        var acmeProducts   = queries.findAll(ProductCatalogProjection.NAME, ACME, ProductView.class);
        var globexProducts = queries.findAll(ProductCatalogProjection.NAME, GLOBEX, ProductView.class);

        // Then
        assertThat(acmeProducts).extracting(found -> found.document.getProductId()).containsExactly("product-1");
        assertThat(globexProducts).extracting(found -> found.document.getProductId()).containsExactly("product-2");
        assertThat(queries.findById(ProductCatalogProjection.NAME, GLOBEX, ProductView.class, "product-1")).isEmpty();
    }

    @Test
    void search_filters_the_documents() {
        // Given
        storeProduct(ACME, new ProductView("product-1", "Pencil", "office", false), 1, 1);
        storeProduct(ACME, new ProductView("product-2", "Chair", "furniture", false), 1, 2);

        // When
        var found = queries.search(ProductCatalogProjection.NAME, ACME, ProductView.class, product -> product.getCategory().equals("furniture"));

        // Then
        assertThat(found).extracting(result -> result.document.getName()).containsExactly("Chair");
    }

    private void storeProduct(TenantId tenantId, ProductView product, long version, long checkpoint) {
        projectionStore.commit(ProductCatalogProjection.NAME,
                               tenantId,
                               1,
                               List.of(DocumentWrite.upsert("ProductView", product.getProductId(), jsonSerializer.serialize(product), version, product.isDeleted())),
                               GlobalEventOrder.of(checkpoint));
    }
}
