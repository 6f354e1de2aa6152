package dk.cloudcreate.bookstore.domain.tenant;

import dk.cloudcreate.bookstore.common.types.TenantId;
import dk.cloudcreate.bookstore.domain.BookStoreEngine;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class EventSourcedTenantRegistryTest {
    private BookStoreEngine           engine;
    private EventSourcedTenantRegistry registry;

    @BeforeEach
    void setUp() {
        engine = BookStoreEngine.inMemory();
        registry = new EventSourcedTenantRegistry(engine.commandBus(), engine.eventStore());
    }

    @Test
    void the_system_tenant_is_always_valid() {
        assertThat(registry.isValid(TenantId.SYSTEM)).isTrue();
        assertThat(registry.isValid(TenantId.of("acme"))).isFalse();
    }

    @Test
    void registered_tenants_are_listed_in_registration_order() {
        // When
        assertThat(registry.register(TenantId.of("globex"), "Globex")).isTrue();
        assertThat(registry.register(TenantId.of("acme"), null)).isTrue();
        assertThat(registry.register(TenantId.of("globex"), "Globex again")).isFalse();

        // Then
        assertThat(registry.registeredTenants()).containsExactly(TenantId.of("globex"), TenantId.of("acme"));
        assertThat(registry.nameOf(TenantId.of("acme"))).hasValue("acme");
        assertThat(registry.nameOf(TenantId.of("globex"))).hasValue("Globex");
        assertThat(registry.nameOf(TenantId.of("initech"))).isEmpty();
        assertThat(registry.isValid(TenantId.of("acme"))).isTrue();
    }

    @Test
    void the_system_tenant_cannot_be_registered() {
        assertThatThrownBy(() -> registry.register(TenantId.SYSTEM, "System"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void the_caching_registry_sees_tenants_registered_through_the_engine() {
        // Given
        assertThat(engine.tenantRegistry().isValid(TenantId.of("acme"))).isFalse();

        // When
        engine.registerTenant(TenantId.of("acme"), "Acme");

        // Then
        assertThat(engine.tenantRegistry().isValid(TenantId.of("acme"))).isTrue();
    }
}
