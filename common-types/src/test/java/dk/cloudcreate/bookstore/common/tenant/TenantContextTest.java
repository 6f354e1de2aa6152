package dk.cloudcreate.bookstore.common.tenant;

import dk.cloudcreate.bookstore.common.types.*;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class TenantContextTest {
    @Test
    void require_tenant_without_an_open_scope_fails() {
        assertThat(TenantContext.currentTenant()).isEmpty();
        assertThatThrownBy(TenantContext::requireTenant).isInstanceOf(MissingTenantException.class);
    }

    @Test
    void nested_scopes_restore_the_outer_tenant_and_mdc() {
        var acme   = TenantId.of("acme");
        var globex = TenantId.of("globex");

        try (var outer = TenantContext.open(acme, CorrelationId.of("c-1"))) {
            assertThat((Object) TenantContext.requireTenant()).isEqualTo(acme);
            assertThat(MDC.get(TenantContext.TENANT_ID_MDC_KEY)).isEqualTo("acme");

            try (var inner = TenantContext.open(globex)) {
                assertThat((Object) TenantContext.requireTenant()).isEqualTo(globex);
                assertThat(MDC.get(TenantContext.TENANT_ID_MDC_KEY)).isEqualTo("globex");
                assertThat(MDC.get(TenantContext.CORRELATION_ID_MDC_KEY)).isNull();
            }

            assertThat((Object) TenantContext.requireTenant()).isEqualTo(acme);
            assertThat(TenantContext.currentCorrelationId()).contains(CorrelationId.of("c-1"));
            assertThat(MDC.get(TenantContext.CORRELATION_ID_MDC_KEY)).isEqualTo("c-1");
        }

        assertThat(TenantContext.currentTenant()).isEmpty();
        assertThat(MDC.get(TenantContext.TENANT_ID_MDC_KEY)).isNull();
    }

    @Test
    void call_as_scopes_the_supplied_work() {
        var tenant = TenantContext.callAs(TenantId.of("acme"), TenantContext::requireTenant);

        assertThat((Object) tenant).isEqualTo(TenantId.of("acme"));
        assertThat(TenantContext.currentTenant()).isEmpty();
    }
}
