package dk.cloudcreate.bookstore.common.tenant;

import dk.cloudcreate.bookstore.common.types.*;
import org.slf4j.MDC;

import java.util.*;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thread scoped tenant (and correlation) context.<br>
 * A scope is opened by the component that received the work (command submission, projection worker, scheduled command dispatch)
 * and is mirrored into the logging {@link MDC} under {@link #TENANT_ID_MDC_KEY} and {@link #CORRELATION_ID_MDC_KEY}.<br>
 * Scopes nest; closing a scope restores the previous one.
 * <pre>{@code
 * try (var scope = TenantContext.open(tenantId, correlationId)) {
 *     ...
 * }
 * }</pre>
 */
public final class TenantContext {
    public static final String TENANT_ID_MDC_KEY      = "tenantId";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private static final ThreadLocal<Deque<Scope>> scopes = ThreadLocal.withInitial(ArrayDeque::new);

    private TenantContext() {
    }

    public static Scope open(TenantId tenantId) {
        return open(tenantId, null);
    }

    public static Scope open(TenantId tenantId, CorrelationId correlationId) {
        var scope = new Scope(checkNotNull(tenantId, "No tenantId provided"), correlationId);
        scopes.get().push(scope);
        scope.applyToMdc();
        return scope;
    }

    public static <R> R callAs(TenantId tenantId, Supplier<R> work) {
        try (var ignored = open(tenantId)) {
            return work.get();
        }
    }

    public static void runAs(TenantId tenantId, Runnable work) {
        try (var ignored = open(tenantId)) {
            work.run();
        }
    }

    public static Optional<TenantId> currentTenant() {
        return Optional.ofNullable(scopes.get().peek()).map(scope -> scope.tenantId);
    }

    public static Optional<CorrelationId> currentCorrelationId() {
        return Optional.ofNullable(scopes.get().peek()).map(scope -> scope.correlationId);
    }

    /**
     * @return the tenant of the innermost open scope
     * @throws MissingTenantException if no scope is open on the current thread
     */
    public static TenantId requireTenant() {
        return currentTenant().orElseThrow(() -> new MissingTenantException("No tenant context is active for the current operation"));
    }

    public static final class Scope implements AutoCloseable {
        public final TenantId      tenantId;
        public final CorrelationId correlationId;
        private      boolean       closed;

        private Scope(TenantId tenantId, CorrelationId correlationId) {
            this.tenantId = tenantId;
            this.correlationId = correlationId;
        }

        private void applyToMdc() {
            MDC.put(TENANT_ID_MDC_KEY, tenantId.toString());
            if (correlationId != null) {
                MDC.put(CORRELATION_ID_MDC_KEY, correlationId.toString());
            } else {
                MDC.remove(CORRELATION_ID_MDC_KEY);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            var stack = scopes.get();
            stack.remove(this);
            var previous = stack.peek();
            if (previous != null) {
                previous.applyToMdc();
            } else {
                MDC.remove(TENANT_ID_MDC_KEY);
                MDC.remove(CORRELATION_ID_MDC_KEY);
                scopes.remove();
            }
        }
    }
}
