package dk.cloudcreate.bookstore.projection.notification;

import dk.cloudcreate.bookstore.common.types.TenantId;
import org.slf4j.*;
import reactor.core.publisher.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * In process notification hub. Subscribers only receive notifications of the tenant they subscribed to, and
 * slow subscribers drop notifications instead of blocking the publisher
 */
public class ReactorNotificationPublisher implements NotificationPublisher {
    private static final Logger log = LoggerFactory.getLogger(ReactorNotificationPublisher.class);

    private final Sinks.Many<EntityChangedNotification> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public synchronized void publish(EntityChangedNotification notification) {
        checkNotNull(notification, "No notification provided");
        var result = sink.tryEmitNext(notification);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("[{}] Failed to publish {}: {}", notification.tenantId, notification, result);
        }
    }

    public Flux<EntityChangedNotification> subscribe(TenantId tenantId) {
        checkNotNull(tenantId, "No tenantId provided");
        return sink.asFlux().filter(notification -> notification.tenantId.equals(tenantId));
    }

    public void close() {
        sink.tryEmitComplete();
    }
}
