package dk.cloudcreate.bookstore.projection.notification;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Delivers {@link EntityChangedNotification}s to clients. Delivery is best effort
 */
public interface NotificationPublisher {
    void publish(EntityChangedNotification notification);

    /**
     * @return a publisher that publishes to this publisher and then to <code>next</code>
     */
    default NotificationPublisher andThen(NotificationPublisher next) {
        checkNotNull(next, "No next publisher provided");
        return notification -> {
            publish(notification);
            next.publish(notification);
        };
    }

    static NotificationPublisher composite(List<NotificationPublisher> publishers) {
        checkNotNull(publishers, "No publishers provided");
        return notification -> publishers.forEach(publisher -> publisher.publish(notification));
    }
}
