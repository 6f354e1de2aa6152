package dk.cloudcreate.bookstore.projection.notification;

import org.slf4j.*;

public class LoggingNotificationPublisher implements NotificationPublisher {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationPublisher.class);

    @Override
    public void publish(EntityChangedNotification notification) {
        log.info("[{}] {} {}:{} (version {})",
                 notification.tenantId,
                 notification.changeKind,
                 notification.entityType,
                 notification.entityId,
                 notification.version);
    }
}
