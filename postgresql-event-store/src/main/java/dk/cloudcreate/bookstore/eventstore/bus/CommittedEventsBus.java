package dk.cloudcreate.bookstore.eventstore.bus;

import dk.cloudcreate.bookstore.eventstore.PersistedEvent;
import org.slf4j.*;
import reactor.core.publisher.*;

import java.util.List;

/**
 * In process publication of committed events.<br>
 * Subscribers are signalled on the publishing thread and must hand off any real work
 */
public class CommittedEventsBus {
    private static final Logger log = LoggerFactory.getLogger(CommittedEventsBus.class);

    private final Sinks.Many<PersistedEvent> sink = Sinks.many().multicast().directBestEffort();

    public synchronized void publish(List<PersistedEvent> persistedEvents) {
        for (var persistedEvent : persistedEvents) {
            var result = sink.tryEmitNext(persistedEvent);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.warn("[{}:{}] Failed to publish committed event with global order {}: {}",
                         persistedEvent.tenantId(),
                         persistedEvent.streamId(),
                         persistedEvent.globalEventOrder(),
                         result);
            }
        }
    }

    public Flux<PersistedEvent> flux() {
        return sink.asFlux();
    }

    public void close() {
        sink.tryEmitComplete();
    }
}
