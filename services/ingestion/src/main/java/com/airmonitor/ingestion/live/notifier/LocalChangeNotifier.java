package com.airmonitor.ingestion.live.notifier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Change notifier for single-instance deployments: only writes made through this process are seen.
 * Fed by {@link ReadingCommittedEvent}s from the write path.
 */
@Component
@ConditionalOnProperty(name = "live.notifier.mode", havingValue = "local")
@Slf4j
public class LocalChangeNotifier implements ChangeNotifier {

    private static final int BUFFER_SIZE = 10_000;

    private final Sinks.Many<ChangeEvent> events =
            Sinks.many().multicast().onBackpressureBuffer(BUFFER_SIZE, false);

    @EventListener
    public void onReadingCommitted(ReadingCommittedEvent event) {
        publish(new ChangeEvent(event.deviceId()));
    }

    @Override
    public Flux<ChangeEvent> changes() {
        return events.asFlux();
    }

    // Sinks reject concurrent emitters, request threads are serialized here
    synchronized void publish(ChangeEvent event) {
        Sinks.EmitResult result = events.tryEmitNext(event);
        if (result.isFailure()) {
            log.warn("Change event for device={} dropped: {}", event.deviceId(), result);
        }
    }
}
