package com.airmonitor.ingestion.live;

import com.airmonitor.common.dto.live.UpdateMessage;
import com.airmonitor.common.dto.reading.DeviceReading;
import com.airmonitor.ingestion.store.DeviceReadingStore;
import com.airmonitor.ingestion.store.StoredReading;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Pushes the latest reading of a device to everyone watching it.
 *
 * <p>Change events only say which device changed. The reading itself is always re-fetched, so
 * duplicated, reordered or stale events collapse into re-sends of the current latest value. Two
 * dispatches for one device may overlap; each observer's {@link FeedPosition} watermark drops
 * whichever of them carries the older reading.
 */
@Service
public class FanOutDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FanOutDispatcher.class);

    private final DeviceReadingStore store;
    private final SubscriptionRegistry registry;
    private final LiveMessageCodec codec;
    private final ConnectionLifecycleManager lifecycle;

    // Metrics
    private final Counter updatesDelivered;
    private final Counter updatesFailed;

    public FanOutDispatcher(
            DeviceReadingStore store,
            SubscriptionRegistry registry,
            LiveMessageCodec codec,
            ConnectionLifecycleManager lifecycle,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.registry = registry;
        this.codec = codec;
        this.lifecycle = lifecycle;

        this.updatesDelivered = Counter.builder("live.updates.delivered")
                .description("Live updates queued to observers")
                .register(meterRegistry);

        this.updatesFailed = Counter.builder("live.updates.failed")
                .description("Live updates observers could not accept")
                .register(meterRegistry);
    }

    /**
     * Handles one change event for {@code deviceId}. Errors only when the store query fails;
     * delivery problems are confined to the affected connection.
     */
    public Mono<Void> onChange(String deviceId) {
        return store.latest(deviceId)
                .doOnNext(stored -> fanOut(deviceId, stored))
                .then();
    }

    private void fanOut(String deviceId, StoredReading stored) {
        Set<ObserverConnection> subscribers = registry.subscribersOf(deviceId);
        if (subscribers.isEmpty()) {
            log.debug("No observers for device={}, nothing to send", deviceId);
            return;
        }

        DeviceReading reading = stored.reading();
        FeedPosition position = FeedPosition.of(stored);
        String frame;
        try {
            frame = codec.encode(UpdateMessage.of(reading));
        } catch (LiveMessageEncodingException e) {
            log.error("Dropping update for device={} recordedAt={}: {}",
                    deviceId, reading.recordedAt(), e.getMessage(), e);
            return;
        }

        for (ObserverConnection connection : subscribers) {
            deliver(connection, reading, position, frame);
        }
    }

    private void deliver(ObserverConnection connection, DeviceReading reading, FeedPosition position, String frame) {
        DeliveryOutcome outcome;
        try {
            outcome = connection.sendUpdate(position, frame);
        } catch (RuntimeException e) {
            log.warn("Send to {} failed: {}", connection, e.getMessage());
            outcome = DeliveryOutcome.FAILED;
        }

        switch (outcome) {
            case SENT -> updatesDelivered.increment();
            case FAILED -> {
                updatesFailed.increment();
                log.warn("Observer {} cannot keep up with device={}, disconnecting", connection.id(), reading.deviceId());
                lifecycle.onDisconnect(connection, CloseCause.SEND_FAILED);
            }
            default -> log.debug("Update for {} not sent: {}", connection, outcome);
        }
    }
}
