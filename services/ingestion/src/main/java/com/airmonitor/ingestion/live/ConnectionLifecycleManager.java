package com.airmonitor.ingestion.live;

import com.airmonitor.common.dto.live.SnapshotMessage;
import com.airmonitor.common.dto.reading.DeviceReading;
import com.airmonitor.ingestion.store.DeviceReadingStore;
import com.airmonitor.ingestion.store.StoredReading;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;

/**
 * Joins observers to the live feed and takes them out again.
 *
 * <p>Joining registers the connection first and loads the snapshot second, so a reading committed in
 * between is either part of the snapshot or arrives as a live update right after it. Leaving runs
 * exactly once per connection no matter how many termination signals race.
 */
@Service
@Slf4j
public class ConnectionLifecycleManager {

    private final SubscriptionRegistry registry;
    private final DeviceReadingStore store;
    private final LiveMessageCodec codec;
    private final int snapshotSize;
    private final long snapshotRetryAttempts;
    private final Duration snapshotRetryBackoff;

    private final Counter connectionsOpened;
    private final Counter connectionsClosed;
    private final Counter snapshotFailures;

    public ConnectionLifecycleManager(
            SubscriptionRegistry registry,
            DeviceReadingStore store,
            LiveMessageCodec codec,
            @Value("${live.snapshot.size:100}") int snapshotSize,
            @Value("${live.snapshot.retry.max-attempts:3}") long snapshotRetryAttempts,
            @Value("${live.snapshot.retry.backoff:200ms}") Duration snapshotRetryBackoff,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.store = store;
        this.codec = codec;
        this.snapshotSize = snapshotSize;
        this.snapshotRetryAttempts = snapshotRetryAttempts;
        this.snapshotRetryBackoff = snapshotRetryBackoff;

        this.connectionsOpened = Counter.builder("live.connections.opened")
                .description("Observer connections that joined a live feed")
                .register(meterRegistry);

        this.connectionsClosed = Counter.builder("live.connections.closed")
                .description("Observer connections that left a live feed")
                .register(meterRegistry);

        this.snapshotFailures = Counter.builder("live.snapshot.failed")
                .description("Connections closed because the initial snapshot could not be sent")
                .register(meterRegistry);
    }

    /**
     * Registers the connection for its device, then sends the snapshot of recent readings.
     * Completes once the snapshot is out; never errors. A connection whose snapshot cannot be
     * loaded (after retries) or delivered is disconnected.
     */
    public Mono<Void> onConnect(ObserverConnection connection) {
        return Mono.defer(() -> {
            String deviceId = connection.deviceId();
            registry.register(deviceId, connection);
            connectionsOpened.increment();
            log.info("Observer {} joined device={}", connection.id(), deviceId);

            return store.recent(deviceId, snapshotSize)
                    .collectList()
                    .retryWhen(Retry.backoff(snapshotRetryAttempts, snapshotRetryBackoff)
                            .doBeforeRetry(signal -> log.warn("Snapshot load for device={} failed (attempt {}): {}",
                                    deviceId, signal.totalRetries() + 1, signal.failure().getMessage())))
                    .doOnNext(readings -> {
                        if (!sendSnapshot(connection, readings)) {
                            onDisconnect(connection, CloseCause.SEND_FAILED);
                        }
                    })
                    .onErrorResume(error -> {
                        snapshotFailures.increment();
                        log.warn("Closing observer {}: snapshot for device={} unavailable: {}",
                                connection.id(), deviceId, error.getMessage());
                        onDisconnect(connection, CloseCause.SNAPSHOT_FAILED);
                        return Mono.empty();
                    })
                    .then();
        });
    }

    /**
     * Unregisters and closes the connection. Only the first call per connection has any effect.
     */
    public void onDisconnect(ObserverConnection connection, CloseCause cause) {
        if (!connection.close()) {
            return;
        }
        registry.unregister(connection.deviceId(), connection);
        connectionsClosed.increment();
        log.info("Observer {} left device={} ({})", connection.id(), connection.deviceId(), cause);
    }

    private boolean sendSnapshot(ObserverConnection connection, List<StoredReading> stored) {
        List<DeviceReading> readings = stored.stream().map(StoredReading::reading).toList();
        String frame = codec.encode(SnapshotMessage.of(connection.deviceId(), readings));
        FeedPosition newest = stored.stream()
                .map(FeedPosition::of)
                .max(FeedPosition::compareTo)
                .orElse(null);
        log.debug("Sending snapshot of {} readings to {}", readings.size(), connection);
        return connection.sendSnapshot(newest, frame);
    }
}
