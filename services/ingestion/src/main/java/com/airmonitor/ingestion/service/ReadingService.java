package com.airmonitor.ingestion.service;

import com.airmonitor.common.dto.reading.DeviceReading;
import com.airmonitor.common.dto.reading.ReadingResponse;
import com.airmonitor.ingestion.live.notifier.ReadingCommittedEvent;
import com.airmonitor.ingestion.store.DeviceReadingStore;
import com.airmonitor.ingestion.store.StoredReading;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Write and read paths for device readings.
 */
@Service
public class ReadingService {

    private static final Logger log = LoggerFactory.getLogger(ReadingService.class);

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final DeviceReadingStore store;
    private final ApplicationEventPublisher eventPublisher;

    // Metrics
    private final Counter readingsReceived;
    private final Counter readingsStored;
    private final Counter readingsFailed;
    private final Timer insertLatency;

    public ReadingService(
            DeviceReadingStore store,
            ApplicationEventPublisher eventPublisher,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.eventPublisher = eventPublisher;

        this.readingsReceived = Counter.builder("ingestion.readings.received")
                .description("Number of readings received from devices")
                .register(meterRegistry);

        this.readingsStored = Counter.builder("ingestion.readings.stored")
                .description("Number of readings committed to the database")
                .register(meterRegistry);

        this.readingsFailed = Counter.builder("ingestion.readings.failed")
                .description("Number of readings that could not be stored")
                .register(meterRegistry);

        this.insertLatency = Timer.builder("ingestion.insert.latency")
                .description("Time taken to store a reading")
                .register(meterRegistry);
    }

    /**
     * Stores a reading. Only a committed reading is announced to the live feed.
     */
    public Mono<ReadingResponse> record(DeviceReading reading) {
        readingsReceived.increment();

        return Mono.defer(() -> {
                    Timer.Sample sample = Timer.start();
                    return store.insert(reading)
                            .doFinally(signal -> sample.stop(insertLatency));
                })
                .map(stored -> {
                    readingsStored.increment();
                    eventPublisher.publishEvent(new ReadingCommittedEvent(stored.deviceId(), stored.recordedAt()));
                    log.debug("Stored reading for device={}, recordedAt={}", stored.deviceId(), stored.recordedAt());
                    return ReadingResponse.success(stored.deviceId());
                })
                .onErrorResume(error -> {
                    readingsFailed.increment();
                    log.error("Failed to store reading for device={}: {}", reading.deviceId(), error.getMessage());
                    return Mono.just(ReadingResponse.error(
                            reading.deviceId(),
                            "Error inserting data into the database: " + error.getMessage()
                    ));
                });
    }

    /**
     * Newest readings, for one device or, when {@code deviceId} is null, for all devices.
     * The limit is clamped to [1, {@value #MAX_LIMIT}].
     */
    public Mono<List<DeviceReading>> recent(String deviceId, Integer limit) {
        int effectiveLimit = clampLimit(limit);
        log.debug("Fetching {} recent readings for device={}", effectiveLimit, deviceId);
        return (deviceId == null ? store.recent(effectiveLimit) : store.recent(deviceId, effectiveLimit))
                .map(StoredReading::reading)
                .collectList();
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }
}
