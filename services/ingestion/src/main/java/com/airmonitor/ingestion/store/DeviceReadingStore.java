package com.airmonitor.ingestion.store;

import com.airmonitor.common.dto.reading.DeviceReading;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable, append-only storage of device readings.
 * Readings of one device are ordered by recorded timestamp, ties by insertion order.
 */
public interface DeviceReadingStore {

    /**
     * Persists a reading. The returned Mono completes once the write has committed.
     */
    Mono<DeviceReading> insert(DeviceReading reading);

    /**
     * Newest reading of the device, empty when the device has no data.
     */
    Mono<StoredReading> latest(String deviceId);

    /**
     * Up to {@code limit} readings of the device, newest first.
     */
    Flux<StoredReading> recent(String deviceId, int limit);

    /**
     * Up to {@code limit} readings over all devices, newest first.
     */
    Flux<StoredReading> recent(int limit);
}
