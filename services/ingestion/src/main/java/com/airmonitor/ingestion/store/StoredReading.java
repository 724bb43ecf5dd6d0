package com.airmonitor.ingestion.store;

import com.airmonitor.common.dto.reading.DeviceReading;

/**
 * A reading as the store holds it. {@code sequence} is the row id and grows with insertion order.
 */
public record StoredReading(long sequence, DeviceReading reading) {
}
