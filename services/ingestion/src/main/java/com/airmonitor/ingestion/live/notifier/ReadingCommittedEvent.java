package com.airmonitor.ingestion.live.notifier;

import java.time.Instant;

/**
 * Application event published by the write path after a reading has been stored.
 */
public record ReadingCommittedEvent(String deviceId, Instant recordedAt) {
}
