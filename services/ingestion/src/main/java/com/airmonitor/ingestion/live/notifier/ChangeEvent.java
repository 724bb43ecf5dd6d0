package com.airmonitor.ingestion.live.notifier;

/**
 * "A new reading for this device has just committed."
 */
public record ChangeEvent(String deviceId) {
}
