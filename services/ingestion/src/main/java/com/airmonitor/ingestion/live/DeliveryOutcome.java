package com.airmonitor.ingestion.live;

/**
 * Result of offering a live update to one connection.
 */
public enum DeliveryOutcome {
    SENT,
    /** Held back until the snapshot has been sent. */
    DEFERRED,
    /** Older than what the observer already has. */
    STALE,
    CLOSED,
    FAILED
}
