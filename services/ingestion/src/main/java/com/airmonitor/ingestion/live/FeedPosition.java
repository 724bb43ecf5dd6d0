package com.airmonitor.ingestion.live;

import com.airmonitor.ingestion.store.StoredReading;

import java.time.Instant;
import java.util.Comparator;

/**
 * Where a reading sits in its device's history: {@code recorded_at}, ties broken by insertion order.
 * The same order the store uses to answer "latest".
 */
public record FeedPosition(Instant recordedAt, long sequence) implements Comparable<FeedPosition> {

    private static final Comparator<FeedPosition> ORDER = Comparator
            .comparing(FeedPosition::recordedAt)
            .thenComparingLong(FeedPosition::sequence);

    public static FeedPosition of(StoredReading stored) {
        return new FeedPosition(stored.reading().recordedAt(), stored.sequence());
    }

    @Override
    public int compareTo(FeedPosition other) {
        return ORDER.compare(this, other);
    }
}
