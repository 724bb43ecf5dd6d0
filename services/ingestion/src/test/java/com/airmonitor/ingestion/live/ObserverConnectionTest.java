package com.airmonitor.ingestion.live;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ObserverConnectionTest {

    private static final FeedPosition T1 = at("2024-01-01T00:00:00Z", 1);
    private static final FeedPosition T2 = at("2024-01-01T00:01:00Z", 2);
    private static final FeedPosition T3 = at("2024-01-01T00:02:00Z", 3);

    private final RecordingChannel channel = new RecordingChannel();
    private final ObserverConnection connection = new ObserverConnection("c1", "sensor-1", channel);

    @Test
    void updatesBeforeSnapshotAreHeldAndOnlyTheNewestIsFlushed() {
        assertThat(connection.sendUpdate(T2, "u2")).isEqualTo(DeliveryOutcome.DEFERRED);
        assertThat(connection.sendUpdate(T1, "u1")).isEqualTo(DeliveryOutcome.DEFERRED);
        assertThat(channel.frames()).isEmpty();

        assertThat(connection.sendSnapshot(T1, "snapshot")).isTrue();

        assertThat(channel.frames()).containsExactly("snapshot", "u2");
    }

    @Test
    void heldUpdateOlderThanSnapshotIsDropped() {
        connection.sendUpdate(T1, "u1");

        connection.sendSnapshot(T2, "snapshot");

        assertThat(channel.frames()).containsExactly("snapshot");
    }

    @Test
    void staleUpdatesAreSkippedAndTheSameReadingIsResent() {
        connection.sendSnapshot(null, "snapshot");

        assertThat(connection.sendUpdate(T2, "u2")).isEqualTo(DeliveryOutcome.SENT);
        assertThat(connection.sendUpdate(T1, "u1")).isEqualTo(DeliveryOutcome.STALE);
        assertThat(connection.sendUpdate(T2, "u2-again")).isEqualTo(DeliveryOutcome.SENT);
        assertThat(connection.sendUpdate(T3, "u3")).isEqualTo(DeliveryOutcome.SENT);

        assertThat(channel.frames()).containsExactly("snapshot", "u2", "u2-again", "u3");
    }

    @Test
    void tiedTimestampsAreOrderedByInsertion() {
        FeedPosition first = at("2024-01-01T00:05:00Z", 10);
        FeedPosition second = at("2024-01-01T00:05:00Z", 11);
        connection.sendSnapshot(null, "snapshot");

        assertThat(connection.sendUpdate(second, "second")).isEqualTo(DeliveryOutcome.SENT);
        assertThat(connection.sendUpdate(first, "first")).isEqualTo(DeliveryOutcome.STALE);

        assertThat(channel.frames()).containsExactly("snapshot", "second");
    }

    @Test
    void heldUpdateWithTiedTimestampKeepsTheLaterWrite() {
        connection.sendUpdate(at("2024-01-01T00:05:00Z", 11), "second");
        connection.sendUpdate(at("2024-01-01T00:05:00Z", 10), "first");

        connection.sendSnapshot(at("2024-01-01T00:05:00Z", 10), "snapshot");

        assertThat(channel.frames()).containsExactly("snapshot", "second");
    }

    @Test
    void snapshotIsSentOnlyOnce() {
        connection.sendSnapshot(null, "snapshot");
        connection.sendSnapshot(T1, "snapshot-again");

        assertThat(channel.frames()).containsExactly("snapshot");
    }

    @Test
    void rejectedSendIsReportedAsFailure() {
        connection.sendSnapshot(null, "snapshot");
        channel.rejectSends();

        assertThat(connection.sendUpdate(T1, "u1")).isEqualTo(DeliveryOutcome.FAILED);
    }

    @Test
    void closeFiresOnceAndStopsDelivery() {
        connection.sendSnapshot(null, "snapshot");

        assertThat(connection.close()).isTrue();
        assertThat(connection.close()).isFalse();

        assertThat(connection.isClosed()).isTrue();
        assertThat(channel.closeCalls()).isEqualTo(1);
        assertThat(connection.sendUpdate(T1, "u1")).isEqualTo(DeliveryOutcome.CLOSED);
        assertThat(channel.frames()).containsExactly("snapshot");
    }

    private static FeedPosition at(String recordedAt, long sequence) {
        return new FeedPosition(Instant.parse(recordedAt), sequence);
    }
}
