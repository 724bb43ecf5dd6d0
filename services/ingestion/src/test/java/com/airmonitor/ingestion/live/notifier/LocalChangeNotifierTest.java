package com.airmonitor.ingestion.live.notifier;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

class LocalChangeNotifierTest {

    @Test
    void committedReadingsBecomeChangeEventsInOrder() {
        LocalChangeNotifier notifier = new LocalChangeNotifier();

        StepVerifier.create(notifier.changes().take(2))
                .then(() -> {
                    notifier.onReadingCommitted(new ReadingCommittedEvent("sensor-1", Instant.EPOCH));
                    notifier.onReadingCommitted(new ReadingCommittedEvent("sensor-2", Instant.EPOCH));
                })
                .expectNext(new ChangeEvent("sensor-1"), new ChangeEvent("sensor-2"))
                .verifyComplete();
    }

    @Test
    void eventsPublishedBeforeTheFeedStartsAreKept() {
        LocalChangeNotifier notifier = new LocalChangeNotifier();
        notifier.onReadingCommitted(new ReadingCommittedEvent("sensor-1", Instant.EPOCH));

        StepVerifier.create(notifier.changes().take(1))
                .expectNext(new ChangeEvent("sensor-1"))
                .verifyComplete();
    }
}
