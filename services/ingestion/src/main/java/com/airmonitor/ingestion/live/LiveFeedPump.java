package com.airmonitor.ingestion.live;

import com.airmonitor.ingestion.live.notifier.ChangeNotifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Drains the change notifier into the dispatcher for as long as the service runs.
 * A failing event is logged and skipped; the stream itself keeps going.
 */
@Component
@Slf4j
public class LiveFeedPump {

    private final ChangeNotifier notifier;
    private final FanOutDispatcher dispatcher;
    private final int concurrency;
    private final Counter dispatchFailures;

    private Disposable subscription;

    public LiveFeedPump(
            ChangeNotifier notifier,
            FanOutDispatcher dispatcher,
            @Value("${live.dispatch.concurrency:32}") int concurrency,
            MeterRegistry meterRegistry) {
        this.notifier = notifier;
        this.dispatcher = dispatcher;
        this.concurrency = concurrency;
        this.dispatchFailures = Counter.builder("live.dispatch.failed")
                .description("Change events that could not be dispatched")
                .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        log.info("Starting live feed with dispatch concurrency {}", concurrency);
        subscription = notifier.changes()
                .flatMap(event -> dispatcher.onChange(event.deviceId())
                        .onErrorResume(error -> {
                            dispatchFailures.increment();
                            log.warn("Dispatch for device={} failed: {}", event.deviceId(), error.getMessage());
                            return Mono.empty();
                        }), concurrency)
                .subscribe(
                        v -> { },
                        error -> log.error("Live feed stopped, no further updates will be dispatched", error),
                        () -> log.error("Change stream completed, no further updates will be dispatched"));
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    public boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }
}
