package com.airmonitor.ingestion.live.notifier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns PostgreSQL {@code NOTIFY} messages from the {@code device_data} insert trigger into change events.
 *
 * <p>A dedicated connection runs {@code LISTEN} on {@link #CHANNEL} and is polled on its own thread. Any
 * failure, and any unexpected end of the stream, closes the connection and starts over after an
 * exponential backoff, forever. Each restart is logged and counted in {@code live.notifier.restarts}.
 * Every successful poll resets the backoff, so an outage days after the last one starts again from the
 * minimum delay.
 */
@Component
@ConditionalOnProperty(name = "live.notifier.mode", havingValue = "postgres", matchIfMissing = true)
@Slf4j
public class PostgresChangeNotifier implements ChangeNotifier {

    /**
     * Channel the trigger in {@code db/schema.sql} notifies on.
     */
    public static final String CHANNEL = "device_data_inserted";

    private final DataSource dataSource;
    private final int pollTimeoutMillis;
    private final Scheduler scheduler = Schedulers.newSingle("change-notifier");
    private final Counter restarts;
    private final Flux<ChangeEvent> changes;

    public PostgresChangeNotifier(
            DataSource dataSource,
            @Value("${live.notifier.poll-timeout:500ms}") Duration pollTimeout,
            @Value("${live.notifier.backoff.min:1s}") Duration minBackoff,
            @Value("${live.notifier.backoff.max:30s}") Duration maxBackoff,
            MeterRegistry meterRegistry) {
        this.dataSource = dataSource;
        this.pollTimeoutMillis = (int) Math.max(1, pollTimeout.toMillis());

        this.restarts = Counter.builder("live.notifier.restarts")
                .description("Times the change notifier lost its database subscription and reconnected")
                .tag("channel", CHANNEL)
                .register(meterRegistry);

        this.changes = Flux.using(this::listen, this::poll, this::release)
                .subscribeOn(scheduler)
                .concatWith(Flux.error(() -> new IllegalStateException("Notification stream ended")))
                .doOnError(error -> {
                    restarts.increment();
                    log.warn("Change notifier on channel {} failed, reconnecting: {}", CHANNEL, error.getMessage());
                })
                .retryWhen(reconnect(minBackoff, maxBackoff))
                .concatMapIterable(events -> events)
                .share();
    }

    // each poll emits a batch, possibly empty, which marks the subscription healthy again
    static RetryBackoffSpec reconnect(Duration minBackoff, Duration maxBackoff) {
        return Retry.backoff(Long.MAX_VALUE, minBackoff)
                .maxBackoff(maxBackoff)
                .transientErrors(true);
    }

    @Override
    public Flux<ChangeEvent> changes() {
        return changes;
    }

    @PreDestroy
    public void shutdown() {
        scheduler.dispose();
    }

    private Connection listen() throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            connection.setAutoCommit(true);
            try (Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + CHANNEL);
            }
            log.info("Listening for committed readings on channel {}", CHANNEL);
            return connection;
        } catch (SQLException e) {
            release(connection);
            throw e;
        }
    }

    private Flux<List<ChangeEvent>> poll(Connection connection) {
        return Flux.generate(sink -> receive(connection, sink));
    }

    private void receive(Connection connection, SynchronousSink<List<ChangeEvent>> sink) {
        try {
            PGNotification[] notifications = connection.unwrap(PGConnection.class)
                    .getNotifications(pollTimeoutMillis);
            if (notifications == null || notifications.length == 0) {
                sink.next(List.of());
                return;
            }
            List<ChangeEvent> events = new ArrayList<>(notifications.length);
            for (PGNotification notification : notifications) {
                String deviceId = notification.getParameter();
                if (deviceId == null || deviceId.isEmpty()) {
                    log.warn("Ignoring notification without device id on channel {}", notification.getName());
                    continue;
                }
                events.add(new ChangeEvent(deviceId));
            }
            log.debug("Received {} change notifications", events.size());
            sink.next(events);
        } catch (SQLException e) {
            sink.error(e);
        }
    }

    private void release(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Closing listener connection failed: {}", e.getMessage());
        }
    }
}
