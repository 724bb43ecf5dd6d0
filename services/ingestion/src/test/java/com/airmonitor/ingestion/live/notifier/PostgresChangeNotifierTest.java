package com.airmonitor.ingestion.live.notifier;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import reactor.test.StepVerifier;
import reactor.util.retry.RetryBackoffSpec;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PostgresChangeNotifierTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private PGConnection pgConnection;

    private SimpleMeterRegistry meterRegistry;
    private PostgresChangeNotifier notifier;

    @BeforeEach
    void setUp() throws SQLException {
        meterRegistry = new SimpleMeterRegistry();
        when(connection.createStatement()).thenReturn(statement);
        when(connection.unwrap(PGConnection.class)).thenReturn(pgConnection);
        notifier = new PostgresChangeNotifier(
                dataSource,
                Duration.ofMillis(10),
                Duration.ofMillis(5),
                Duration.ofMillis(20),
                meterRegistry);
    }

    @AfterEach
    void tearDown() {
        notifier.shutdown();
    }

    @Test
    void listensAndEmitsOneEventPerNotification() throws SQLException {
        PGNotification[] batch = {notification("sensor-1"), notification("sensor-2"), notification("sensor-1")};
        when(dataSource.getConnection()).thenReturn(connection);
        when(pgConnection.getNotifications(anyInt()))
                .thenReturn(null)
                .thenReturn(batch);

        StepVerifier.create(notifier.changes().take(3))
                .expectNext(new ChangeEvent("sensor-1"), new ChangeEvent("sensor-2"), new ChangeEvent("sensor-1"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(statement).execute("LISTEN device_data_inserted");
        verify(connection, atLeastOnce()).close();
    }

    @Test
    void reconnectsWhenTheDatabaseIsUnavailable() throws SQLException {
        PGNotification[] batch = {notification("sensor-1")};
        when(dataSource.getConnection())
                .thenThrow(new SQLException("connection refused"))
                .thenThrow(new SQLException("connection refused"))
                .thenReturn(connection);
        when(pgConnection.getNotifications(anyInt()))
                .thenReturn(batch);

        StepVerifier.create(notifier.changes().take(1))
                .expectNext(new ChangeEvent("sensor-1"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(dataSource, times(3)).getConnection();
        assertThat(meterRegistry.get("live.notifier.restarts").counter().count()).isEqualTo(2.0);
    }

    @Test
    void reconnectsWhenTheListeningConnectionBreaks() throws SQLException {
        PGNotification[] batch = {notification("sensor-1")};
        Statement brokenStatement = mock(Statement.class);
        Connection broken = mock(Connection.class);
        PGConnection brokenPg = mock(PGConnection.class);
        when(broken.createStatement()).thenReturn(brokenStatement);
        when(broken.unwrap(PGConnection.class)).thenReturn(brokenPg);
        when(brokenPg.getNotifications(anyInt())).thenThrow(new SQLException("An I/O error occurred"));

        when(dataSource.getConnection()).thenReturn(broken).thenReturn(connection);
        when(pgConnection.getNotifications(anyInt()))
                .thenReturn(batch);

        StepVerifier.create(notifier.changes().take(1))
                .expectNext(new ChangeEvent("sensor-1"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(broken).close();
        assertThat(meterRegistry.get("live.notifier.restarts").counter().count()).isEqualTo(1.0);
    }

    @Test
    void notificationsWithoutPayloadAreIgnored() throws SQLException {
        PGNotification[] batch = {notification(""), notification("sensor-3")};
        when(dataSource.getConnection()).thenReturn(connection);
        when(pgConnection.getNotifications(anyInt())).thenReturn(batch);

        StepVerifier.create(notifier.changes().take(1))
                .expectNext(new ChangeEvent("sensor-3"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void listensOnTheChannelTheInsertTriggerNotifies() throws IOException {
        String schema;
        try (InputStream in = getClass().getResourceAsStream("/db/schema.sql")) {
            assertThat(in).isNotNull();
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        assertThat(schema).contains("pg_notify('" + PostgresChangeNotifier.CHANNEL + "'");
    }

    @Test
    void backoffStartsOverOnceTheSubscriptionIsHealthyAgain() {
        RetryBackoffSpec spec = PostgresChangeNotifier.reconnect(Duration.ofSeconds(1), Duration.ofSeconds(30));

        assertThat(spec.isTransientErrors).isTrue();
        assertThat(spec.minBackoff).isEqualTo(Duration.ofSeconds(1));
        assertThat(spec.maxBackoff).isEqualTo(Duration.ofSeconds(30));
        assertThat(spec.maxAttempts).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void quietPollsKeepTheSubscriptionOpen() throws SQLException {
        PGNotification[] batch = {notification("sensor-4")};
        when(dataSource.getConnection()).thenReturn(connection);
        when(pgConnection.getNotifications(anyInt()))
                .thenReturn(new PGNotification[0])
                .thenReturn(null)
                .thenReturn(new PGNotification[0])
                .thenReturn(batch);

        StepVerifier.create(notifier.changes().take(1))
                .expectNext(new ChangeEvent("sensor-4"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(dataSource, times(1)).getConnection();
        assertThat(meterRegistry.find("live.notifier.restarts").counter().count()).isZero();
    }

    private static PGNotification notification(String deviceId) {
        PGNotification notification = mock(PGNotification.class);
        when(notification.getName()).thenReturn("device_data_inserted");
        when(notification.getParameter()).thenReturn(deviceId);
        return notification;
    }
}
