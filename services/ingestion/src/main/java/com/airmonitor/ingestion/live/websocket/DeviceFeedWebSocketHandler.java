package com.airmonitor.ingestion.live.websocket;

import com.airmonitor.common.dto.reading.DeviceReading;
import com.airmonitor.ingestion.live.CloseCause;
import com.airmonitor.ingestion.live.ConnectionLifecycleManager;
import com.airmonitor.ingestion.live.ObserverConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * WebSocket endpoint {@code /ws/devices/{deviceId}}: one live feed per connection, addressed by path.
 *
 * <p>Inbound frames are ignored; the receive side only tells us when the observer goes away, as a
 * single {@link CloseCause}. Every way a session can end funnels into
 * {@link ConnectionLifecycleManager#onDisconnect}.
 */
@Component
@Slf4j
public class DeviceFeedWebSocketHandler implements WebSocketHandler {

    public static final String PATH_PREFIX = "/ws/devices/";

    private final ConnectionLifecycleManager lifecycle;
    private final int bufferSize;

    public DeviceFeedWebSocketHandler(
            ConnectionLifecycleManager lifecycle,
            @Value("${live.connection.buffer-size:256}") int bufferSize) {
        this.lifecycle = lifecycle;
        this.bufferSize = bufferSize;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String deviceId = deviceIdOf(session.getHandshakeInfo().getUri());
        if (deviceId == null) {
            log.warn("Rejecting session {} without device id: {}", session.getId(), session.getHandshakeInfo().getUri());
            return session.close(CloseStatus.POLICY_VIOLATION);
        }

        WebSocketObserverChannel channel = new WebSocketObserverChannel(session, bufferSize);
        ObserverConnection connection = new ObserverConnection(session.getId(), deviceId, channel);

        Mono<Void> outbound = session.send(channel.frames().map(session::textMessage))
                .onErrorResume(error -> {
                    log.debug("Send to {} failed: {}", connection, error.getMessage());
                    lifecycle.onDisconnect(connection, CloseCause.SEND_FAILED);
                    return Mono.empty();
                });

        Mono<Void> inbound = session.receive()
                .doOnNext(message -> log.debug("Ignoring inbound {} frame from {}", message.getType(), connection))
                .then(Mono.just(CloseCause.CLIENT_CLOSED))
                .onErrorResume(error -> {
                    log.debug("Receive from {} failed: {}", connection, error.getMessage());
                    return Mono.just(CloseCause.TRANSPORT_ERROR);
                })
                .doOnNext(cause -> lifecycle.onDisconnect(connection, cause))
                .then();

        return Mono.when(lifecycle.onConnect(connection), inbound, outbound)
                .doFinally(signal -> lifecycle.onDisconnect(connection, CloseCause.SERVER_CLOSED));
    }

    static String deviceIdOf(URI uri) {
        String path = uri.getPath();
        if (path == null || !path.startsWith(PATH_PREFIX)) {
            return null;
        }
        String deviceId = path.substring(PATH_PREFIX.length());
        if (deviceId.isEmpty() || deviceId.contains("/") || deviceId.length() > DeviceReading.DEVICE_ID_MAX_LENGTH) {
            return null;
        }
        return deviceId;
    }
}
