package com.airmonitor.ingestion.live.websocket;

import com.airmonitor.ingestion.live.ObserverChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Bounded, non-blocking outbound queue in front of a WebSocket session.
 * A full buffer rejects the frame; the caller then treats the observer as gone.
 */
@Slf4j
class WebSocketObserverChannel implements ObserverChannel {

    private final WebSocketSession session;
    private final Sinks.Many<String> outbound;

    WebSocketObserverChannel(WebSocketSession session, int bufferSize) {
        this.session = session;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(bufferSize).get());
    }

    /**
     * Frames to write to the session, in the order they were accepted.
     */
    Flux<String> frames() {
        return outbound.asFlux();
    }

    @Override
    public synchronized boolean trySend(String frame) {
        Sinks.EmitResult result = outbound.tryEmitNext(frame);
        if (result.isFailure()) {
            log.debug("Session {} rejected frame: {}", session.getId(), result);
            return false;
        }
        return true;
    }

    @Override
    public synchronized void close() {
        outbound.tryEmitComplete();
        session.close().subscribe(
                null,
                error -> log.debug("Closing session {} failed: {}", session.getId(), error.getMessage()));
    }
}
