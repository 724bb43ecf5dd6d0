package com.airmonitor.ingestion.live.websocket;

import com.airmonitor.common.dto.live.LiveMessage;
import com.airmonitor.common.dto.live.SnapshotMessage;
import com.airmonitor.common.dto.live.UpdateMessage;
import com.airmonitor.common.util.JsonUtil;
import com.airmonitor.ingestion.live.SubscriptionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LiveFeedIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private SubscriptionRegistry registry;

    @Test
    void observerGetsSnapshotThenLiveUpdateAndIsRemovedOnClose() {
        List<String> frames = new CopyOnWriteArrayList<>();
        ReactorNettyWebSocketClient client = new ReactorNettyWebSocketClient();

        client.execute(URI.create("ws://localhost:" + port + "/ws/devices/it-sensor-1"), session -> session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .doOnNext(frames::add)
                        .index()
                        .concatMap(frame -> frame.getT1() == 0
                                ? postReading("it-sensor-1").thenReturn(frame)
                                : Mono.just(frame))
                        .take(2)
                        .then())
                .block(Duration.ofSeconds(20));

        assertThat(frames).hasSize(2);
        LiveMessage first = JsonUtil.fromJson(frames.get(0), LiveMessage.class);
        assertThat(first).isEqualTo(SnapshotMessage.of("it-sensor-1", List.of()));

        LiveMessage second = JsonUtil.fromJson(frames.get(1), LiveMessage.class);
        assertThat(second).isInstanceOf(UpdateMessage.class);
        assertThat(((UpdateMessage) second).reading().deviceId()).isEqualTo("it-sensor-1");
        assertThat(frames.get(1)).contains("\"recorded_at\":\"2024-01-01T00:00:00Z\"");

        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(registry.hasEntry("it-sensor-1")).isFalse());
    }

    private Mono<String> postReading(String deviceId) {
        return WebClient.create("http://localhost:" + port)
                .post()
                .uri("/api/v1/readings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {
                        "device_id": "%s",
                        "recorded_at": "2024-01-01T00:00:00Z",
                        "carbon_monoxide_ppm": 0.4,
                        "temperature_celcius": 21.5,
                        "pm1_ug_m3": 3.1,
                        "pm2_5_ug_m3": 5.2,
                        "pm4_ug_m3": 6.0,
                        "pm10_ug_m3": 7.4
                    }
                    """.formatted(deviceId))
                .retrieve()
                .bodyToMono(String.class);
    }
}
