package com.airmonitor.ingestion.live.websocket;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceFeedWebSocketHandlerTest {

    @Test
    void deviceIdIsTheLastPathSegment() {
        assertThat(DeviceFeedWebSocketHandler.deviceIdOf(URI.create("ws://localhost:8000/ws/devices/sensor-1")))
                .isEqualTo("sensor-1");
    }

    @Test
    void deviceIdKeepsCaseAndDecodesEscapes() {
        assertThat(DeviceFeedWebSocketHandler.deviceIdOf(URI.create("ws://localhost/ws/devices/Lab%20Sensor-7")))
                .isEqualTo("Lab Sensor-7");
    }

    @Test
    void missingOrNestedDeviceIdIsRejected() {
        assertThat(DeviceFeedWebSocketHandler.deviceIdOf(URI.create("ws://localhost/ws/devices/"))).isNull();
        assertThat(DeviceFeedWebSocketHandler.deviceIdOf(URI.create("ws://localhost/ws/devices/a/b"))).isNull();
        assertThat(DeviceFeedWebSocketHandler.deviceIdOf(URI.create("ws://localhost/other/sensor-1"))).isNull();
    }

    @Test
    void overlongDeviceIdIsRejected() {
        String longest = "d".repeat(255);

        assertThat(DeviceFeedWebSocketHandler.deviceIdOf(URI.create("ws://localhost/ws/devices/" + longest)))
                .isEqualTo(longest);
        assertThat(DeviceFeedWebSocketHandler.deviceIdOf(URI.create("ws://localhost/ws/devices/" + longest + "d")))
                .isNull();
    }
}
