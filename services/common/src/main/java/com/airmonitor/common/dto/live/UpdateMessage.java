package com.airmonitor.common.dto.live;

import com.airmonitor.common.dto.reading.DeviceReading;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A newly stored reading pushed to observers of its device.
 */
public record UpdateMessage(
    @JsonProperty("device_id")
    String deviceId,

    @JsonProperty("reading")
    DeviceReading reading
) implements LiveMessage {

    public static UpdateMessage of(DeviceReading reading) {
        return new UpdateMessage(reading.deviceId(), reading);
    }
}
