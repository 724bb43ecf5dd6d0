package com.airmonitor.common.dto.live;

import com.airmonitor.common.dto.reading.DeviceReading;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * First frame on every live feed: the most recent readings of the device, newest first.
 * An empty list means the device has no stored data yet.
 */
public record SnapshotMessage(
    @JsonProperty("device_id")
    String deviceId,

    @JsonProperty("readings")
    List<DeviceReading> readings
) implements LiveMessage {

    public static SnapshotMessage of(String deviceId, List<DeviceReading> readings) {
        return new SnapshotMessage(deviceId, List.copyOf(readings));
    }
}
