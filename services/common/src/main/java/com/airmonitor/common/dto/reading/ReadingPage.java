package com.airmonitor.common.dto.reading;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Newest-first page of readings returned by the read API.
 */
public record ReadingPage(
    @JsonProperty("data")
    List<DeviceReading> data
) {
    public static ReadingPage of(List<DeviceReading> readings) {
        return new ReadingPage(List.copyOf(readings));
    }
}
