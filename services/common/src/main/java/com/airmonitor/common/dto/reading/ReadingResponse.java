package com.airmonitor.common.dto.reading;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Response for a reading submitted to the write API.
 */
public record ReadingResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("device_id")
    String deviceId,

    @JsonProperty("received_at")
    Instant receivedAt,

    @JsonProperty("message")
    String message
) {
    public static ReadingResponse success(String deviceId) {
        return new ReadingResponse(
            "OK",
            deviceId,
            Instant.now(),
            "Data inserted into the database"
        );
    }

    public static ReadingResponse error(String deviceId, String message) {
        return new ReadingResponse(
            "ERROR",
            deviceId,
            Instant.now(),
            message
        );
    }

    public boolean isSuccess() {
        return "OK".equals(status);
    }
}
