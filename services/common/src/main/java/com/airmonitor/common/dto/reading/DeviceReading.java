package com.airmonitor.common.dto.reading;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * One air quality reading reported by a device.
 * Used as the write API body, in read API pages and in live feed messages.
 *
 * Example JSON:
 * {
 *   "device_id": "sensor-1",
 *   "recorded_at": "2024-01-01T00:00:00Z",
 *   "carbon_monoxide_ppm": 0.4,
 *   "temperature_celcius": 21.5,
 *   "pm1_ug_m3": 3.1,
 *   "pm2_5_ug_m3": 5.2,
 *   "pm4_ug_m3": 6.0,
 *   "pm10_ug_m3": 7.4
 * }
 */
public record DeviceReading(
    @NotBlank(message = "Device ID is required")
    @Size(max = DeviceReading.DEVICE_ID_MAX_LENGTH, message = "Device ID must be at most 255 characters")
    @JsonProperty("device_id")
    String deviceId,

    @NotNull(message = "Recorded timestamp is required")
    @JsonProperty("recorded_at")
    Instant recordedAt,

    @NotNull(message = "Carbon monoxide level is required")
    @JsonProperty("carbon_monoxide_ppm")
    Double carbonMonoxidePpm,

    @NotNull(message = "Temperature is required")
    @JsonProperty("temperature_celcius")
    Double temperatureCelcius,

    @NotNull(message = "PM1 concentration is required")
    @JsonProperty("pm1_ug_m3")
    Double pm1UgM3,

    @NotNull(message = "PM2.5 concentration is required")
    @JsonProperty("pm2_5_ug_m3")
    Double pm25UgM3,

    @NotNull(message = "PM4 concentration is required")
    @JsonProperty("pm4_ug_m3")
    Double pm4UgM3,

    @NotNull(message = "PM10 concentration is required")
    @JsonProperty("pm10_ug_m3")
    Double pm10UgM3
) {
    /**
     * Longest accepted device id. Also bounds the NOTIFY payload, which carries the device id.
     */
    public static final int DEVICE_ID_MAX_LENGTH = 255;

    @JsonCreator
    public DeviceReading(
        @JsonProperty("device_id") String deviceId,
        @JsonProperty("recorded_at") Instant recordedAt,
        @JsonProperty("carbon_monoxide_ppm") Double carbonMonoxidePpm,
        @JsonProperty("temperature_celcius") Double temperatureCelcius,
        @JsonProperty("pm1_ug_m3") Double pm1UgM3,
        @JsonProperty("pm2_5_ug_m3") Double pm25UgM3,
        @JsonProperty("pm4_ug_m3") Double pm4UgM3,
        @JsonProperty("pm10_ug_m3") Double pm10UgM3
    ) {
        this.deviceId = deviceId;
        this.recordedAt = recordedAt;
        this.carbonMonoxidePpm = carbonMonoxidePpm;
        this.temperatureCelcius = temperatureCelcius;
        this.pm1UgM3 = pm1UgM3;
        this.pm25UgM3 = pm25UgM3;
        this.pm4UgM3 = pm4UgM3;
        this.pm10UgM3 = pm10UgM3;
    }
}
