package com.airmonitor.ingestion.model;

import com.airmonitor.common.dto.reading.DeviceReading;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the append-only {@code device_data} table.
 * The identity column doubles as insertion order for readings sharing a timestamp.
 */
@Entity
@Table(name = "device_data", indexes = {
    @Index(name = "idx_device_data_device_recorded", columnList = "device_id, recorded_at DESC, id DESC"),
    @Index(name = "idx_device_data_recorded", columnList = "recorded_at DESC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, length = DeviceReading.DEVICE_ID_MAX_LENGTH)
    private String deviceId;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "carbon_monoxide_ppm", nullable = false)
    private Double carbonMonoxidePpm;

    @Column(name = "temperature_celcius", nullable = false)
    private Double temperatureCelcius;

    @Column(name = "pm1_ug_m3", nullable = false)
    private Double pm1UgM3;

    @Column(name = "pm2_5_ug_m3", nullable = false)
    private Double pm25UgM3;

    @Column(name = "pm4_ug_m3", nullable = false)
    private Double pm4UgM3;

    @Column(name = "pm10_ug_m3", nullable = false)
    private Double pm10UgM3;

    public static DeviceReadingEntity fromReading(DeviceReading reading) {
        return DeviceReadingEntity.builder()
                .deviceId(reading.deviceId())
                .recordedAt(reading.recordedAt())
                .carbonMonoxidePpm(reading.carbonMonoxidePpm())
                .temperatureCelcius(reading.temperatureCelcius())
                .pm1UgM3(reading.pm1UgM3())
                .pm25UgM3(reading.pm25UgM3())
                .pm4UgM3(reading.pm4UgM3())
                .pm10UgM3(reading.pm10UgM3())
                .build();
    }

    public DeviceReading toReading() {
        return new DeviceReading(
                deviceId,
                recordedAt,
                carbonMonoxidePpm,
                temperatureCelcius,
                pm1UgM3,
                pm25UgM3,
                pm4UgM3,
                pm10UgM3
        );
    }
}
