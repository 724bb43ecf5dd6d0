package com.airmonitor.ingestion.controller;

import com.airmonitor.common.dto.reading.DeviceReading;
import com.airmonitor.common.dto.reading.ReadingPage;
import com.airmonitor.common.dto.reading.ReadingResponse;
import com.airmonitor.ingestion.service.ReadingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * REST controller for device readings.
 *
 * Endpoints:
 * - POST /api/v1/readings - Store a reading (and announce it to live observers)
 * - GET /api/v1/readings - Newest readings, optionally for one device
 *
 * Both are also served under /data, the path deployed devices already post to.
 */
@RestController
@RequestMapping({"/api/v1/readings", "/data"})
@Tag(name = "Readings", description = "Write and query air quality readings")
public class ReadingController {

    private static final Logger log = LoggerFactory.getLogger(ReadingController.class);

    private final ReadingService readingService;

    public ReadingController(ReadingService readingService) {
        this.readingService = readingService;
    }

    /**
     * Store a single reading.
     */
    @Operation(summary = "Store a reading", description = "Store one reading and push it to the device's live observers")
    @PostMapping(
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public Mono<ResponseEntity<ReadingResponse>> record(@Valid @RequestBody DeviceReading reading) {

        log.debug("Received reading: device={}, recordedAt={}", reading.deviceId(), reading.recordedAt());

        return readingService.record(reading)
                .map(response -> response.isSuccess()
                        ? ResponseEntity.status(HttpStatus.CREATED).body(response)
                        : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response));
    }

    /**
     * Newest readings first.
     */
    @Operation(summary = "Recent readings", description = "Newest readings first, for one device or across all devices")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ReadingPage> recent(
            @RequestParam(name = "device_id", required = false) String deviceId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        return readingService.recent(deviceId, limit).map(ReadingPage::of);
    }

    /**
     * Health check endpoint for simple connectivity test.
     */
    @Operation(summary = "Health check")
    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
