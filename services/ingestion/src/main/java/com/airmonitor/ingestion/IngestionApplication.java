package com.airmonitor.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Air Monitor Ingestion Service
 *
 * Stores air quality readings posted by devices and pushes every new reading
 * to the WebSocket observers of that device.
 */
@SpringBootApplication
public class IngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestionApplication.class, args);
    }
}
