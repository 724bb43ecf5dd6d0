package com.airmonitor.ingestion.config;

import com.airmonitor.ingestion.live.websocket.DeviceFeedWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

/**
 * Routes {@code /ws/devices/{deviceId}} to the live feed handler.
 */
@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping deviceFeedHandlerMapping(DeviceFeedWebSocketHandler handler) {
        // ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(Map.of(DeviceFeedWebSocketHandler.PATH_PREFIX + "*", handler), -1);
    }
}
