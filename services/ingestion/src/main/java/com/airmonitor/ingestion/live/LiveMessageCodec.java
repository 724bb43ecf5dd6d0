package com.airmonitor.ingestion.live;

import com.airmonitor.common.dto.live.LiveMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Turns live messages into the JSON text frames observers receive.
 */
@Component
public class LiveMessageCodec {

    private final ObjectMapper objectMapper;

    public LiveMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(LiveMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new LiveMessageEncodingException(
                    "Failed to encode " + message.getClass().getSimpleName() + " for device " + message.deviceId(), e);
        }
    }
}
