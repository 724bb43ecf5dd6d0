package com.airmonitor.ingestion.live;

public class LiveMessageEncodingException extends RuntimeException {

    public LiveMessageEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
