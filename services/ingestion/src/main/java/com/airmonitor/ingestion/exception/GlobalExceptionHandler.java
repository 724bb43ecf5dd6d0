package com.airmonitor.ingestion.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps failures on the readings API to {@link ErrorResponse} bodies: 400 for bodies or parameters
 * that do not bind or validate, 500 for anything else. Storage failures on the write path are not
 * exceptions here; the service reports them as an ERROR {@code ReadingResponse}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle validation errors.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());

        String path = exchange.getRequest().getPath().value();

        log.warn("Validation failed for {}: {}", path, details);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "Request validation failed",
                path,
                details
        );

        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    /**
     * Handle unreadable bodies and malformed parameters.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        String message = ex.getReason() != null ? ex.getReason() : "Invalid request";

        // Try to extract more specific error
        Throwable cause = ex.getMostSpecificCause();
        if (cause != ex && cause.getMessage() != null) {
            message = cause.getMessage();
        }

        log.warn("Invalid request for {}: {}", path, message);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Request",
                message,
                path
        );

        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.error("Unexpected error for {}: {}", path, ex.getMessage(), ex);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "An unexpected error occurred",
                path
        );

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response));
    }
}
