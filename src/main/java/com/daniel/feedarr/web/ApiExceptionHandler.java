package com.daniel.feedarr.web;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.daniel.feedarr.cache.StorageException;
import com.daniel.feedarr.feed.UnknownFeedKindException;
import com.daniel.feedarr.upstream.UpstreamException;

@RestControllerAdvice
// Turns the typed feed errors into JSON {error, message} responses.
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownFeedKindException.class)
    public ResponseEntity<Map<String, String>> unknownFeedKind(UnknownFeedKindException ex) {
        return error(HttpStatus.BAD_REQUEST, "Invalid feed type",
                "Feed type must be one of: calendar, notification, queue");
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<Map<String, String>> upstream(UpstreamException ex) {
        log.warn("Manual refresh failed upstream: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "Upstream request failed", ex.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, String>> storage(StorageException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", ex.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                "error", error,
                "message", message == null ? "" : message));
    }
}
