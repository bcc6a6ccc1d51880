package com.prudhvi.vlm_relay.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Turns unexpected failures in the status endpoints into a JSON error body
 * instead of the default HTML error page.
 */
@RestControllerAdvice(assignableTypes = StatusController.class)
public class StatusExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(StatusExceptionHandler.class);

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(RuntimeException ex) {
        log.error("Status endpoint failed", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Status unavailable: " + ex.getMessage()));
    }
}
