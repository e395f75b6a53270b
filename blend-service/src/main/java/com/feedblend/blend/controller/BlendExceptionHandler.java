package com.feedblend.blend.controller;

import com.feedblend.common.exception.BlendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps caller configuration errors to 400. Nothing here is retried.
 */
@RestControllerAdvice
public class BlendExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BlendExceptionHandler.class);

    @ExceptionHandler(BlendException.class)
    public ResponseEntity<Map<String, String>> handleBlendException(BlendException e) {
        log.warn("[BlendExceptionHandler] Rejected request: {}", e.getMessage());
        return badRequest(e.getClass().getSimpleName(), e.getComponent(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("[BlendExceptionHandler] Invalid request value: {}", e.getMessage());
        return badRequest("InvalidRequest", "request", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> badRequest(String error, String component, String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
            "error", error,
            "component", component,
            "message", message != null ? message : ""));
    }
}
