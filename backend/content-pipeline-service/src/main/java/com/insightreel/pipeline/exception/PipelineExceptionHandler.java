package com.insightreel.pipeline.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps pipeline exceptions to JSON error responses.
 */
@RestControllerAdvice(basePackages = "com.insightreel.pipeline.controller")
@Slf4j
public class PipelineExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(IllegalArgumentException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InsufficientContentException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientContent(InsufficientContentException ex) {
        log.info("Insufficient content: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(InvalidVideoRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidVideoRequestException ex) {
        log.info("Invalid video request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler(StateConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(StateConflictException ex) {
        log.info("State conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({TransientExternalException.class, PermanentExternalException.class})
    public ResponseEntity<Map<String, Object>> handleExternal(PipelineException ex) {
        log.error("External provider error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(PipelineException ex) {
        log.info("Rejected request [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
