package com.ocadapter.controller;

import com.ocadapter.config.AdapterProperties;
import com.ocadapter.exception.BackendUnavailableException;
import com.ocadapter.exception.SessionCreateException;
import com.ocadapter.exception.ValidationException;
import com.ocadapter.ollama.OllamaWireAdapter;
import com.ocadapter.ollama.dto.OllamaChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps the failures allowed to reach the caller onto HTTP responses. Validation problems use
 * Ollama's {@code {"error": ...}} body; backend failures use an error-shaped chat response.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ApiExceptionHandler {

    private final OllamaWireAdapter wireAdapter;
    private final AdapterProperties properties;

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.warn("Rejected chat request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<OllamaChatResponse> handleBackendUnavailable(BackendUnavailableException ex) {
        log.error("OpenCode backend unavailable: {}", ex.getMessage());
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(SessionCreateException.class)
    public ResponseEntity<OllamaChatResponse> handleSessionCreate(SessionCreateException ex) {
        log.error("OpenCode session could not be created", ex);
        return errorResponse(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
        log.warn("Request failed status={} reason={}", ex.getStatusCode(), ex.getReason());
        String reason = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode()).body(Map.of("error", reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<OllamaChatResponse> handleUnexpected(Exception ex) {
        log.error("Error processing chat request", ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private ResponseEntity<OllamaChatResponse> errorResponse(HttpStatus status, Exception ex) {
        String message = ex.getMessage() != null ? ex.getMessage() : "Internal server error";
        return ResponseEntity.status(status)
                .body(wireAdapter.toErrorResponse(message, properties.getModel().getId()));
    }
}
