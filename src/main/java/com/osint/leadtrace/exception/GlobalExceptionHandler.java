package com.osint.leadtrace.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice(basePackages = "com.osint.leadtrace.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleProjectNotFound(ProjectNotFoundException ex) {
        log.warn("Project not found: {}", ex.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "PROJECT_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvestigationRunNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleRunNotFound(InvestigationRunNotFoundException ex) {
        log.warn("Investigation run not found: {}", ex.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "RUN_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidInvestigationRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidInvestigationRequestException ex) {
        log.warn("Rejected investigation request: {}", ex.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return errorResponse(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    @ExceptionHandler(LookupClientException.class)
    public ResponseEntity<Map<String, Object>> handleLookupFailure(LookupClientException ex) {
        log.error("Lookup service error: {}", ex.getMessage(), ex);
        return errorResponse(HttpStatus.BAD_GATEWAY, "LOOKUP_FAILED", ex.getMessage());
    }

    @ExceptionHandler(GraphStoreException.class)
    public ResponseEntity<Map<String, Object>> handleGraphStoreFailure(GraphStoreException ex) {
        log.error("Graph store error: {}", ex.getMessage(), ex);
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "GRAPH_STORE_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String errorCode, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", errorCode);
        body.put("message", message);
        body.put("status", status.value());
        body.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
