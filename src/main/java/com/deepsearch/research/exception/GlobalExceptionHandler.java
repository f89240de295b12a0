package com.deepsearch.research.exception;

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
 * 딥 서치 API 전역 예외 처리
 */
@RestControllerAdvice(basePackages = "com.deepsearch.research.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidQuery(InvalidQueryException ex) {
        log.warn("Invalid query: {}", ex.getMessage());
        return build(ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", message);

        Map<String, Object> response = createErrorResponse(
                "INVALID_REQUEST", message, null, HttpStatus.BAD_REQUEST.value());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotFound(SessionNotFoundException ex) {
        log.warn("Session not found: {}", ex.getSessionId());
        return build(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(AnalysisServiceException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysisService(AnalysisServiceException ex) {
        log.error("Analysis service error: {}", ex.getMessage(), ex);
        return build(ex, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(DeepSearchException.class)
    public ResponseEntity<Map<String, Object>> handleDeepSearch(DeepSearchException ex) {
        log.error("Deep search error: {}", ex.getMessage(), ex);
        return build(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        Map<String, Object> response = createErrorResponse(
                "INTERNAL_ERROR",
                "An unexpected error occurred",
                null,
                HttpStatus.INTERNAL_SERVER_ERROR.value()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ResponseEntity<Map<String, Object>> build(DeepSearchException ex, HttpStatus status) {
        Map<String, Object> response = createErrorResponse(
                ex.getErrorCode(),
                ex.getMessage(),
                ex.getSessionId(),
                status.value()
        );
        return ResponseEntity.status(status).body(response);
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, String sessionId, int status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status);
        response.put("timestamp", LocalDateTime.now().toString());

        if (sessionId != null) {
            response.put("sessionId", sessionId);
        }

        return response;
    }
}
