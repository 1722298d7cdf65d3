package com.cloudcost.awspricing.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CostEngineException.class)
    public ResponseEntity<Map<String, Object>> handleCostEngineException(CostEngineException ex) {
        HttpStatus status = ex.getErrorCode().getHttpStatus();
        if (status.is5xxServerError()) {
            log.error("Cost engine failure: {}", ex.getMessage(), ex);
        } else {
            log.warn("Rejected request ({}): {}", ex.getErrorCode(), ex.getMessage());
        }

        Map<String, Object> response = buildErrorBody(status, ex.getMessage());
        response.put("error_code", ex.getErrorCode().name());
        Map<String, String> details = new LinkedHashMap<>(ex.getDetails());
        if (ex.getTraceId() != null) {
            details.putIfAbsent("trace_id", ex.getTraceId());
        }
        response.put("details", details);
        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage())
        );

        Map<String, Object> response = buildErrorBody(HttpStatus.BAD_REQUEST, "Validation Failed");
        response.put("error_code", ErrorCode.INVALID_RESOURCE.name());
        response.put("details", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        Map<String, Object> response = buildErrorBody(HttpStatus.BAD_REQUEST, "Malformed request body");
        response.put("error_code", ErrorCode.INVALID_RESOURCE.name());
        response.put("details", Map.of());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        Map<String, Object> response = buildErrorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        response.put("error_code", ErrorCode.UNSPECIFIED.name());
        response.put("details", Map.of());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private Map<String, Object> buildErrorBody(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", Instant.now());
        response.put("status", status.value());
        response.put("error", status.getReasonPhrase());
        response.put("message", message);
        return response;
    }
}
