package com.example.renderflow_backend.exception;

import com.example.renderflow_backend.util.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps pipeline errors onto HTTP responses carrying the structured {@link PipelineError}.
 */
@RestControllerAdvice(basePackages = "com.example.renderflow_backend.controller")
public class GlobalExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(PipelineException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            LOGGER.error("Pipeline error kind={}: {}", ex.getKind(), ex.getMessage(), ex);
        } else {
            LOGGER.warn("Rejected request kind={}: {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(ex.getError(), status));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOGGER.warn("Invalid request body: {}", message);
        PipelineError error = PipelineError.of(ErrorKind.VALIDATION_ERROR, message);
        return ResponseEntity.badRequest().body(body(error, HttpStatus.BAD_REQUEST));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case CONFIGURATION_ERROR -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ENGINE_ERROR, ARTIFACT_ERROR, TIMEOUT_ERROR -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static Map<String, Object> body(PipelineError error, HttpStatus status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", error.kind());
        body.put("message", error.message());
        body.put("retryable", error.retryable());
        body.put("status", status.value());
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
