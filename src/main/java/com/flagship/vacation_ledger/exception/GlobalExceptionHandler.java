package com.flagship.vacation_ledger.exception;

import com.flagship.vacation_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates workflow and request-binding failures into {@link ApiError} bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<ApiError> handleWorkflowException(WorkflowException e) {
        ErrorKind kind = e.getKind();
        if (kind == ErrorKind.AUTHORIZATION) {
            log.warn("Access denied: {}", e.getMessage());
        } else {
            log.info("Workflow rule refused operation: kind={}, message={}", kind, e.getMessage());
        }

        ApiError.ApiErrorBuilder error = ApiError.builder()
            .error(kind.getTitle())
            .kind(kind.name())
            .message(e.getMessage())
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now());

        if (e instanceof ValidationException validation) {
            error.details(Map.of("reason", validation.getReason().name()));
        }

        return ResponseEntity.status(kind.getHttpStatus()).body(error.build());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ApiError error = ApiError.builder()
            .error("Missing Required Header")
            .kind(ErrorKind.AUTHORIZATION.name())
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error(ErrorKind.VALIDATION.getTitle())
            .kind(ErrorKind.VALIDATION.name())
            .message("Request validation failed")
            .details(errors)
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());

        ApiError error = ApiError.builder()
            .error(ErrorKind.VALIDATION.getTitle())
            .kind(ErrorKind.VALIDATION.name())
            .message("Invalid value for parameter '" + e.getName() + "'")
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error(ErrorKind.VALIDATION.getTitle())
            .kind(ErrorKind.VALIDATION.name())
            .message("Malformed request body")
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .correlationId(CorrelationContext.getCorrelationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
