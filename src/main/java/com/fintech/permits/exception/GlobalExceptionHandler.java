package com.fintech.permits.exception;

import com.fintech.permits.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for the pipeline API.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        log.warn("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), request, null);
    }

    /**
     * Rejected state transitions and operations that conflict with work in progress
     */
    @ExceptionHandler({InvalidStateTransitionException.class, JobInProgressException.class,
            ScanInProgressException.class})
    public ResponseEntity<ErrorResponse> handleConflict(PipelineException ex, HttpServletRequest request) {
        log.warn("Conflict on {}: {}", request.getRequestURI(), ex.getMessage());
        String code = ex instanceof InvalidStateTransitionException ? "INVALID_STATE_TRANSITION"
                : ex instanceof JobInProgressException ? "JOB_IN_PROGRESS" : "SCAN_IN_PROGRESS";
        return error(HttpStatus.CONFLICT, code, ex.getMessage(), request, null);
    }

    @ExceptionHandler(InvalidWebhookSignatureException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignature(InvalidWebhookSignatureException ex,
                                                                HttpServletRequest request) {
        log.warn("Webhook rejected: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "INVALID_SIGNATURE", ex.getMessage(), request, null);
    }

    @ExceptionHandler(InvalidPaymentStateTokenException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateToken(InvalidPaymentStateTokenException ex,
                                                                 HttpServletRequest request) {
        log.warn("Payment state token rejected: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "INVALID_STATE_TOKEN", ex.getMessage(), request, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                          HttpServletRequest request) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.toList());
        log.warn("Validation failed on {}: {}", request.getRequestURI(), errors);
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", request, errors);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request, null);
    }

    @ExceptionHandler(TransientGatewayException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(TransientGatewayException ex, HttpServletRequest request) {
        log.warn("Backend unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "BACKEND_UNAVAILABLE", ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message,
                                                HttpServletRequest request, List<String> validationErrors) {
        ErrorResponse body = ErrorResponse.builder()
                .errorCode(code)
                .message(message)
                .status(status.value())
                .timestamp(LocalDateTime.now(clock))
                .path(request.getRequestURI())
                .validationErrors(validationErrors)
                .build();
        return ResponseEntity.status(status).body(body);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
