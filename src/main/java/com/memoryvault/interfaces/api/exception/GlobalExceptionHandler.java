package com.memoryvault.interfaces.api.exception;

import com.memoryvault.application.exceptions.DecryptionFailedException;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Provides centralized exception handling with:
 * - Uniform denial messages (a missing record reads like a forbidden one)
 * - No plaintext, key material or answers in error bodies
 * - Standard error format with validation details
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> ErrorResponse.ValidationError.builder()
                .field(error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName())
                .message(error.getDefaultMessage())
                .build())
            .collect(Collectors.toList());

        ErrorResponse errorResponse = error(HttpStatus.BAD_REQUEST, "Validation Failed",
            "Invalid request parameters", request);
        errorResponse.setValidationErrors(validationErrors);

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        ServletRequestBindingException.class
    })
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Unreadable request on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        }
        return ResponseEntity.badRequest()
            .body(error(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request", request));
    }

    /**
     * Handle denials returned by the vault, disclosure and authentication services.
     */
    @ExceptionHandler(RequestDeniedException.class)
    public ResponseEntity<ErrorResponse> handleDenied(
            RequestDeniedException ex,
            HttpServletRequest request) {

        HttpStatus status = statusFor(ex.getReason());

        if (log.isWarnEnabled()) {
            log.warn("Request denied: reason={} on {}", ex.getReason(), request.getRequestURI());
        }

        return ResponseEntity.status(status)
            .body(error(status, status.getReasonPhrase(), ex.getReason().getDisplayMessage(), request));
    }

    @ExceptionHandler(AuthenticationCredentialsNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleMissingSession(
            AuthenticationCredentialsNotFoundException ex,
            HttpServletRequest request) {

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .body(error(HttpStatus.UNAUTHORIZED, "Unauthorized",
                DenialReason.SESSION_NOT_FOUND.getDisplayMessage(), request));
    }

    /**
     * Handle illegal argument exceptions.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal argument: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.badRequest()
            .body(error(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(), request));
    }

    /**
     * Handle illegal state exceptions.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal state: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(error(HttpStatus.CONFLICT, "Invalid State",
                "Operation cannot be performed in current state", request));
    }

    /**
     * Stored ciphertext failed authentication. Never retried, never shown in detail.
     */
    @ExceptionHandler(DecryptionFailedException.class)
    public ResponseEntity<ErrorResponse> handleDecryptionFailed(
            DecryptionFailedException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("SECURITY: integrity fault on record {} at {}", ex.getRecordId(), request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(error(HttpStatus.INTERNAL_SERVER_ERROR, "Integrity Fault",
                "The record could not be read", request));
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support.", request));
    }

    public static HttpStatus statusFor(DenialReason reason) {
        return switch (reason) {
            case SESSION_EXPIRED, SESSION_NOT_FOUND, NOT_ENROLLED, AUTHENTICATION_DENIED,
                 CHALLENGE_FAILED, CHALLENGE_ATTEMPTS_EXHAUSTED -> HttpStatus.UNAUTHORIZED;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case CHALLENGE_NOT_PENDING -> HttpStatus.CONFLICT;
            case CATEGORY_NOT_COVERED, AUTHORIZATION_DENIED, RECORD_NOT_FOUND -> HttpStatus.FORBIDDEN;
        };
    }

    private static ErrorResponse error(HttpStatus status, String error, String message, HttpServletRequest request) {
        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .build();
    }
}
