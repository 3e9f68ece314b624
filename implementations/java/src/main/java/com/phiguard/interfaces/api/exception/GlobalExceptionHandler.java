package com.phiguard.interfaces.api.exception;

import com.phiguard.application.LeaseConflictException;
import com.phiguard.application.RotationJobNotFoundException;
import com.phiguard.domain.model.RotationStateException;
import com.phiguard.infrastructure.crypto.DecryptionFailedException;
import com.phiguard.infrastructure.crypto.IntegrityException;
import com.phiguard.infrastructure.crypto.KeyConfigurationException;
import com.phiguard.infrastructure.crypto.KeyNotFoundException;
import com.phiguard.infrastructure.keys.KeyRetirementException;
import com.phiguard.interfaces.api.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Provides centralized exception handling with:
 * - No plaintext, ciphertext or key material in any response
 * - Standard error format
 * - Validation error details
 * - Status codes: 400 configuration/validation, 404 unknown job or key,
 *   409 state/lease/retirement conflicts, 422 decryption failures
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
            .map(error -> {
                String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
                Object rejectedValue = error instanceof FieldError
                    ? ((FieldError) error).getRejectedValue()
                    : null;

                return ErrorResponse.ValidationError.builder()
                    .field(fieldName)
                    .message(error.getDefaultMessage())
                    .rejectedValue(rejectedValue)
                    .build();
            })
            .collect(Collectors.toList());

        ErrorResponse errorResponse = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(HttpStatus.BAD_REQUEST.value())
            .error("Validation Failed")
            .message("Invalid request parameters")
            .path(request.getRequestURI())
            .validationErrors(validationErrors)
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Weak or malformed key material.
     */
    @ExceptionHandler(KeyConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleKeyConfiguration(
            KeyConfigurationException ex,
            HttpServletRequest request) {

        log.warn("Key configuration rejected: {} on {}", ex.getMessage(), request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, "Key Configuration Error", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        log.warn("Illegal argument: {} on {}", ex.getMessage(), request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(), request);
    }

    @ExceptionHandler(RotationJobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(
            RotationJobNotFoundException ex,
            HttpServletRequest request) {

        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(KeyNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleKeyNotFound(
            KeyNotFoundException ex,
            HttpServletRequest request) {

        return respond(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    /**
     * Illegal job transitions and rejected completions.
     */
    @ExceptionHandler(RotationStateException.class)
    public ResponseEntity<ErrorResponse> handleRotationState(
            RotationStateException ex,
            HttpServletRequest request) {

        log.warn("Rotation state conflict: {} on {}", ex.getMessage(), request.getRequestURI());
        return respond(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    @ExceptionHandler(LeaseConflictException.class)
    public ResponseEntity<ErrorResponse> handleLeaseConflict(
            LeaseConflictException ex,
            HttpServletRequest request) {

        return respond(HttpStatus.CONFLICT, "Lease Conflict", ex.getMessage(), request);
    }

    @ExceptionHandler(KeyRetirementException.class)
    public ResponseEntity<ErrorResponse> handleRetirement(
            KeyRetirementException ex,
            HttpServletRequest request) {

        log.warn("Key retirement refused: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Key In Use", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex,
            HttpServletRequest request) {

        log.warn("Illegal state: {} on {}", ex.getMessage(), request.getRequestURI());
        return respond(HttpStatus.CONFLICT, "Invalid State",
            "Operation cannot be performed in current state", request);
    }

    /**
     * Stored data could not be decrypted. The message names the key version at most.
     */
    @ExceptionHandler({DecryptionFailedException.class, IntegrityException.class})
    public ResponseEntity<ErrorResponse> handleDecryptionFailure(
            RuntimeException ex,
            HttpServletRequest request) {

        log.error("Decryption failure on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Decryption Failed",
            "Stored data could not be decrypted", request);
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

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred. Please contact support.", request);
    }

    private static ResponseEntity<ErrorResponse> respond(
            HttpStatus status, String error, String message, HttpServletRequest request) {

        ErrorResponse errorResponse = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }
}
