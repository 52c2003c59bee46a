package com.olympiadregistration.interfaces.api.exception;

import com.olympiadregistration.domain.exception.BulkImportException;
import com.olympiadregistration.domain.exception.ErrorKind;
import com.olympiadregistration.domain.exception.RegistrationException;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import jakarta.persistence.OptimisticLockException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Registration failures carry a user-facing message that is returned
 * verbatim, with the HTTP status chosen by {@link ErrorKind}. Anything
 * unexpected gets a generic message.
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
     * Handle registration rule violations, including bulk import rows.
     */
    @ExceptionHandler(RegistrationException.class)
    public ResponseEntity<ErrorResponse> handleRegistration(
            RegistrationException ex,
            HttpServletRequest request) {

        HttpStatus status = statusFor(ex.getKind());
        ErrorResponse errorResponse = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .kind(ex.getKind().name())
            .message(ex.getMessage())
            .path(request.getRequestURI())
            .row(ex instanceof BulkImportException bulk ? bulk.getRow() : null)
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Registration rejected: kind={} on {}", ex.getKind(), request.getRequestURI());
        }

        return ResponseEntity.status(status).body(errorResponse);
    }

    /**
     * Handle optimistic locking failures.
     */
    @ExceptionHandler({OptimisticLockException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            RuntimeException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(HttpStatus.CONFLICT.value())
            .error("Concurrent Modification")
            .kind(ErrorKind.RACE_CONDITION.name())
            .message("The record was modified by another user. Please retry.")
            .path(request.getRequestURI())
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Optimistic lock exception on {}", request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(HttpStatus.PAYLOAD_TOO_LARGE.value())
            .error("Payload Too Large")
            .kind(ErrorKind.FORMAT_INVALID.name())
            .message("Uploaded file too large")
            .path(request.getRequestURI())
            .build();

        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(errorResponse);
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .error("Internal Server Error")
            .message("An unexpected error occurred. Please contact the event organisers.")
            .path(request.getRequestURI())
            .build();

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case REQUIRED_FIELD_MISSING, FORMAT_INVALID, REFERENCE_INVALID -> HttpStatus.BAD_REQUEST;
            case UNIQUENESS_VIOLATION, STATE_CONFLICT, RACE_CONDITION -> HttpStatus.CONFLICT;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }
}
