package com.koni.thermoguard.infrastructure.web.exception;

import com.koni.thermoguard.domain.exception.ConflictException;
import com.koni.thermoguard.domain.exception.ForbiddenException;
import com.koni.thermoguard.domain.exception.NotFoundException;
import com.koni.thermoguard.domain.exception.ValidationException;
import com.koni.thermoguard.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Provides consistent error responses and appropriate HTTP status codes.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Returns 400 Bad Request when input validation fails.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
    }

    /**
     * Returns 400 Bad Request when bean validation of a request body fails.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Request validation error: {}", message);
        return error(HttpStatus.BAD_REQUEST, "validation_error", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request");
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFoundException(NotFoundException ex) {
        log.info("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    /**
     * Returns 409 Conflict with the exception's own code, e.g. {@code already_acknowledged}.
     */
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflictException(ConflictException ex) {
        log.info("Conflict: code={}, message={}", ex.getCode(), ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleForbiddenException(ForbiddenException ex) {
        log.warn("Forbidden: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "forbidden", ex.getMessage());
    }

    /**
     * Returns 502 Bad Gateway when an IR command was not delivered to the unit.
     */
    @ExceptionHandler(CommandFailedException.class)
    public ResponseEntity<ErrorResponse> handleCommandFailedException(CommandFailedException ex) {
        log.warn("Command failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "command_failed", ex.getMessage());
    }

    /**
     * Returns 500 Internal Server Error for unhandled exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), code, message));
    }
}
