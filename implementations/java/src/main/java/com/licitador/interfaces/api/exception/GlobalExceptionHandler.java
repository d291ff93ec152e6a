package com.licitador.interfaces.api.exception;

import com.licitador.application.exceptions.DecryptionException;
import com.licitador.application.exceptions.KeyAlreadyUsedException;
import com.licitador.application.exceptions.KeyNotFoundException;
import com.licitador.infrastructure.crypto.AuthenticationFailedException;
import com.licitador.infrastructure.crypto.CipherDecryptException;
import com.licitador.infrastructure.crypto.CipherEncryptException;
import com.licitador.infrastructure.crypto.EncryptionException;
import com.licitador.interfaces.api.dto.ErrorResponse;
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

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Global exception handler for REST API.
 *
 * Maps the encryption error family to HTTP statuses:
 * - Unknown or expired key pair: 404
 * - Key pair already consumed: 409
 * - Field decryption or tag verification failure: 422
 * - Bad input to the symmetric cipher: 400
 * - Key generation, key configuration and anything else: 500
 *
 * Messages of 5xx responses are generic; the cause is logged, never returned.
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

        // Rejected values are left out: they may be plaintexts
        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> ErrorResponse.ValidationError.builder()
                .field(error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName())
                .message(error.getDefaultMessage())
                .build())
            .toList();

        ErrorResponse errorResponse = baseError(HttpStatus.BAD_REQUEST, "Validation Failed", request)
            .message("Invalid request parameters")
            .validationErrors(validationErrors)
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseError(HttpStatus.BAD_REQUEST, "Bad Request", request)
            .message("Malformed request")
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Unreadable request on {}: {}", request.getRequestURI(), ex.getClass().getSimpleName());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(KeyNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleKeyNotFound(
            KeyNotFoundException ex,
            HttpServletRequest request) {

        if (ex.getCause() != null && log.isErrorEnabled()) {
            log.error("Key pair lookup failed on {}", request.getRequestURI(), ex);
        }

        return encryptionError(HttpStatus.NOT_FOUND, "Not Found", ex, request);
    }

    @ExceptionHandler(KeyAlreadyUsedException.class)
    public ResponseEntity<ErrorResponse> handleKeyAlreadyUsed(
            KeyAlreadyUsedException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Reuse of consumed key pair rejected on {}", request.getRequestURI());
        }

        return encryptionError(HttpStatus.CONFLICT, "Conflict", ex, request);
    }

    @ExceptionHandler({DecryptionException.class, AuthenticationFailedException.class})
    public ResponseEntity<ErrorResponse> handleUndecryptable(
            EncryptionException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Decryption rejected on {}: {}", request.getRequestURI(), ex.getMessage());
        }

        return encryptionError(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Entity", ex, request);
    }

    @ExceptionHandler({CipherEncryptException.class, CipherDecryptException.class})
    public ResponseEntity<ErrorResponse> handleCipherInput(
            EncryptionException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Cipher input rejected on {}: {}", request.getRequestURI(), ex.getMessage());
        }

        return encryptionError(HttpStatus.BAD_REQUEST, "Bad Request", ex, request);
    }

    /**
     * Key generation failures, key configuration errors and any other member
     * of the encryption family.
     */
    @ExceptionHandler(EncryptionException.class)
    public ResponseEntity<ErrorResponse> handleEncryptionFailure(
            EncryptionException ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Encryption failure on {}", request.getRequestURI(), ex);
        }

        ErrorResponse errorResponse = baseError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", request)
            .type(typeOf(ex))
            .message("An encryption error occurred. Please contact support.")
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseError(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", request)
            .message("An unexpected error occurred. Please contact support.")
            .build();

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private static ResponseEntity<ErrorResponse> encryptionError(
            HttpStatus status,
            String error,
            EncryptionException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseError(status, error, request)
            .type(typeOf(ex))
            .message(ex.getMessage())
            .build();

        return ResponseEntity.status(status).body(errorResponse);
    }

    private static ErrorResponse.ErrorResponseBuilder baseError(
            HttpStatus status,
            String error,
            HttpServletRequest request) {

        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(Instant.now())
            .status(status.value())
            .error(error)
            .path(request.getRequestURI());
    }

    private static String typeOf(EncryptionException ex) {
        String name = ex.getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }
}
