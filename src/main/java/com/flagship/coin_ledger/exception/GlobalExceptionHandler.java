package com.flagship.coin_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
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
 * Maps the rejection taxonomy and infrastructure failures to HTTP responses.
 * The error field carries the machine-readable reason code.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ActionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejection(ActionRejectedException e) {
        RejectionReason reason = e.getReason();
        log.info("Action rejected: reason={}, message={}", reason, e.getMessage());

        ErrorResponse.ErrorResponseBuilder error = ErrorResponse.builder()
            .error(reason.name())
            .message(e.getMessage())
            .timestamp(Instant.now());

        if (e instanceof InsufficientBalanceException insufficient) {
            error.details(Map.of(
                "balance", String.valueOf(insufficient.getBalance()),
                "required", String.valueOf(insufficient.getRequired())));
        }

        return ResponseEntity.status(statusFor(reason)).body(error.build());
    }

    /**
     * Already reported on the integrity logger by whoever detected it.
     */
    @ExceptionHandler(LedgerIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrityFault(LedgerIntegrityException e) {
        log.error("Request aborted by ledger integrity fault: accountId={}, subjectId={}",
            e.getAccountId(), e.getSubjectId());

        ErrorResponse error = ErrorResponse.builder()
            .error("INTEGRITY_FAULT")
            .message("The ledger rejected this operation; an operator has been alerted")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler({PessimisticLockingFailureException.class, QueryTimeoutException.class,
        TransientDataAccessException.class})
    public ResponseEntity<ErrorResponse> handleTransient(RuntimeException e) {
        log.warn("Transient failure, client may retry: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("TRANSIENT_FAILURE")
            .message("The resource is busy, please retry")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Required Header")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message("Request body is missing or malformed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message("Invalid value for '" + e.getName() + "'")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(RejectionReason reason) {
        return switch (reason) {
            case INSUFFICIENT_BALANCE -> HttpStatus.PAYMENT_REQUIRED;
            case NOT_ELIGIBLE, NOT_ADMIN, NOT_OWNER -> HttpStatus.FORBIDDEN;
            case INVALID_TARGET, INVALID_DELTA -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_DECIDED, DOMAIN_EFFECT_FAILED -> HttpStatus.CONFLICT;
        };
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
