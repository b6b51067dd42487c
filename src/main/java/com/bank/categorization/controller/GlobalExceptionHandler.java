package com.bank.categorization.controller;

import com.bank.categorization.exception.CorrectionConflictException;
import com.bank.categorization.exception.DecisionNotFoundException;
import com.bank.categorization.exception.DecisionPersistenceException;
import com.bank.categorization.exception.InvalidRequestException;
import com.bank.categorization.exception.UnknownTenantException;
import com.bank.categorization.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownTenantException.class)
    public ResponseEntity<ErrorResponse> handleUnknownTenant(UnknownTenantException ex) {
        log.warn("Unknown tenant: {}", ex.getTenantId());
        return build(HttpStatus.NOT_FOUND, "Unknown Tenant", ex.getMessage());
    }

    @ExceptionHandler(DecisionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleDecisionNotFound(DecisionNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "Decision Not Found", ex.getMessage());
    }

    @ExceptionHandler(CorrectionConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(CorrectionConflictException ex) {
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed request body");
    }

    @ExceptionHandler(DecisionPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(DecisionPersistenceException ex) {
        log.error("Record store write failed: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Record Store Unavailable", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(OffsetDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
