package com.moneylens.api.controller;

import com.moneylens.api.dto.ErrorBody;
import com.moneylens.categorization.CategorizationException;
import com.moneylens.reconciliation.ReconciliationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures to 400 and domain exceptions to 404/409, all with ErrorBody.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + " is required")
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(CategorizationException.class)
    public ResponseEntity<ErrorBody> handleCategorization(CategorizationException ex) {
        HttpStatus status = CategorizationException.TRANSACTION_NOT_FOUND.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorBody> handleReconciliation(ReconciliationException ex) {
        HttpStatus status = ReconciliationException.NOT_FOUND.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }
}
