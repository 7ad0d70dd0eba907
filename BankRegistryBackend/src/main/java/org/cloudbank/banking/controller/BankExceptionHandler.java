package org.cloudbank.banking.controller;

import org.cloudbank.banking.exception.AccountNotFoundException;
import org.cloudbank.banking.exception.BankException;
import org.cloudbank.banking.exception.DuplicateAccountException;
import org.cloudbank.banking.exception.InvalidAmountException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Translates banking failures into HTTP responses with a {@code {error, message}} body.
 */
@RestControllerAdvice
public class BankExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(BankExceptionHandler.class);

    @ExceptionHandler(BankException.class)
    public ResponseEntity<Map<String, Object>> handleBankException(BankException ex) {
        HttpStatus status = statusFor(ex);
        log.warn("Rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(body(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, UnsupportedOperationException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("BAD_REQUEST", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("BAD_REQUEST", "Malformed request body"));
    }

    static HttpStatus statusFor(BankException ex) {
        if (ex instanceof AccountNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof DuplicateAccountException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof InvalidAmountException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private static Map<String, Object> body(String errorCode, String message) {
        return Map.of("error", errorCode, "message", message);
    }
}
