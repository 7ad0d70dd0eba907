package org.cloudbank.banking.exception;

/**
 * Base class for every recoverable banking failure.
 * The error code is stable; the message is for humans only.
 */
public abstract class BankException extends RuntimeException {

    private final String errorCode;

    protected BankException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
