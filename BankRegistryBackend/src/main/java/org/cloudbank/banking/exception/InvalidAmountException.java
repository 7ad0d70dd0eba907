package org.cloudbank.banking.exception;

import java.math.BigDecimal;

/**
 * Thrown when a deposit or withdrawal amount is missing or not positive.
 */
public class InvalidAmountException extends BankException {

    public InvalidAmountException(String operation, BigDecimal amount) {
        super("INVALID_AMOUNT", operation + " amount must be positive (was " + amount + ")");
    }
}
