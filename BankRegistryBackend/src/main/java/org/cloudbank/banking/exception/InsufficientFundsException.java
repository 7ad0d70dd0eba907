package org.cloudbank.banking.exception;

import java.math.BigDecimal;

public class InsufficientFundsException extends BankException {

    public InsufficientFundsException(String accountId, BigDecimal balance, BigDecimal requested) {
        super("INSUFFICIENT_FUNDS",
              "Insufficient funds in " + accountId + ": balance " + balance + ", requested " + requested);
    }
}
