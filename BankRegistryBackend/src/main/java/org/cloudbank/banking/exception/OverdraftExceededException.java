package org.cloudbank.banking.exception;

import java.math.BigDecimal;

public class OverdraftExceededException extends BankException {

    public OverdraftExceededException(String accountId, BigDecimal overdraftLimit, BigDecimal requested) {
        super("OVERDRAFT_EXCEEDED",
              "Exceeds overdraft limit of " + overdraftLimit + " on " + accountId + " (requested " + requested + ")");
    }
}
