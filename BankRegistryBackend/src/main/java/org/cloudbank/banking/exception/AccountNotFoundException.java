package org.cloudbank.banking.exception;

public class AccountNotFoundException extends BankException {

    public AccountNotFoundException(String accountId) {
        super("ACCOUNT_NOT_FOUND", "Account not found: " + accountId);
    }
}
