package org.cloudbank.banking.exception;

public class DuplicateAccountException extends BankException {

    public DuplicateAccountException(String accountId) {
        super("DUPLICATE_ACCOUNT", "Account with this number already exists: " + accountId);
    }
}
