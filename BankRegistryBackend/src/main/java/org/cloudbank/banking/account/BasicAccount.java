package org.cloudbank.banking.account;

import java.math.BigDecimal;

/**
 * Plain account: deposits and withdrawals covered by the balance, nothing else.
 */
public class BasicAccount extends AbstractBankAccount {

    public BasicAccount(String accountId, String holderName, BigDecimal initialBalance) {
        super(accountId, holderName, initialBalance);
    }

    @Override
    public AccountType getAccountType() {
        return AccountType.BASIC;
    }
}
