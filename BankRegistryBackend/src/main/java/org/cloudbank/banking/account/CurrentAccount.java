package org.cloudbank.banking.account;

import org.cloudbank.banking.exception.OverdraftExceededException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Current Account
 * Balance may go negative down to {@code -overdraftLimit}
 */
public class CurrentAccount extends AbstractBankAccount {

    private final BigDecimal overdraftLimit;

    public CurrentAccount(String accountId, String holderName, BigDecimal overdraftLimit,
                          BigDecimal initialBalance) {
        super(accountId, holderName, initialBalance);
        Objects.requireNonNull(overdraftLimit, "overdraftLimit");
        if (overdraftLimit.signum() < 0) {
            throw new IllegalArgumentException("Overdraft limit must be >= 0");
        }
        this.overdraftLimit = overdraftLimit;
    }

    @Override
    public AccountType getAccountType() {
        return AccountType.CURRENT;
    }

    public BigDecimal getOverdraftLimit() {
        return overdraftLimit;
    }

    @Override
    public synchronized void withdraw(BigDecimal amount) {
        requirePositive("Withdrawal", amount);
        if (amount.compareTo(getBalance().add(overdraftLimit)) > 0) {
            throw new OverdraftExceededException(getAccountId(), overdraftLimit, amount);
        }
        debit(amount);
        log.info("[{}] Withdrew {} (Overdraft Allowed)", getHolderName(), formatMoney(amount));
    }

    @Override
    protected String describeDetails() {
        return "Account Type: " + getAccountType().getDisplayName() + "\n"
            + "Overdraft Limit: " + formatMoney(overdraftLimit);
    }
}
