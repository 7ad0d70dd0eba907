package org.cloudbank.banking.account;

import org.cloudbank.banking.exception.InsufficientFundsException;
import org.cloudbank.banking.exception.InvalidAmountException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Base implementation holding the balance and the default deposit/withdraw rules.
 * Variants override {@link #withdraw(BigDecimal)} and {@link #describeDetails()}.
 */
public abstract class AbstractBankAccount implements BankAccount {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String accountId;
    private final String holderName;
    private BigDecimal balance;

    protected AbstractBankAccount(String accountId, String holderName, BigDecimal initialBalance) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.holderName = Objects.requireNonNull(holderName, "holderName");
        this.balance = initialBalance != null ? initialBalance : BigDecimal.ZERO;
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    @Override
    public String getHolderName() {
        return holderName;
    }

    @Override
    public synchronized BigDecimal getBalance() {
        return balance;
    }

    @Override
    public synchronized void deposit(BigDecimal amount) {
        requirePositive("Deposit", amount);
        balance = balance.add(amount);
        log.info("[{}] Deposited {}", holderName, formatMoney(amount));
    }

    @Override
    public synchronized void withdraw(BigDecimal amount) {
        requirePositive("Withdrawal", amount);
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientFundsException(accountId, balance, amount);
        }
        debit(amount);
        log.info("[{}] Withdrew {}", holderName, formatMoney(amount));
    }

    @Override
    public synchronized String describe() {
        StringBuilder sb = new StringBuilder()
            .append("Account Number: ").append(accountId).append('\n')
            .append("Account Holder: ").append(holderName).append('\n')
            .append("Balance: ").append(formatMoney(balance));
        String details = describeDetails();
        if (!details.isEmpty()) {
            sb.append('\n').append(details);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "%s{id='%s', holder='%s', balance=%s}"
            .formatted(getAccountType().getDisplayName(), accountId, holderName, getBalance());
    }

    /**
     * Variant-specific lines appended to {@link #describe()}; empty for none.
     */
    protected String describeDetails() {
        return "";
    }

    /**
     * Subtracts an already validated amount. Callers hold the account monitor.
     */
    protected final void debit(BigDecimal amount) {
        balance = balance.subtract(amount);
    }

    /**
     * Adds an already computed amount. Callers hold the account monitor.
     */
    protected final void credit(BigDecimal amount) {
        balance = balance.add(amount);
    }

    protected static void requirePositive(String operation, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException(operation, amount);
        }
    }

    /**
     * Two-decimal dollar text, independent of the host locale.
     */
    public static String formatMoney(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%.2f", amount);
    }
}
