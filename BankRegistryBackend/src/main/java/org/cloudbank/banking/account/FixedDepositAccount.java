package org.cloudbank.banking.account;

import org.cloudbank.banking.exception.LockPeriodActiveException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Fixed Deposit Account
 * No withdrawals until {@code createdAt + lockPeriodDays}; afterwards behaves like a basic account.
 * The lock start is taken from the supplied clock when the account is created.
 */
public class FixedDepositAccount extends AbstractBankAccount {

    private final int lockPeriodDays;
    private final Clock clock;
    private final Instant createdAt;

    public FixedDepositAccount(String accountId, String holderName, int lockPeriodDays,
                               BigDecimal initialBalance) {
        this(accountId, holderName, lockPeriodDays, initialBalance, Clock.systemDefaultZone());
    }

    public FixedDepositAccount(String accountId, String holderName, int lockPeriodDays,
                               BigDecimal initialBalance, Clock clock) {
        super(accountId, holderName, initialBalance);
        if (lockPeriodDays < 0) {
            throw new IllegalArgumentException("Lock period must be >= 0 days");
        }
        this.lockPeriodDays = lockPeriodDays;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
    }

    @Override
    public AccountType getAccountType() {
        return AccountType.FIXED_DEPOSIT;
    }

    public int getLockPeriodDays() {
        return lockPeriodDays;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUnlockInstant() {
        return createdAt.plus(Duration.ofDays(lockPeriodDays));
    }

    public LocalDate getUnlockDate() {
        return LocalDate.ofInstant(getUnlockInstant(), clock.getZone());
    }

    public boolean isLocked() {
        return clock.instant().isBefore(getUnlockInstant());
    }

    @Override
    public synchronized void withdraw(BigDecimal amount) {
        if (isLocked()) {
            throw new LockPeriodActiveException(getAccountId(), getUnlockDate());
        }
        super.withdraw(amount);
    }

    @Override
    protected String describeDetails() {
        return "Account Type: " + getAccountType().getDisplayName() + "\n"
            + "Unlock Date: " + getUnlockDate();
    }
}
