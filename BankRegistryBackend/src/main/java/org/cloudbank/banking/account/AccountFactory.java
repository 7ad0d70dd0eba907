package org.cloudbank.banking.account;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Builds account variants from their type, handing fixed deposits the application clock.
 */
@Component
public class AccountFactory {

    private final Clock clock;

    public AccountFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create an account of the given type.
     * Parameters that do not apply to the type are ignored; missing ones default to zero.
     */
    public BankAccount create(AccountType type, String accountId, String holderName,
                              BigDecimal initialBalance, BigDecimal interestRatePercent,
                              BigDecimal overdraftLimit, Integer lockPeriodDays) {
        if (type == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        requireText("Account number", accountId);
        requireText("Holder name", holderName);
        return switch (type) {
            case BASIC -> new BasicAccount(accountId, holderName, initialBalance);
            case SAVINGS -> new SavingsAccount(accountId, holderName, orZero(interestRatePercent), initialBalance);
            case CURRENT -> new CurrentAccount(accountId, holderName, orZero(overdraftLimit), initialBalance);
            case FIXED_DEPOSIT -> new FixedDepositAccount(accountId, holderName,
                lockPeriodDays != null ? lockPeriodDays : 0, initialBalance, clock);
        };
    }

    public SavingsAccount createSavings(String accountId, String holderName,
                                        BigDecimal interestRatePercent, BigDecimal initialBalance) {
        return new SavingsAccount(accountId, holderName, interestRatePercent, initialBalance);
    }

    public CurrentAccount createCurrent(String accountId, String holderName,
                                        BigDecimal overdraftLimit, BigDecimal initialBalance) {
        return new CurrentAccount(accountId, holderName, overdraftLimit, initialBalance);
    }

    public FixedDepositAccount createFixedDeposit(String accountId, String holderName,
                                                  int lockPeriodDays, BigDecimal initialBalance) {
        return new FixedDepositAccount(accountId, holderName, lockPeriodDays, initialBalance, clock);
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
