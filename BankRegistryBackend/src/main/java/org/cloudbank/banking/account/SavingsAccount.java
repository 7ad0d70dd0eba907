package org.cloudbank.banking.account;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Savings Account
 * Withdraws like a basic account and can be credited interest on demand
 */
public class SavingsAccount extends AbstractBankAccount {

    private final BigDecimal interestRatePercent;

    /**
     * @param interestRatePercent rate in percent, e.g. 3.5; not range-checked, a negative rate acts as a fee
     */
    public SavingsAccount(String accountId, String holderName, BigDecimal interestRatePercent,
                          BigDecimal initialBalance) {
        super(accountId, holderName, initialBalance);
        this.interestRatePercent = Objects.requireNonNull(interestRatePercent, "interestRatePercent");
    }

    @Override
    public AccountType getAccountType() {
        return AccountType.SAVINGS;
    }

    public BigDecimal getInterestRatePercent() {
        return interestRatePercent;
    }

    /**
     * Credit {@code balance * rate / 100}, computed on the pre-interest balance.
     * @return the interest credited
     */
    public synchronized BigDecimal applyInterest() {
        BigDecimal interest = getBalance().multiply(interestRatePercent).movePointLeft(2);
        credit(interest);
        log.info("[{}] Interest applied: {}", getHolderName(), formatMoney(interest));
        return interest;
    }

    @Override
    protected String describeDetails() {
        return "Account Type: " + getAccountType().getDisplayName() + "\n"
            + "Interest Rate: " + interestRatePercent.toPlainString() + "%";
    }
}
