package org.cloudbank.banking.exception;

import java.time.LocalDate;

/**
 * Thrown when a fixed deposit is withdrawn from before its lock-in period ends.
 */
public class LockPeriodActiveException extends BankException {

    public LockPeriodActiveException(String accountId, LocalDate unlockDate) {
        super("LOCK_PERIOD_ACTIVE",
              "Withdrawal not allowed before lock-in period ends (" + accountId + " unlocks on " + unlockDate + ")");
    }
}
