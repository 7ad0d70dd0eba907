package org.cloudbank.banking.bank;

import org.cloudbank.banking.account.AbstractBankAccount;
import org.cloudbank.banking.account.AccountType;
import org.cloudbank.banking.account.BankAccount;
import org.cloudbank.banking.account.CurrentAccount;
import org.cloudbank.banking.account.FixedDepositAccount;
import org.cloudbank.banking.account.SavingsAccount;
import org.cloudbank.banking.exception.AccountNotFoundException;
import org.cloudbank.banking.exception.DuplicateAccountException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bank
 * Registry of accounts keyed by account number, plus transfers between them
 */
@Service
public class Bank {

    private static final Logger log = LoggerFactory.getLogger(Bank.class);

    private final Map<String, BankAccount> accounts = new ConcurrentHashMap<>();

    /**
     * Register an account
     * @throws DuplicateAccountException if the account number is already taken; the existing entry is kept
     */
    public void addAccount(BankAccount account) {
        BankAccount existing = accounts.putIfAbsent(account.getAccountId(), account);
        if (existing != null) {
            throw new DuplicateAccountException(account.getAccountId());
        }
        log.info("Registered account {} for {} ({})", account.getAccountId(),
                 account.getHolderName(), account.getAccountType().getDisplayName());
    }

    /**
     * Get account by number, or null if none is registered
     */
    public BankAccount getAccount(String accountId) {
        return accountId == null ? null : accounts.get(accountId);
    }

    /**
     * Get account by number
     * @throws AccountNotFoundException if none is registered
     */
    public BankAccount requireAccount(String accountId) {
        BankAccount account = getAccount(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return account;
    }

    /**
     * Withdraw from one account and deposit into another.
     * Both accounts are resolved before either is touched. Any withdrawal failure propagates
     * unchanged and the destination is not credited. There is no compensation if the deposit
     * fails after a successful withdrawal; with the current deposit rules that cannot happen.
     */
    public synchronized void transferFunds(String fromAccountId, String toAccountId, BigDecimal amount) {
        BankAccount from = requireAccount(fromAccountId);
        BankAccount to = requireAccount(toAccountId);

        from.withdraw(amount);
        to.deposit(amount);
        log.info("Transferred {} from {} to {}", AbstractBankAccount.formatMoney(amount),
                 from.getHolderName(), to.getHolderName());
    }

    /**
     * Get all accounts, ordered by account number
     */
    public List<BankAccount> getAllAccounts() {
        return accounts.values().stream()
            .sorted(Comparator.comparing(BankAccount::getAccountId))
            .toList();
    }

    /**
     * Get all accounts of one type, ordered by account number
     */
    public List<BankAccount> getAccountsByType(AccountType type) {
        return getAllAccounts().stream()
            .filter(a -> a.getAccountType() == type)
            .toList();
    }

    /**
     * Sum of all balances, overdrawn accounts included
     */
    public BigDecimal getTotalHoldings() {
        return accounts.values().stream()
            .map(BankAccount::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int size() {
        return accounts.size();
    }

    /**
     * Get account summary
     * @throws AccountNotFoundException if none is registered
     */
    public Map<String, Object> getAccountSummary(String accountId) {
        BankAccount account = requireAccount(accountId);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("accountId", account.getAccountId());
        summary.put("holderName", account.getHolderName());
        summary.put("accountType", account.getAccountType().name());
        summary.put("accountTypeName", account.getAccountType().getDisplayName());
        summary.put("balance", account.getBalance());

        if (account instanceof SavingsAccount savings) {
            summary.put("interestRatePercent", savings.getInterestRatePercent());
        } else if (account instanceof CurrentAccount current) {
            summary.put("overdraftLimit", current.getOverdraftLimit());
        } else if (account instanceof FixedDepositAccount fixed) {
            summary.put("lockPeriodDays", fixed.getLockPeriodDays());
            summary.put("unlockDate", fixed.getUnlockDate().toString());
            summary.put("locked", fixed.isLocked());
        }
        return summary;
    }

    /**
     * Get summary of all accounts
     */
    public List<Map<String, Object>> getAllAccountsSummary() {
        return getAllAccounts().stream()
            .map(a -> getAccountSummary(a.getAccountId()))
            .toList();
    }
}
