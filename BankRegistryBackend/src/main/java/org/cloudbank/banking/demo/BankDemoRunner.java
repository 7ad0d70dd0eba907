package org.cloudbank.banking.demo;

import org.cloudbank.banking.account.AccountFactory;
import org.cloudbank.banking.account.CurrentAccount;
import org.cloudbank.banking.account.FixedDepositAccount;
import org.cloudbank.banking.account.SavingsAccount;
import org.cloudbank.banking.bank.Bank;
import org.cloudbank.banking.exception.BankException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.BigDecimal;

/**
 * Walks three sample accounts through deposits, interest, overdraft use,
 * a refused fixed-deposit withdrawal and a transfer, printing each account before and after.
 * Disable with {@code bank.demo.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "bank.demo.enabled", havingValue = "true", matchIfMissing = true)
public class BankDemoRunner implements CommandLineRunner {

    private final Bank bank;
    private final AccountFactory accountFactory;
    private final PrintStream out;

    @Autowired
    public BankDemoRunner(Bank bank, AccountFactory accountFactory) {
        this(bank, accountFactory, System.out);
    }

    BankDemoRunner(Bank bank, AccountFactory accountFactory, PrintStream out) {
        this.bank = bank;
        this.accountFactory = accountFactory;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        SavingsAccount savings = accountFactory.createSavings("S1001", "Alice", new BigDecimal("3.5"), new BigDecimal("1000"));
        CurrentAccount current = accountFactory.createCurrent("C1001", "Bob", new BigDecimal("500"), new BigDecimal("200"));
        FixedDepositAccount fixed = accountFactory.createFixedDeposit("F1001", "Charlie", 30, new BigDecimal("5000"));

        bank.addAccount(savings);
        bank.addAccount(current);
        bank.addAccount(fixed);

        out.println("\n--- Initial Account Info ---");
        printAccounts(savings, current, fixed);

        out.println("\n--- Savings Account Operations ---");
        savings.deposit(new BigDecimal("500"));
        savings.applyInterest();
        savings.withdraw(new BigDecimal("200"));

        out.println("\n--- Current Account Operations ---");
        current.withdraw(new BigDecimal("600"));
        current.deposit(new BigDecimal("300"));

        out.println("\n--- Attempt Early Withdrawal from Fixed Deposit ---");
        try {
            fixed.withdraw(new BigDecimal("1000"));
        } catch (BankException e) {
            out.println("Error: " + e.getMessage());
        }

        out.println("\n--- Transfer Funds from Savings to Current ---");
        bank.transferFunds("S1001", "C1001", new BigDecimal("300"));

        out.println("\n--- Final Balances ---");
        printAccounts(savings, current, fixed);
    }

    private void printAccounts(SavingsAccount savings, CurrentAccount current, FixedDepositAccount fixed) {
        out.println(savings.describe());
        out.println(current.describe());
        out.println(fixed.describe());
    }
}
