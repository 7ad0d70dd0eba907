package org.cloudbank.banking.account;

import java.math.BigDecimal;

/**
 * Bank Account Interface
 * Capabilities shared by every account variant held by the bank
 */
public interface BankAccount {
    
    /**
     * Get account number
     */
    String getAccountId();
    
    /**
     * Get account holder name
     */
    String getHolderName();
    
    /**
     * Get account type
     */
    AccountType getAccountType();
    
    /**
     * Credit the account
     * @throws org.cloudbank.banking.exception.InvalidAmountException if amount is missing or not positive
     */
    void deposit(BigDecimal amount);
    
    /**
     * Debit the account according to the variant's withdrawal rule.
     * A rejected withdrawal leaves the balance untouched.
     */
    void withdraw(BigDecimal amount);
    
    /**
     * Get current balance
     */
    BigDecimal getBalance();
    
    /**
     * Multi-line summary for display only
     */
    String describe();
}
