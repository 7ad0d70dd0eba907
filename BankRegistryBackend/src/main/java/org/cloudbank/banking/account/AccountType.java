package org.cloudbank.banking.account;

/**
 * Types of bank accounts
 */
public enum AccountType {
    BASIC("Basic", "Plain account, withdrawals limited to the balance"),
    SAVINGS("Savings", "Interest-bearing account"),
    CURRENT("Current", "Account with an overdraft facility"),
    FIXED_DEPOSIT("Fixed Deposit", "Funds locked for a fixed number of days");
    
    private final String displayName;
    private final String description;
    
    AccountType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public String getDescription() {
        return description;
    }
}
