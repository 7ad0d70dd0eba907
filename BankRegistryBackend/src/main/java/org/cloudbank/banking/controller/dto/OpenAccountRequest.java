package org.cloudbank.banking.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(description = "Request to open a new account")
public class OpenAccountRequest {
    
    @Schema(description = "Account type", example = "SAVINGS", required = true,
            allowableValues = {"BASIC", "SAVINGS", "CURRENT", "FIXED_DEPOSIT"})
    private String accountType;
    
    @Schema(description = "Account number, unique within the bank", example = "S1001", required = true)
    private String accountId;
    
    @Schema(description = "Account holder name", example = "Alice", required = true)
    private String holderName;
    
    @Schema(description = "Opening balance", example = "1000.00")
    private BigDecimal initialBalance;
    
    @Schema(description = "Interest rate in percent (SAVINGS only)", example = "3.5")
    private BigDecimal interestRatePercent;
    
    @Schema(description = "Overdraft limit (CURRENT only)", example = "500.00")
    private BigDecimal overdraftLimit;
    
    @Schema(description = "Lock-in period in days (FIXED_DEPOSIT only)", example = "30")
    private Integer lockPeriodDays;
    
    // Getters and Setters
    public String getAccountType() {
        return accountType;
    }
    
    public void setAccountType(String accountType) {
        this.accountType = accountType;
    }
    
    public String getAccountId() {
        return accountId;
    }
    
    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }
    
    public String getHolderName() {
        return holderName;
    }
    
    public void setHolderName(String holderName) {
        this.holderName = holderName;
    }
    
    public BigDecimal getInitialBalance() {
        return initialBalance;
    }
    
    public void setInitialBalance(BigDecimal initialBalance) {
        this.initialBalance = initialBalance;
    }
    
    public BigDecimal getInterestRatePercent() {
        return interestRatePercent;
    }
    
    public void setInterestRatePercent(BigDecimal interestRatePercent) {
        this.interestRatePercent = interestRatePercent;
    }
    
    public BigDecimal getOverdraftLimit() {
        return overdraftLimit;
    }
    
    public void setOverdraftLimit(BigDecimal overdraftLimit) {
        this.overdraftLimit = overdraftLimit;
    }
    
    public Integer getLockPeriodDays() {
        return lockPeriodDays;
    }
    
    public void setLockPeriodDays(Integer lockPeriodDays) {
        this.lockPeriodDays = lockPeriodDays;
    }
}
