package org.cloudbank.banking.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(description = "Request to move funds between two accounts")
public class TransferRequest {
    
    @Schema(description = "Source account number", example = "S1001", required = true)
    private String fromAccountId;
    
    @Schema(description = "Destination account number", example = "C1001", required = true)
    private String toAccountId;
    
    @Schema(description = "Amount to transfer, must be positive", example = "300.00", required = true)
    private BigDecimal amount;
    
    public String getFromAccountId() {
        return fromAccountId;
    }
    
    public void setFromAccountId(String fromAccountId) {
        this.fromAccountId = fromAccountId;
    }
    
    public String getToAccountId() {
        return toAccountId;
    }
    
    public void setToAccountId(String toAccountId) {
        this.toAccountId = toAccountId;
    }
    
    public BigDecimal getAmount() {
        return amount;
    }
    
    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }
}
