package org.cloudbank.banking.controller.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(description = "Amount to deposit or withdraw")
public class AmountRequest {
    
    @Schema(description = "Amount, must be positive", example = "250.00", required = true)
    private BigDecimal amount;
    
    public BigDecimal getAmount() {
        return amount;
    }
    
    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }
}
