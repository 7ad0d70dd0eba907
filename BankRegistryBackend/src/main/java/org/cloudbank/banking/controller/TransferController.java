package org.cloudbank.banking.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.cloudbank.banking.bank.Bank;
import org.cloudbank.banking.controller.dto.TransferRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/transfers")
@Tag(name = "Transfers", description = "Move funds between accounts held by the bank")
public class TransferController {
    
    private final Bank bank;
    
    public TransferController(Bank bank) {
        this.bank = bank;
    }
    
    @Operation(summary = "Transfer Funds", description = "Withdraw from the source account, then deposit into the destination")
    @PostMapping
    public Map<String, Object> transfer(@RequestBody TransferRequest request) {
        bank.transferFunds(request.getFromAccountId(), request.getToAccountId(), request.getAmount());
        
        return Map.of(
            "success", true,
            "fromAccountId", request.getFromAccountId(),
            "fromBalance", bank.requireAccount(request.getFromAccountId()).getBalance(),
            "toAccountId", request.getToAccountId(),
            "toBalance", bank.requireAccount(request.getToAccountId()).getBalance(),
            "amount", request.getAmount()
        );
    }
}
