package org.cloudbank.banking.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.cloudbank.banking.account.AccountFactory;
import org.cloudbank.banking.account.AccountType;
import org.cloudbank.banking.account.BankAccount;
import org.cloudbank.banking.account.SavingsAccount;
import org.cloudbank.banking.bank.Bank;
import org.cloudbank.banking.controller.dto.AmountRequest;
import org.cloudbank.banking.controller.dto.OpenAccountRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Account Management Controller
 * Open accounts and move money in and out of them
 */
@RestController
@RequestMapping("/api/accounts")
@Tag(name = "Accounts", description = "Open accounts, deposit, withdraw and apply interest")
public class AccountController {
    
    private final Bank bank;
    private final AccountFactory accountFactory;
    
    public AccountController(Bank bank, AccountFactory accountFactory) {
        this.bank = bank;
        this.accountFactory = accountFactory;
    }
    
    // ==================== Account Management ====================
    
    @Operation(summary = "Get All Accounts", description = "Get summaries of all accounts, optionally filtered by type")
    @GetMapping
    public List<Map<String, Object>> getAllAccounts(@RequestParam(required = false) String type) {
        if (type == null) {
            return bank.getAllAccountsSummary();
        }
        AccountType accountType = parseType(type);
        return bank.getAccountsByType(accountType).stream()
            .map(a -> bank.getAccountSummary(a.getAccountId()))
            .toList();
    }
    
    @Operation(summary = "Get Account Details", description = "Get detailed information about a specific account")
    @GetMapping("/{accountId}")
    public Map<String, Object> getAccountDetails(@PathVariable String accountId) {
        Map<String, Object> details = bank.getAccountSummary(accountId);
        details.put("description", bank.requireAccount(accountId).describe());
        return details;
    }
    
    @Operation(summary = "Open Account", description = "Open a new account of the given type and register it with the bank")
    @PostMapping
    public ResponseEntity<Map<String, Object>> openAccount(@RequestBody OpenAccountRequest request) {
        BankAccount account = accountFactory.create(
            parseType(request.getAccountType()),
            request.getAccountId(),
            request.getHolderName(),
            request.getInitialBalance(),
            request.getInterestRatePercent(),
            request.getOverdraftLimit(),
            request.getLockPeriodDays()
        );
        bank.addAccount(account);
        return ResponseEntity.status(HttpStatus.CREATED).body(bank.getAccountSummary(account.getAccountId()));
    }
    
    // ==================== Balance Operations ====================
    
    @Operation(summary = "Get Account Balance", description = "Get current balance for an account")
    @GetMapping("/{accountId}/balance")
    public Map<String, Object> getBalance(@PathVariable String accountId) {
        BankAccount account = bank.requireAccount(accountId);
        return Map.of(
            "accountId", account.getAccountId(),
            "balance", account.getBalance()
        );
    }
    
    @Operation(summary = "Deposit", description = "Credit a positive amount to an account")
    @PostMapping("/{accountId}/deposit")
    public Map<String, Object> deposit(@PathVariable String accountId, @RequestBody AmountRequest request) {
        BankAccount account = bank.requireAccount(accountId);
        account.deposit(request.getAmount());
        return result(account, "Deposited " + request.getAmount());
    }
    
    @Operation(summary = "Withdraw", description = "Debit an account according to its withdrawal rule")
    @PostMapping("/{accountId}/withdraw")
    public Map<String, Object> withdraw(@PathVariable String accountId, @RequestBody AmountRequest request) {
        BankAccount account = bank.requireAccount(accountId);
        account.withdraw(request.getAmount());
        return result(account, "Withdrew " + request.getAmount());
    }
    
    @Operation(summary = "Apply Interest", description = "Credit interest to a savings account")
    @PostMapping("/{accountId}/interest")
    public Map<String, Object> applyInterest(@PathVariable String accountId) {
        BankAccount account = bank.requireAccount(accountId);
        if (!(account instanceof SavingsAccount savings)) {
            throw new UnsupportedOperationException(
                "Interest applies to savings accounts only (" + accountId + " is "
                    + account.getAccountType().getDisplayName() + ")");
        }
        BigDecimal interest = savings.applyInterest();
        Map<String, Object> response = result(account, "Interest applied: " + interest);
        response.put("interest", interest);
        return response;
    }
    
    private static Map<String, Object> result(BankAccount account, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("accountId", account.getAccountId());
        response.put("balance", account.getBalance());
        response.put("message", message);
        return response;
    }
    
    private static AccountType parseType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Account type is required");
        }
        try {
            return AccountType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown account type: " + type, e);
        }
    }
}
