package org.cloudbank.banking.account;

import org.cloudbank.banking.exception.InvalidAmountException;
import org.cloudbank.banking.exception.OverdraftExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.cloudbank.banking.account.BasicAccountTest.assertMoney;
import static org.junit.jupiter.api.Assertions.*;

class CurrentAccountTest {
    
    private CurrentAccount current;
    
    @BeforeEach
    void setUp() {
        current = new CurrentAccount("C1001", "Bob", new BigDecimal("500"), new BigDecimal("200.0"));
    }
    
    @Test
    @DisplayName("Withdraw into the overdraft drives the balance negative")
    void testOverdraftWithdrawal() {
        current.withdraw(new BigDecimal("600"));
        assertMoney("-400.0", current.getBalance());
        
        current.deposit(new BigDecimal("300"));
        assertMoney("-100.0", current.getBalance());
    }
    
    @Test
    @DisplayName("Balance may reach exactly minus the overdraft limit")
    void testWithdrawToLimit() {
        current.withdraw(new BigDecimal("700"));
        
        assertMoney("-500", current.getBalance());
        assertThrows(OverdraftExceededException.class, () -> current.withdraw(new BigDecimal("0.01")));
    }
    
    @Test
    @DisplayName("Withdraw beyond balance plus overdraft fails and leaves the balance alone")
    void testOverdraftExceeded() {
        OverdraftExceededException ex = assertThrows(OverdraftExceededException.class,
            () -> current.withdraw(new BigDecimal("700.01")));
        
        assertEquals("OVERDRAFT_EXCEEDED", ex.getErrorCode());
        assertMoney("200.0", current.getBalance());
    }
    
    @Test
    void testInvalidAmount() {
        assertThrows(InvalidAmountException.class, () -> current.withdraw(BigDecimal.ZERO));
        assertThrows(InvalidAmountException.class, () -> current.deposit(new BigDecimal("-3")));
        assertMoney("200.0", current.getBalance());
    }
    
    @Test
    @DisplayName("Zero overdraft behaves like a basic account")
    void testZeroOverdraft() {
        CurrentAccount strict = new CurrentAccount("C2", "Kim", BigDecimal.ZERO, new BigDecimal("50"));
        
        strict.withdraw(new BigDecimal("50"));
        assertMoney("0", strict.getBalance());
        assertThrows(OverdraftExceededException.class, () -> strict.withdraw(BigDecimal.ONE));
    }
    
    @Test
    void testNegativeOverdraftRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new CurrentAccount("C3", "Lee", new BigDecimal("-1"), BigDecimal.TEN));
    }
    
    @Test
    void testDescribe() {
        String description = current.describe();
        
        assertTrue(description.contains("Account Type: Current"));
        assertTrue(description.endsWith("Overdraft Limit: $500.00"));
    }
}
