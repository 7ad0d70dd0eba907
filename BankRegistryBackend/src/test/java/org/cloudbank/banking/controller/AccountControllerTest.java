package org.cloudbank.banking.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * REST surface for opening accounts and moving money in and out of them
 */
@SpringBootTest(properties = "bank.demo.enabled=false")
@AutoConfigureMockMvc
class AccountControllerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @Test
    @DisplayName("Open a savings account, deposit, apply interest and withdraw")
    void testSavingsLifecycle() throws Exception {
        open("{\"accountType\":\"savings\",\"accountId\":\"API-S1\",\"holderName\":\"Alice\","
            + "\"initialBalance\":1000.0,\"interestRatePercent\":3.5}")
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.accountId").value("API-S1"))
            .andExpect(jsonPath("$.accountType").value("SAVINGS"))
            .andExpect(jsonPath("$.interestRatePercent").value(3.5));
        
        mockMvc.perform(post("/api/accounts/API-S1/deposit")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":500}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.balance").value(1500.0));
        
        mockMvc.perform(post("/api/accounts/API-S1/interest"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.interest").value(52.5))
            .andExpect(jsonPath("$.balance").value(1552.5));
        
        mockMvc.perform(post("/api/accounts/API-S1/withdraw")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":200}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(1352.5));
        
        mockMvc.perform(get("/api/accounts/API-S1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.holderName").value("Alice"))
            .andExpect(jsonPath("$.description").value(containsString("Interest Rate: 3.5%")));
    }
    
    @Test
    @DisplayName("Opening an account twice answers 409")
    void testDuplicateAccount() throws Exception {
        String body = "{\"accountType\":\"BASIC\",\"accountId\":\"API-B1\",\"holderName\":\"Ben\",\"initialBalance\":10}";
        open(body).andExpect(status().isCreated());
        
        open(body)
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("DUPLICATE_ACCOUNT"));
    }
    
    @Test
    @DisplayName("Unknown account answers 404")
    void testAccountNotFound() throws Exception {
        mockMvc.perform(get("/api/accounts/NO-SUCH-ACCOUNT"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("ACCOUNT_NOT_FOUND"));
        
        mockMvc.perform(get("/api/accounts/NO-SUCH-ACCOUNT/balance"))
            .andExpect(status().isNotFound());
    }
    
    @Test
    @DisplayName("Rule violations answer 422 and invalid amounts 400")
    void testRejectedOperations() throws Exception {
        open("{\"accountType\":\"CURRENT\",\"accountId\":\"API-C1\",\"holderName\":\"Bob\","
            + "\"initialBalance\":200.0,\"overdraftLimit\":500}")
            .andExpect(status().isCreated());
        
        mockMvc.perform(post("/api/accounts/API-C1/withdraw")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":600}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(-400.0));
        
        mockMvc.perform(post("/api/accounts/API-C1/withdraw")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":100.01}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("OVERDRAFT_EXCEEDED"));
        
        mockMvc.perform(post("/api/accounts/API-C1/deposit")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_AMOUNT"));
        
        mockMvc.perform(post("/api/accounts/API-C1/interest"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
        
        mockMvc.perform(get("/api/accounts/API-C1/balance"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(-400.0));
    }
    
    @Test
    @DisplayName("Fresh fixed deposit refuses withdrawals")
    void testFixedDepositLocked() throws Exception {
        open("{\"accountType\":\"FIXED_DEPOSIT\",\"accountId\":\"API-F1\",\"holderName\":\"Cara\","
            + "\"initialBalance\":5000,\"lockPeriodDays\":30}")
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.locked").value(true));
        
        mockMvc.perform(post("/api/accounts/API-F1/withdraw")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\":1000}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("LOCK_PERIOD_ACTIVE"));
    }
    
    @Test
    void testUnknownAccountType() throws Exception {
        open("{\"accountType\":\"PLATINUM\",\"accountId\":\"API-X1\",\"holderName\":\"Dev\"}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
    
    @Test
    void testMissingHolderName() throws Exception {
        open("{\"accountType\":\"BASIC\",\"accountId\":\"API-X2\"}")
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
            .andExpect(jsonPath("$.message").value("Holder name is required"));
        
        mockMvc.perform(get("/api/accounts/API-X2"))
            .andExpect(status().isNotFound());
    }
    
    @Test
    void testListFilteredByType() throws Exception {
        open("{\"accountType\":\"BASIC\",\"accountId\":\"API-B2\",\"holderName\":\"Flo\",\"initialBalance\":1}")
            .andExpect(status().isCreated());
        
        mockMvc.perform(get("/api/accounts").param("type", "basic"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].accountType").value(everyItem(is("BASIC"))));
    }
    
    private ResultActions open(String json) throws Exception {
        return mockMvc.perform(post("/api/accounts")
            .contentType(MediaType.APPLICATION_JSON)
            .content(json));
    }
}
