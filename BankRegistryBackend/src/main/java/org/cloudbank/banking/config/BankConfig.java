package org.cloudbank.banking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core banking configuration
 */
@Configuration("bankConfig")
public class BankConfig {

    /**
     * Time source for fixed-deposit lock periods. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
