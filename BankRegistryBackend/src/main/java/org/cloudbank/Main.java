package org.cloudbank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Bank Registry Backend.
 *
 * Starts the REST API and, unless {@code bank.demo.enabled=false}, runs the sample account walkthrough.
 */
@SpringBootApplication
public class Main {
    public static void main(String[] args) {
        SpringApplication.run(Main.class, args);
    }
}
