package com.creditengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Credit Engine.
 *
 * Credit Engine issues annuity credits against customer accounts, keeps the account ledger,
 * and periodically collects past-due payments with penalties.
 */
@SpringBootApplication
public class CreditEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditEngineApplication.class, args);
    }
}
