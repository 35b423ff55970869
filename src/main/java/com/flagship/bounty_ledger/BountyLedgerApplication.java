package com.flagship.bounty_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the bounty ledger service.
 *
 * Tasks are published with a fixed reward, workers submit proof, an external judge
 * approves or rejects it, and approved work is settled to the worker's payout address.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class BountyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BountyLedgerApplication.class, args);
    }
}
