package com.flagship.spv_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Full-node service that rebuilds the in-memory wallet ledger from persisted block history.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SpvLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpvLedgerApplication.class, args);
    }
}
