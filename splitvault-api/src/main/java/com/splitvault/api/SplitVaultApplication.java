package com.splitvault.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SplitVault Application
 *
 * Collateralized vault splitting a base asset into cToken/iToken claims,
 * with stake-weighted dispute resolution over a tracked condition.
 */
@SpringBootApplication(scanBasePackages = "com.splitvault")
public class SplitVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(SplitVaultApplication.class, args);
    }
}
