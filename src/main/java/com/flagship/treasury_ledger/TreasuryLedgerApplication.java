package com.flagship.treasury_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableRetry
@EnableScheduling
public class TreasuryLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TreasuryLedgerApplication.class, args);
    }
}
