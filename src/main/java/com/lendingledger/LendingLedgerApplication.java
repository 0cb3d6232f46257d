package com.lendingledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LendingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingLedgerApplication.class, args);
    }
}
