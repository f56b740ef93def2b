package com.snuffles.lotledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LotLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LotLedgerApplication.class, args);
    }
}
