package com.flagship.pocket_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PocketLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PocketLedgerApplication.class, args);
    }
}
