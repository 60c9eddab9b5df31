package com.flagship.coin_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CoinLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoinLedgerApplication.class, args);
    }
}
