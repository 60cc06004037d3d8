package com.momoledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MomoLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MomoLedgerApplication.class, args);
    }
}
