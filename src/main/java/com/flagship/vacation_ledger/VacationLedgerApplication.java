package com.flagship.vacation_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VacationLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VacationLedgerApplication.class, args);
    }
}
