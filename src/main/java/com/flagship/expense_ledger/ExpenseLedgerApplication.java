package com.flagship.expense_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExpenseLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpenseLedgerApplication.class, args);
    }
}
