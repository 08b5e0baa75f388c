package com.gillianbc.finhealth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinanceHealthApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinanceHealthApplication.class, args);
    }
}
