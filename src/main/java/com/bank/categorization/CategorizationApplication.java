package com.bank.categorization;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CategorizationApplication {

    public static void main(String[] args) {
        SpringApplication.run(CategorizationApplication.class, args);
    }
}
