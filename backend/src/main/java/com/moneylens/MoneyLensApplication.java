package com.moneylens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MoneyLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(MoneyLensApplication.class, args);
    }
}
