package com.flagship.gold_history;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoldHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoldHistoryApplication.class, args);
    }
}
