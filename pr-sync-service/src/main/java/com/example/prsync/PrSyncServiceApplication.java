package com.example.prsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PrSyncServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrSyncServiceApplication.class, args);
    }
}
