package com.storereplenishment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReplenishmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplenishmentApplication.class, args);
    }
}
