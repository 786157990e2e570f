package com.marketpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketpulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketpulseApplication.class, args);
    }
}
