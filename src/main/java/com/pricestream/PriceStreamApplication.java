package com.pricestream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PriceStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceStreamApplication.class, args);
    }
}
