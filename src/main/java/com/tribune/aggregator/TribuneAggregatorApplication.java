package com.tribune.aggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TribuneAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TribuneAggregatorApplication.class, args);
    }
}
