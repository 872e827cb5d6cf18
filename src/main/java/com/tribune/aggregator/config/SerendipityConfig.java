package com.tribune.aggregator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class SerendipityConfig {

    @Bean
    public Random serendipityRandom() {
        return new SecureRandom();
    }
}
