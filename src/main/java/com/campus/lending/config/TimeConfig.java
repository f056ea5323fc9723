package com.campus.lending.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(LendingProperties properties) {
        return Clock.system(properties.timeZone());
    }
}
