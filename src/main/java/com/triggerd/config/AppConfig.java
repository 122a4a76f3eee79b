package com.triggerd.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    // Single source of "now" for schedules and execution timestamps
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
