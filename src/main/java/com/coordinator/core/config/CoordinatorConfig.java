package com.coordinator.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoordinatorConfig {

    @Bean
    public Clock coordinatorClock() {
        return Clock.systemUTC();
    }
}
