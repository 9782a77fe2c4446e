package com.taskforge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class CoordinatorConfig {

    @Bean
    public Clock coordinatorClock() {
        return Clock.systemUTC();
    }
}
