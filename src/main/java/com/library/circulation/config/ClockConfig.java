package com.library.circulation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // Domain code never reads the system clock directly.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
