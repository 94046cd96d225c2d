package com.salescrm.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides a single source of truth for time across the app.
 * Services take "now" from this clock so that scheduling rules can be tested.
 */
@Configuration
public class TimeConfig {
    @Bean
    public Clock appClock() {
        return Clock.systemUTC();
    }
}
