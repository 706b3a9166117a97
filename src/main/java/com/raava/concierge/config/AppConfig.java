package com.raava.concierge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class AppConfig {

    /**
     * System clock in UTC. Session expiry, appointment dates and record timestamps read
     * time through this bean.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
