package com.esgledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Supplies the clock the API layer reads "now" from.
 *
 * Core services never read the clock themselves; deadline-sensitive operations
 * take the current instant as an explicit argument.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
