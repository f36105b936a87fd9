package com.fintech.escrow.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** All local timestamps are UTC so they compare directly with ledger time. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
