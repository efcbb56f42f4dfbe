package com.example.clipscore_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * UTC clock that stamps analysis reports and history entries. Tests pass a fixed clock instead.
 */
@Configuration
class TimeConfig {

    @Bean
    public Clock analysisClock() {
        return Clock.systemUTC();
    }
}
