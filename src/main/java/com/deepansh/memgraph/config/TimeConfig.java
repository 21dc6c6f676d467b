package com.deepansh.memgraph.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single clock for every "now" the memory graph records: fingerprint first-seen,
 * relationship since-dates and access times. Tests pass a fixed clock instead.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
