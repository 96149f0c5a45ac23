package com.dcruver.vaultgraph.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GraphConfiguration {

    /**
     * "Now" for recency calculations.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
