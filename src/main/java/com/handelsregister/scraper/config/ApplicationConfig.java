package com.handelsregister.scraper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class ApplicationConfig {

    /** Time source for token {@code iat} claims and limiter idle tracking; replaced by a fixed clock in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
