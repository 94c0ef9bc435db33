package com.example.renderflow_backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * UTC clock behind batch deadlines, item stage timestamps, probe snapshots and progress events.
 * Tests substitute a fixed clock.
 */
@Configuration
class ClockConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    Clock pipelineClock() {
        return Clock.systemUTC();
    }
}
