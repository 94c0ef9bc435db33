package com.example.renderflow_backend.config;

import com.example.renderflow_backend.service.Interfaces.EnvironmentProbe;
import com.example.renderflow_backend.service.decision.EnvironmentSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    /**
     * Reports the last probe of the local render backend. Always UP: without the backend batches are
     * routed to remote engines, shown as {@code mode=remote-only}.
     */
    @Bean
    public HealthIndicator renderBackendHealth(EnvironmentProbe probe) {
        return () -> {
            EnvironmentSnapshot env = probe.current();
            return Health.up()
                    .withDetail("mode", env.canRunLocally() ? "local" : "remote-only")
                    .withDetail("available", env.available())
                    .withDetail("ffmpegReady", env.ffmpegReady())
                    .withDetail("queueDepth", env.queueDepth())
                    .withDetail("latencyMs", env.latencyMs())
                    .withDetail("gpu", env.hasGpu())
                    .withDetail("probedAt", String.valueOf(env.probedAt()))
                    .build();
        };
    }
}
