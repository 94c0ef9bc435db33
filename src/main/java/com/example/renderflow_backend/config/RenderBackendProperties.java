package com.example.renderflow_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Self-hosted ffmpeg render backend, used both for local engine calls and for the environment probe.
 */
@ConfigurationProperties(prefix = "render-backend")
public class RenderBackendProperties {
    private String baseUrl = "http://127.0.0.1:9000";
    private String healthPath = "/health";
    private long timeoutSeconds = 120;
    private long probeTimeoutSeconds = 5;
    private long probeIntervalMs = 30_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getHealthPath() {
        return healthPath;
    }

    public void setHealthPath(String healthPath) {
        this.healthPath = healthPath;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getProbeTimeoutSeconds() {
        return probeTimeoutSeconds;
    }

    public void setProbeTimeoutSeconds(long probeTimeoutSeconds) {
        this.probeTimeoutSeconds = probeTimeoutSeconds;
    }

    public long getProbeIntervalMs() {
        return probeIntervalMs;
    }

    public void setProbeIntervalMs(long probeIntervalMs) {
        this.probeIntervalMs = probeIntervalMs;
    }
}
