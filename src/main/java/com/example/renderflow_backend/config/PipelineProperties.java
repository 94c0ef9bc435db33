package com.example.renderflow_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Retry, timeout and polling knobs of the batch pipeline.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Whole-chain attempts per item (first try included). */
    private int maxAttempts = 3;
    private Duration backoffInitial = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    private Duration backoffMax = Duration.ofSeconds(10);
    private Duration stageTimeout = Duration.ofMinutes(2);
    private Duration batchTimeout = Duration.ofMinutes(10);
    private Duration pollInterval = Duration.ofSeconds(2);
    private int maxVariations = 50;
    private String defaultRatio = "9:16";
    private int defaultDurationSec = 10;
    private Validation validation = new Validation();

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffInitial() {
        return backoffInitial;
    }

    public void setBackoffInitial(Duration backoffInitial) {
        this.backoffInitial = backoffInitial;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        this.backoffMax = backoffMax;
    }

    public Duration getStageTimeout() {
        return stageTimeout;
    }

    public void setStageTimeout(Duration stageTimeout) {
        this.stageTimeout = stageTimeout;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public void setBatchTimeout(Duration batchTimeout) {
        this.batchTimeout = batchTimeout;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxVariations() {
        return maxVariations;
    }

    public void setMaxVariations(int maxVariations) {
        this.maxVariations = maxVariations;
    }

    public String getDefaultRatio() {
        return defaultRatio;
    }

    public void setDefaultRatio(String defaultRatio) {
        this.defaultRatio = defaultRatio;
    }

    public int getDefaultDurationSec() {
        return defaultDurationSec;
    }

    public void setDefaultDurationSec(int defaultDurationSec) {
        this.defaultDurationSec = defaultDurationSec;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    /**
     * Backoff before retry number {@code retry} (1-based), capped at {@link #backoffMax}.
     */
    public Duration backoffFor(int retry) {
        double factor = Math.pow(Math.max(1.0, backoffMultiplier), Math.max(0, retry - 1));
        long millis = (long) Math.min(backoffMax.toMillis(), backoffInitial.toMillis() * factor);
        return Duration.ofMillis(Math.max(0, millis));
    }

    public static class Validation {
        private int maxAttempts = 5;
        private Duration retryDelay = Duration.ofSeconds(2);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private long minContentLength = 1000;
        private List<String> internalPrefixes = new ArrayList<>(List.of("storage://"));

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public long getMinContentLength() {
            return minContentLength;
        }

        public void setMinContentLength(long minContentLength) {
            this.minContentLength = minContentLength;
        }

        public List<String> getInternalPrefixes() {
            return internalPrefixes;
        }

        public void setInternalPrefixes(List<String> internalPrefixes) {
            this.internalPrefixes = internalPrefixes;
        }
    }
}
