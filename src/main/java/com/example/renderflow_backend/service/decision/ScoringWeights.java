package com.example.renderflow_backend.service.decision;

/**
 * Weights of the reported factor blend. Cost and latency are inverted (lower is better).
 */
public record ScoringWeights(double cost, double quality, double latency, double availability) {

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.4, 0.3, 0.2, 0.1);
    }

    public double blend(double costFactor, double qualityFactor, double latencyFactor, double availabilityFactor) {
        return (100 - costFactor) * cost
                + qualityFactor * quality
                + (100 - latencyFactor) * latency
                + availabilityFactor * availability;
    }
}
