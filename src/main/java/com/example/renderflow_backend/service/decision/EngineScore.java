package com.example.renderflow_backend.service.decision;

/**
 * Per-engine factors, each bounded to [0,100], plus the ranking composite and the weighted blend.
 */
public record EngineScore(
        String engineId,
        double cost,
        double quality,
        double latency,
        double availability,
        double composite,
        double weighted
) {
}
