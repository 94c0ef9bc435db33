package com.example.renderflow_backend.service.decision;

import java.math.BigDecimal;
import java.util.List;

public record DecisionResult(
        String engineId,
        String engineName,
        double score,
        EngineScore factors,
        String justification,
        BigDecimal estimatedCost,
        int estimatedDurationSec,
        long estimatedLatencyMs,
        boolean usedLocalFirst,
        DecisionPath path,
        List<Alternative> alternatives
) {
    public record Alternative(String engineId, String engineName, double score, BigDecimal estimatedCost) {
    }

    public DecisionResult {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
}
