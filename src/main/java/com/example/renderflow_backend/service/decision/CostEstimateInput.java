package com.example.renderflow_backend.service.decision;

import com.example.renderflow_backend.util.OperationType;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * @param count       number of operations (variations) to price
 * @param durationSec informational, pricing is per operation
 */
public record CostEstimateInput(
        EnvironmentSnapshot environment,
        OperationType operationType,
        int count,
        List<String> ratios,
        Integer durationSec,
        Set<String> availableCredentials
) {
    public CostEstimateInput {
        Objects.requireNonNull(operationType, "operationType");
        environment = environment == null ? EnvironmentSnapshot.unavailable() : environment;
        ratios = ratios == null ? List.of() : List.copyOf(ratios);
        availableCredentials = availableCredentials == null ? Set.of() : Set.copyOf(availableCredentials);
        count = Math.max(0, count);
    }
}
