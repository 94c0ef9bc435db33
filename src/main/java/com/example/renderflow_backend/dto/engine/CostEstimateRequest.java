package com.example.renderflow_backend.dto.engine;

import com.example.renderflow_backend.util.OperationType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Set;

public record CostEstimateRequest(
        @NotNull OperationType operationType,
        @NotNull @Min(1) Integer count,
        List<String> ratios,
        Integer durationSeconds,
        Set<String> availableCredentials
) {
}
