package com.example.renderflow_backend.dto.engine;

import com.example.renderflow_backend.util.CostConstraint;
import com.example.renderflow_backend.util.ExecutionMode;
import com.example.renderflow_backend.util.OperationType;
import com.example.renderflow_backend.util.QualityTier;
import com.example.renderflow_backend.util.UserTier;
import jakarta.validation.constraints.NotNull;

import java.util.Set;

/**
 * Decision request. When {@code availableCredentials} is omitted the credentials configured on the server
 * are used.
 */
public record EngineSelectionRequest(
        @NotNull OperationType operationType,
        QualityTier qualityPreference,
        CostConstraint costConstraint,
        ExecutionMode executionMode,
        Set<String> availableCredentials,
        UserTier userTier,
        Integer durationSeconds,
        String platform,
        String market,
        boolean hasReferenceImage,
        boolean hasSourceVideo
) {
}
