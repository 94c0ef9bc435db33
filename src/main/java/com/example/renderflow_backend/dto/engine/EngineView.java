package com.example.renderflow_backend.dto.engine;

import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.util.*;

import java.math.BigDecimal;
import java.util.Set;

public record EngineView(
        String id,
        String name,
        EngineKind kind,
        OperationType operationType,
        BigDecimal costPerUnit,
        QualityTier quality,
        CostTier costTier,
        Set<Capability> capabilities,
        Set<ExecutionMode> executionModes,
        int maxDurationSec,
        int priority,
        String requiredCredential
) {
    public static EngineView of(EngineDefinition engine) {
        return new EngineView(engine.id(), engine.name(), engine.kind(), engine.operationType(), engine.costPerUnit(),
                engine.quality(), engine.costTier(), engine.capabilities(), engine.executionModes(),
                engine.maxDurationSec(), engine.priority(), engine.requiredCredential().orElse(null));
    }
}
