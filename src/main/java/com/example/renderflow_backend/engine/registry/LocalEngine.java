package com.example.renderflow_backend.engine.registry;

import com.example.renderflow_backend.util.*;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;

/**
 * Engine executed by the self-hosted render backend. Local engines are always free.
 */
public record LocalEngine(
        String id,
        String name,
        OperationType operationType,
        QualityTier quality,
        Set<Capability> capabilities,
        int maxDurationSec,
        int priority,
        long baseLatencyMs,
        boolean hardwareAccelerated,
        boolean available
) implements EngineDefinition {

    public LocalEngine {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operationType, "operationType");
        capabilities = Set.copyOf(capabilities);
    }

    @Override
    public BigDecimal costPerUnit() {
        return BigDecimal.ZERO;
    }

    @Override
    public CostTier costTier() {
        return CostTier.FREE;
    }

    @Override
    public Set<ExecutionMode> executionModes() {
        return Set.of(ExecutionMode.LOCAL);
    }

    @Override
    public EngineKind kind() {
        return EngineKind.LOCAL;
    }
}
