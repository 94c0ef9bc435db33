package com.example.renderflow_backend.engine.registry;

import com.example.renderflow_backend.util.*;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Engine reached over HTTP, either an edge function ({@link Provider#EDGE}) or a paid provider.
 *
 * @param credentialKey name of the credential the provider needs, {@code null} when none
 */
public record RemoteEngine(
        String id,
        String name,
        OperationType operationType,
        BigDecimal costPerUnit,
        QualityTier quality,
        CostTier costTier,
        Set<Capability> capabilities,
        Set<ExecutionMode> executionModes,
        int maxDurationSec,
        int priority,
        long baseLatencyMs,
        Provider provider,
        String credentialKey,
        boolean available
) implements EngineDefinition {

    public RemoteEngine {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(costPerUnit, "costPerUnit");
        capabilities = Set.copyOf(capabilities);
        executionModes = Set.copyOf(executionModes);
    }

    @Override
    public EngineKind kind() {
        return provider == Provider.EDGE ? EngineKind.EDGE : EngineKind.PROVIDER;
    }

    @Override
    public Optional<String> requiredCredential() {
        return Optional.ofNullable(credentialKey).filter(k -> !k.isBlank());
    }
}
