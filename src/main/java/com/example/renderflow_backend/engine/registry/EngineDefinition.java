package com.example.renderflow_backend.engine.registry;

import com.example.renderflow_backend.util.*;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalog entry describing one execution backend.
 * <p>
 * {@code costPerUnit} is USD per generated unit. Engines are either {@link LocalEngine} (ffmpeg on the
 * self-hosted render backend) or {@link RemoteEngine} (edge function or paid provider).
 */
public sealed interface EngineDefinition permits LocalEngine, RemoteEngine {

    String id();

    String name();

    OperationType operationType();

    BigDecimal costPerUnit();

    QualityTier quality();

    CostTier costTier();

    Set<Capability> capabilities();

    Set<ExecutionMode> executionModes();

    int maxDurationSec();

    int priority();

    long baseLatencyMs();

    boolean available();

    EngineKind kind();

    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }

    default boolean isFree() {
        return costTier() == CostTier.FREE;
    }

    default boolean isLocal() {
        return kind() == EngineKind.LOCAL;
    }

    /** Credential key the invocation client needs, empty when the engine needs none. */
    default Optional<String> requiredCredential() {
        return Optional.empty();
    }
}
