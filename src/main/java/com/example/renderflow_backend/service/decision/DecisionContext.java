package com.example.renderflow_backend.service.decision;

import com.example.renderflow_backend.util.*;

import java.util.Objects;
import java.util.Set;

/**
 * Inputs of one engine decision. Scores computed for different contexts are not comparable.
 *
 * @param qualityPreference  {@code null} when the caller has no preference
 * @param executionMode      {@code null} admits every mode
 * @param requestedDurationSec {@code null} falls back to {@link #DEFAULT_DURATION_SEC}
 */
public record DecisionContext(
        EnvironmentSnapshot environment,
        OperationType operationType,
        QualityTier qualityPreference,
        CostConstraint costConstraint,
        ExecutionMode executionMode,
        Set<String> availableCredentials,
        UserTier userTier,
        Integer requestedDurationSec,
        String platform,
        String market,
        boolean hasReferenceImage,
        boolean hasSourceVideo
) {
    public static final int DEFAULT_DURATION_SEC = 10;

    public DecisionContext {
        Objects.requireNonNull(operationType, "operationType");
        environment = environment == null ? EnvironmentSnapshot.unavailable() : environment;
        costConstraint = costConstraint == null ? CostConstraint.AI_CHOOSES : costConstraint;
        availableCredentials = availableCredentials == null ? Set.of() : Set.copyOf(availableCredentials);
        userTier = userTier == null ? UserTier.FREE : userTier;
    }

    public int durationSec() {
        return requestedDurationSec == null || requestedDurationSec <= 0 ? DEFAULT_DURATION_SEC : requestedDurationSec;
    }

    /**
     * Capability the operation needs. Native operations need the matching edit capability; for generation it
     * follows the inputs the caller supplied.
     */
    public Capability requiredCapability() {
        if (operationType.isNativelyHandled()) {
            return operationType.editCapability();
        }
        if (operationType == OperationType.AVATAR_GENERATION) {
            return Capability.AVATAR;
        }
        if (hasReferenceImage) {
            return Capability.IMAGE_TO_VIDEO;
        }
        if (hasSourceVideo) {
            return Capability.VIDEO_TO_VIDEO;
        }
        return Capability.TEXT_TO_VIDEO;
    }

    public DecisionContext withEnvironment(EnvironmentSnapshot snapshot) {
        return new DecisionContext(snapshot, operationType, qualityPreference, costConstraint, executionMode,
                availableCredentials, userTier, requestedDurationSec, platform, market, hasReferenceImage,
                hasSourceVideo);
    }
}
