package com.example.renderflow_backend.service.decision;

import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.engine.registry.LocalEngine;
import com.example.renderflow_backend.util.OperationType;

import java.util.Optional;

/**
 * Short-circuit shared by the scorer and the cost optimizer: natively handled operations go to the
 * local backend whenever it is available and ffmpeg is ready.
 */
public class LocalFirstPolicy {
    private final CapabilityRegistry registry;

    public LocalFirstPolicy(CapabilityRegistry registry) {
        this.registry = registry;
    }

    public Optional<LocalEngine> resolve(EnvironmentSnapshot env, OperationType operation) {
        if (env == null || operation == null || !env.canRunLocally() || !operation.isNativelyHandled()) {
            return Optional.empty();
        }
        return registry.localVariant(env.hasGpu());
    }

    public boolean isLocalCapable(EnvironmentSnapshot env, OperationType operation) {
        return resolve(env, operation).isPresent();
    }
}
