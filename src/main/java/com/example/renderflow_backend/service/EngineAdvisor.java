package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.EngineProperties;
import com.example.renderflow_backend.dto.engine.CostEstimateRequest;
import com.example.renderflow_backend.dto.engine.EngineSelectionRequest;
import com.example.renderflow_backend.dto.engine.EngineView;
import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.service.Interfaces.EnvironmentProbe;
import com.example.renderflow_backend.service.decision.*;
import com.example.renderflow_backend.util.Capability;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Read-only engine queries: decisions and estimates against the current environment snapshot, and the
 * registry listing. Nothing here is persisted.
 */
@Service
public class EngineAdvisor {
    private final CapabilityRegistry registry;
    private final DecisionScorer scorer;
    private final CostOptimizer optimizer;
    private final EnvironmentProbe probe;
    private final EngineProperties engineProperties;

    public EngineAdvisor(CapabilityRegistry registry, DecisionScorer scorer, CostOptimizer optimizer,
                         EnvironmentProbe probe, EngineProperties engineProperties) {
        this.registry = registry;
        this.scorer = scorer;
        this.optimizer = optimizer;
        this.probe = probe;
        this.engineProperties = engineProperties;
    }

    public DecisionResult select(EngineSelectionRequest req) {
        return scorer.selectEngine(new DecisionContext(probe.current(), req.operationType(), req.qualityPreference(),
                req.costConstraint(), req.executionMode(), credentials(req.availableCredentials()), req.userTier(),
                req.durationSeconds(), req.platform(), req.market(), req.hasReferenceImage(), req.hasSourceVideo()));
    }

    public CostEstimate estimate(CostEstimateRequest req) {
        return optimizer.estimate(new CostEstimateInput(probe.current(), req.operationType(), req.count(),
                req.ratios(), req.durationSeconds(), credentials(req.availableCredentials())));
    }

    public List<EngineView> list(Capability capability) {
        var engines = capability == null ? registry.getAll() : registry.getByCapability(capability);
        return engines.stream().map(EngineView::of).toList();
    }

    public EnvironmentSnapshot environment() {
        return probe.current();
    }

    private Set<String> credentials(Set<String> requested) {
        return requested != null ? requested : engineProperties.availableCredentialKeys();
    }
}
