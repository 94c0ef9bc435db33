package com.example.renderflow_backend.config;

import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.service.decision.CostOptimizer;
import com.example.renderflow_backend.service.decision.DecisionScorer;
import com.example.renderflow_backend.service.decision.LocalFirstPolicy;
import com.example.renderflow_backend.service.decision.ScoringWeights;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine catalog plus the scorer and optimizer built on it. Both share one {@link LocalFirstPolicy} so a
 * decision and its estimate agree on when the local backend is used.
 */
@Configuration
public class DecisionConfig {

    @Bean
    public CapabilityRegistry capabilityRegistry() {
        return CapabilityRegistry.withDefaults();
    }

    @Bean
    public LocalFirstPolicy localFirstPolicy(CapabilityRegistry registry) {
        return new LocalFirstPolicy(registry);
    }

    @Bean
    public DecisionScorer decisionScorer(CapabilityRegistry registry, LocalFirstPolicy localFirst) {
        return new DecisionScorer(registry, localFirst, ScoringWeights.defaults());
    }

    @Bean
    public CostOptimizer costOptimizer(CapabilityRegistry registry, LocalFirstPolicy localFirst,
                                       EngineProperties engineProperties) {
        return new CostOptimizer(registry, localFirst, engineProperties.getFallbackUnitCost());
    }
}
