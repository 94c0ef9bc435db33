package com.example.renderflow_backend.service.decision;

import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.engine.registry.EngineCatalog;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.engine.registry.LocalEngine;
import com.example.renderflow_backend.util.Capability;
import com.example.renderflow_backend.util.EngineKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Prices a batch before it runs. One generated variation is one billable unit.
 * <p>
 * Uses the same local-first predicate as {@link DecisionScorer}, so an operation the scorer routes to the
 * local backend is always estimated at zero.
 */
public class CostOptimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CostOptimizer.class);
    private static final int SCALE = 4;

    private final CapabilityRegistry registry;
    private final LocalFirstPolicy localFirst;
    private final BigDecimal fallbackUnitCost;

    public CostOptimizer(CapabilityRegistry registry, LocalFirstPolicy localFirst, BigDecimal fallbackUnitCost) {
        this.registry = registry;
        this.localFirst = localFirst;
        this.fallbackUnitCost = fallbackUnitCost == null ? new BigDecimal("0.01") : fallbackUnitCost;
    }

    public CostEstimate estimate(CostEstimateInput input) {
        int quantity = input.count();
        List<EngineDefinition> reachable = reachablePaidEngines(input);
        BigDecimal max = reachable.stream()
                .map(EngineDefinition::costPerUnit)
                .max(Comparator.naturalOrder())
                .map(unit -> total(unit, quantity))
                .orElse(null);

        Optional<LocalEngine> local = localFirst.resolve(input.environment(), input.operationType());
        if (local.isPresent()) {
            LocalEngine engine = local.get();
            CostBreakdown line = new CostBreakdown(engine.id(), engine.name(), input.operationType(),
                    BigDecimal.ZERO, quantity, total(BigDecimal.ZERO, quantity), false);
            BigDecimal zero = total(BigDecimal.ZERO, quantity);
            return log(input, new CostEstimate(zero, max == null ? zero : max, zero, List.of(line),
                    CostStrategy.LOCAL_FIRST, quantity, 0));
        }

        Optional<EngineDefinition> cheapest = reachable.stream()
                .min(Comparator.comparing(EngineDefinition::costPerUnit).thenComparing(EngineDefinition::id));
        if (cheapest.isPresent()) {
            EngineDefinition engine = cheapest.get();
            BigDecimal optimized = total(engine.costPerUnit(), quantity);
            CostBreakdown line = new CostBreakdown(engine.id(), engine.name(), input.operationType(),
                    engine.costPerUnit(), quantity, optimized, true);
            return log(input, new CostEstimate(optimized, max, optimized, List.of(line),
                    CostStrategy.CLOUD_FALLBACK, 0, quantity));
        }

        BigDecimal optimized = total(fallbackUnitCost, quantity);
        String edgeName = registry.getById(EngineCatalog.EDGE_FFMPEG).map(EngineDefinition::name).orElse("Edge fallback");
        CostBreakdown line = new CostBreakdown(EngineCatalog.EDGE_FFMPEG, edgeName, input.operationType(),
                fallbackUnitCost, quantity, optimized, true);
        return log(input, new CostEstimate(optimized, optimized, optimized, List.of(line),
                CostStrategy.EDGE_FALLBACK, 0, quantity));
    }

    /** Credentialed provider engines whose credential the caller holds and that can run the operation. */
    private List<EngineDefinition> reachablePaidEngines(CostEstimateInput input) {
        Capability edit = input.operationType().editCapability();
        return registry.getAll().stream()
                .filter(e -> e.kind() == EngineKind.PROVIDER)
                .filter(e -> !e.isFree())
                .filter(e -> edit == null || e.supports(edit))
                .filter(e -> e.requiredCredential().map(input.availableCredentials()::contains).orElse(true))
                .toList();
    }

    private static BigDecimal total(BigDecimal unit, int quantity) {
        return unit.multiply(BigDecimal.valueOf(quantity)).setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static CostEstimate log(CostEstimateInput input, CostEstimate estimate) {
        LOGGER.debug("Cost estimate op={} count={} strategy={} optimized={}", input.operationType(), input.count(),
                estimate.strategy().label(), estimate.optimized());
        return estimate;
    }
}
