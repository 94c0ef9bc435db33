package com.example.renderflow_backend.service.decision;

import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.engine.registry.LocalEngine;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.util.Capability;
import com.example.renderflow_backend.util.CostConstraint;
import com.example.renderflow_backend.util.CostTier;
import com.example.renderflow_backend.util.QualityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the engine for one operation.
 * <ol>
 *     <li>Natively handled operations short-circuit to the local backend when it is ready.</li>
 *     <li>Otherwise candidates are filtered (mode, cost tier, capability, duration, credentials) and ranked
 *     by priority plus cost and quality bonuses; ties go to the lower engine id.</li>
 *     <li>When nothing survives the filter the cheapest free-tier engine is used.</li>
 * </ol>
 * Deterministic for a given context; holds no mutable state.
 */
public class DecisionScorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DecisionScorer.class);

    static final long QUEUE_PENALTY_MS = 500;
    static final int MIN_DURATION_CAP_SEC = 10;
    private static final int MAX_ALTERNATIVES = 3;

    private final CapabilityRegistry registry;
    private final LocalFirstPolicy localFirst;
    private final ScoringWeights weights;

    public DecisionScorer(CapabilityRegistry registry, LocalFirstPolicy localFirst, ScoringWeights weights) {
        this.registry = registry;
        this.localFirst = localFirst;
        this.weights = weights == null ? ScoringWeights.defaults() : weights;
    }

    public DecisionResult selectEngine(DecisionContext context) {
        Optional<LocalEngine> local = localFirst.resolve(context.environment(), context.operationType());
        if (local.isPresent()) {
            return localFirstDecision(local.get(), context);
        }

        List<Ranked> ranked = registry.getAll().stream()
                .filter(e -> isCandidate(e, context))
                .map(e -> new Ranked(e, score(e, context)))
                .sorted(Comparator.comparingDouble((Ranked r) -> r.score().composite()).reversed()
                        .thenComparing(r -> r.engine().id()))
                .toList();

        if (ranked.isEmpty()) {
            return freeTierFallback(context);
        }

        Ranked top = ranked.get(0);
        List<DecisionResult.Alternative> alternatives = ranked.stream()
                .skip(1)
                .limit(MAX_ALTERNATIVES)
                .map(r -> new DecisionResult.Alternative(r.engine().id(), r.engine().name(),
                        r.score().composite(), estimatedCost(r.engine(), context)))
                .toList();

        String why = "Score %.1f of %d candidates (priority %d, cost %.0f, quality %.0f)".formatted(
                top.score().composite(), ranked.size(), top.engine().priority(),
                top.score().cost(), top.score().quality());
        LOGGER.debug("Decision op={} engine={} path=SCORED candidates={}", context.operationType(),
                top.engine().id(), ranked.size());
        return new DecisionResult(top.engine().id(), top.engine().name(), top.score().composite(), top.score(), why,
                estimatedCost(top.engine(), context), estimatedDuration(top.engine(), context),
                estimatedLatency(top.engine(), context), false, DecisionPath.SCORED, alternatives);
    }

    /** Factor breakdown and composite for one engine under {@code context}. */
    public EngineScore score(EngineDefinition engine, DecisionContext context) {
        double cost = Math.min(100, engine.costPerUnit().doubleValue() * 1000);
        double quality = engine.quality().factorScore();
        if (context.qualityPreference() == QualityTier.CINEMATIC && engine.quality() != QualityTier.CINEMATIC) {
            quality = Math.max(0, quality - 20);
        }
        double latency = Math.min(100, estimatedLatency(engine, context) / 500.0);
        double availability = isReachable(engine, context) ? 100 : 0;
        double composite = engine.priority() + costTerm(engine, context.costConstraint())
                + qualityTerm(engine, context.qualityPreference());
        return new EngineScore(engine.id(), cost, quality, latency, availability, composite,
                weights.blend(cost, quality, latency, availability));
    }

    private DecisionResult localFirstDecision(LocalEngine engine, DecisionContext context) {
        EngineScore score = score(engine, context);
        long latency = estimatedLatency(engine, context);
        LOGGER.debug("Decision op={} engine={} path=LOCAL_FIRST queueDepth={}", context.operationType(), engine.id(),
                context.environment().queueDepth());
        return new DecisionResult(engine.id(), engine.name(), score.composite(), score,
                "Local backend ready, %s handled natively".formatted(context.operationType()),
                BigDecimal.ZERO, estimatedDuration(engine, context), latency, true, DecisionPath.LOCAL_FIRST,
                List.of());
    }

    private DecisionResult freeTierFallback(DecisionContext context) {
        EngineDefinition fallback = registry.freeTier().stream()
                .filter(e -> !e.isLocal() || context.environment().canRunLocally())
                .min(Comparator.comparingInt(EngineDefinition::priority).thenComparing(EngineDefinition::id))
                .orElseThrow(() -> PipelineException.configuration(
                        "No engine available for operation " + context.operationType()));
        EngineScore score = score(fallback, context);
        LOGGER.info("Decision op={} engine={} path=FREE_TIER_FALLBACK constraint={}", context.operationType(),
                fallback.id(), context.costConstraint());
        return new DecisionResult(fallback.id(), fallback.name(), score.composite(), score,
                "No candidate matched; free-tier fallback", estimatedCost(fallback, context),
                estimatedDuration(fallback, context), estimatedLatency(fallback, context), false,
                DecisionPath.FREE_TIER_FALLBACK, List.of());
    }

    private boolean isCandidate(EngineDefinition engine, DecisionContext context) {
        if (context.executionMode() != null && !engine.executionModes().contains(context.executionMode())) {
            return false;
        }
        if (!context.costConstraint().includes(engine.costTier())) {
            return false;
        }
        Capability required = context.requiredCapability();
        if (!engine.supports(required)) {
            return false;
        }
        if (engine.maxDurationSec() < Math.min(context.durationSec(), MIN_DURATION_CAP_SEC)) {
            return false;
        }
        return isReachable(engine, context);
    }

    private boolean isReachable(EngineDefinition engine, DecisionContext context) {
        if (!engine.available()) {
            return false;
        }
        if (engine.isLocal()) {
            return context.environment().canRunLocally();
        }
        return engine.requiredCredential().map(context.availableCredentials()::contains).orElse(true);
    }

    private double costTerm(EngineDefinition engine, CostConstraint constraint) {
        return switch (constraint) {
            case FREE -> engine.isFree() ? 50 : 0;
            case BUDGET -> switch (engine.costTier()) {
                case FREE -> 30;
                case BUDGET -> 20;
                case PREMIUM -> 0;
            };
            case PREMIUM -> engine.costTier() == CostTier.PREMIUM ? 20 : 0;
            case AI_CHOOSES -> 100 - engine.costPerUnit().doubleValue() * 100;
        };
    }

    private double qualityTerm(EngineDefinition engine, QualityTier preference) {
        if (preference == null || engine.quality() != preference) {
            return 0;
        }
        return switch (preference) {
            case FAST -> 25;
            case BALANCED -> 20;
            case CINEMATIC -> 30;
        };
    }

    int estimatedDuration(EngineDefinition engine, DecisionContext context) {
        return Math.min(context.durationSec(), engine.maxDurationSec());
    }

    BigDecimal estimatedCost(EngineDefinition engine, DecisionContext context) {
        return engine.costPerUnit()
                .multiply(BigDecimal.valueOf(estimatedDuration(engine, context)))
                .setScale(4, RoundingMode.HALF_UP);
    }

    long estimatedLatency(EngineDefinition engine, DecisionContext context) {
        long queuePenalty = engine.isLocal() ? context.environment().queueDepth() * QUEUE_PENALTY_MS : 0;
        return engine.baseLatencyMs() + queuePenalty;
    }

    private record Ranked(EngineDefinition engine, EngineScore score) {
    }
}
