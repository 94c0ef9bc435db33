package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.EngineProperties;
import com.example.renderflow_backend.config.PipelineProperties;
import com.example.renderflow_backend.dto.batch.BatchSpecRequest;
import com.example.renderflow_backend.dto.batch.BatchStatusResponse;
import com.example.renderflow_backend.dto.batch.BatchSubmitResponse;
import com.example.renderflow_backend.dto.engine.EngineCallbackRequest;
import com.example.renderflow_backend.engine.EngineResponses;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.TaskStatus;
import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.service.Interfaces.BatchJobStore;
import com.example.renderflow_backend.service.Interfaces.EnvironmentProbe;
import com.example.renderflow_backend.service.decision.DecisionContext;
import com.example.renderflow_backend.service.decision.DecisionResult;
import com.example.renderflow_backend.service.decision.DecisionScorer;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ItemState;
import com.example.renderflow_backend.util.OperationType;
import com.example.renderflow_backend.util.PipelineStage;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Entry point of the batch pipeline: validates and prices a submission, persists it for the worker, and reads
 * status back.
 */
@Service
public class BatchOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchOrchestrator.class);
    private static final Pattern RATIO = Pattern.compile("^\\d{1,2}:\\d{1,2}$");
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final BatchJobStore store;
    private final DecisionScorer scorer;
    private final EnvironmentProbe probe;
    private final AsyncTaskTracker tasks;
    private final PipelineProperties props;
    private final EngineProperties engineProperties;
    private final ObjectMapper mapper;

    public BatchOrchestrator(BatchJobStore store, DecisionScorer scorer, EnvironmentProbe probe, AsyncTaskTracker tasks,
                             PipelineProperties props, EngineProperties engineProperties, ObjectMapper mapper) {
        this.store = store;
        this.scorer = scorer;
        this.probe = probe;
        this.tasks = tasks;
        this.props = props;
        this.engineProperties = engineProperties;
        this.mapper = mapper;
    }

    /**
     * @throws PipelineException VALIDATION_ERROR for a malformed spec, CONFIGURATION_ERROR when no engine fits;
     *                           nothing is persisted in either case
     */
    public BatchSubmitResponse submit(BatchSpecRequest spec) {
        List<String> ratios = validate(spec);
        DecisionResult decision = scorer.selectEngine(decisionContext(spec));

        BatchJob job = new BatchJob(mapper.convertValue(spec, MAP), mapper.convertValue(decision, MAP));
        List<BatchItem> items = new ArrayList<>();
        int ordinal = 0;
        for (int variation = 0; variation < spec.variationCount(); variation++) {
            for (String ratio : ratios) {
                items.add(new BatchItem(null, ordinal++, ratio));
            }
        }
        UUID id = store.insert(job, items);
        LOGGER.info("BATCH SUBMIT batch={} items={} engine={} path={} estimatedCost={}", id, items.size(),
                decision.engineId(), decision.path(), decision.estimatedCost());
        return new BatchSubmitResponse(id, BatchStatus.QUEUED, decision.engineId(), items.size());
    }

    public BatchStatusResponse getStatus(UUID jobId) {
        BatchJob job = store.findJob(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "BATCH_NOT_FOUND"));
        List<BatchItem> items = store.listItems(jobId);

        Map<UUID, ItemState> states = new LinkedHashMap<>();
        Map<UUID, PipelineError> errors = new LinkedHashMap<>();
        List<BatchStatusResponse.ItemView> details = new ArrayList<>();
        List<String> validated = new ArrayList<>();
        int ready = 0, failed = 0, timedOut = 0, terminal = 0;
        for (BatchItem item : items) {
            states.put(item.getId(), item.getState());
            details.add(new BatchStatusResponse.ItemView(item.getId(), item.getOrdinal(), item.getRatio(),
                    item.getState(), item.getEngineId(), item.getArtifactUrl(), item.getRetryCount()));
            if (item.lastError() != null) {
                errors.put(item.getId(), item.lastError());
            }
            switch (item.getState()) {
                case READY -> {
                    ready++;
                    validated.add(item.getArtifactUrl());
                }
                case FAILED -> failed++;
                case TIMED_OUT -> timedOut++;
                default -> { }
            }
            if (item.isTerminal()) terminal++;
        }

        int percent = progressPercent(job, items.size(), terminal);
        PipelineError batchError = job.getErrorKind() == null ? null
                : new PipelineError(job.getErrorKind(), job.getErrorMessage(), false);
        Object engineId = job.getDecision() == null ? null : job.getDecision().get("engineId");
        return new BatchStatusResponse(job.getId(), job.getStatus(),
                job.getCurrentStage() == null ? null : job.getCurrentStage().label(),
                List.copyOf(job.getCompletedStages()), percent, states, details, validated, errors,
                new BatchStatusResponse.Counts(ready + failed + timedOut, ready, failed, timedOut, items.size()),
                engineId == null ? null : engineId.toString(), job.getCreatedAt(), job.getStartedAt(),
                job.getFinishedAt(), batchError);
    }

    /**
     * Resolves an async task handle from the engine webhook.
     *
     * @return {@code false} when no item owns the handle
     */
    public boolean resolveTask(EngineCallbackRequest callback) {
        Optional<BatchItem> item = store.findItemByTaskHandle(callback.taskHandle());
        if (item.isEmpty()) {
            LOGGER.warn("Callback for unknown task handle={} engine={}", callback.taskHandle(), callback.engine());
            return false;
        }
        TaskStatus status = EngineResponses.toTaskStatus(callback.status(), callback.artifactUrl(), callback.error());
        if (!tasks.complete(callback.taskHandle(), status)) {
            LOGGER.debug("Callback after item stopped waiting handle={} item={}", callback.taskHandle(),
                    item.get().getId());
            return true;
        }
        LOGGER.info("Callback resolved handle={} item={} state={}", callback.taskHandle(), item.get().getId(),
                status.state());
        return true;
    }

    DecisionContext decisionContext(BatchSpecRequest spec) {
        int duration = spec.durationSeconds() != null ? spec.durationSeconds() : props.getDefaultDurationSec();
        return new DecisionContext(probe.current(), OperationType.VIDEO_GENERATION, spec.qualityPreference(),
                spec.costConstraint(), spec.executionMode(), engineProperties.availableCredentialKeys(),
                spec.userTier(), duration, spec.platform(), spec.market(),
                !spec.referenceImageRefsOrEmpty().isEmpty(), !spec.sourceVideoRefsOrEmpty().isEmpty());
    }

    private List<String> validate(BatchSpecRequest spec) {
        if (spec == null) {
            throw PipelineException.validation("Batch spec is required");
        }
        if (spec.variationCount() == null || spec.variationCount() < 1) {
            throw PipelineException.validation("variationCount must be at least 1");
        }
        if (!spec.hasAnyInput()) {
            throw PipelineException.validation("A prompt or at least one source reference is required");
        }
        List<String> ratios = spec.ratios() == null || spec.ratios().isEmpty()
                ? List.of(props.getDefaultRatio())
                : spec.ratios().stream().map(r -> r == null ? "" : r.trim()).distinct().toList();
        for (String ratio : ratios) {
            if (!RATIO.matcher(ratio).matches()) {
                throw PipelineException.validation("Invalid aspect ratio: '" + ratio + "'");
            }
        }
        long total = (long) spec.variationCount() * ratios.size();
        if (total > props.getMaxVariations()) {
            throw PipelineException.validation("Batch of %d items exceeds the limit of %d"
                    .formatted(total, props.getMaxVariations()));
        }
        if (spec.durationSeconds() != null && spec.durationSeconds() <= 0) {
            throw PipelineException.validation("durationSeconds must be positive");
        }
        return ratios;
    }

    private static int progressPercent(BatchJob job, int total, int terminal) {
        if (job.getStatus() != null && job.getStatus().isTerminal()) {
            return 100;
        }
        int stages = PipelineStage.values().length;
        double stageShare = (double) job.getCompletedStages().size() / stages;
        double itemShare = total == 0 ? 0 : (double) terminal / total;
        return (int) Math.min(99, Math.round((stageShare * 0.5 + itemShare * 0.5) * 100));
    }
}
