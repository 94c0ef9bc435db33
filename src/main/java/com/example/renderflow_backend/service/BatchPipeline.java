package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.PipelineProperties;
import com.example.renderflow_backend.dto.batch.BatchSpecRequest;
import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.model.ItemPatch;
import com.example.renderflow_backend.model.JobPatch;
import com.example.renderflow_backend.service.Interfaces.BatchJobStore;
import com.example.renderflow_backend.service.Interfaces.ProgressNotifier;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.ItemState;
import com.example.renderflow_backend.util.PipelineStage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one claimed batch to a terminal status.
 * <p>
 * Batch-level stages run one after the other; the per-item window then fans every non-terminal item out on the
 * item executor in creation order. The hard batch timeout is measured from the first start and, once passed,
 * cancels outstanding items and closes them as TIMED_OUT.
 */
@Service
public class BatchPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchPipeline.class);
    private static final List<PipelineStage> WINDOW = PipelineStage.itemWindow();

    private final BatchJobStore store;
    private final ContentPreparationService preparation;
    private final ItemPipeline itemPipeline;
    private final CapabilityRegistry registry;
    private final ProgressNotifier notifier;
    private final PipelineProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final AsyncTaskExecutor itemExecutor;

    public BatchPipeline(BatchJobStore store, ContentPreparationService preparation, ItemPipeline itemPipeline,
                         CapabilityRegistry registry, ProgressNotifier notifier, PipelineProperties props,
                         ObjectMapper mapper, Clock clock,
                         @Qualifier("itemTaskExecutor") AsyncTaskExecutor itemExecutor) {
        this.store = store;
        this.preparation = preparation;
        this.itemPipeline = itemPipeline;
        this.registry = registry;
        this.notifier = notifier;
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
        this.itemExecutor = itemExecutor;
    }

    public BatchStatus run(BatchJob job) {
        UUID batchId = job.getId();
        Instant startedAt = job.getStartedAt() != null ? job.getStartedAt() : clock.instant();
        Instant deadline = startedAt.plus(props.getBatchTimeout());
        store.mergeJob(batchId, JobPatch.empty().withStatus(BatchStatus.RUNNING).started());

        BatchSpecRequest spec = mapper.convertValue(job.getSpec(), BatchSpecRequest.class);
        List<BatchItem> items = store.listItems(batchId);

        Optional<EngineDefinition> engine = resolveEngine(job);
        if (engine.isEmpty()) {
            PipelineError error = PipelineError.of(ErrorKind.CONFIGURATION_ERROR,
                    "Selected engine is not in the registry: " + job.getDecision());
            store.terminateRemaining(batchId, ItemState.FAILED, error);
            return finish(batchId, error, false);
        }

        Map<String, Object> prepared = new HashMap<>(job.getProgress());
        Set<String> done = new HashSet<>(job.getCompletedStages());
        for (PipelineStage stage : PipelineStage.batchLevelPrefix()) {
            if (done.contains(stage.label())) {
                continue;
            }
            if (!clock.instant().isBefore(deadline)) {
                return timeOut(batchId, stage);
            }
            store.mergeJob(batchId, JobPatch.enterStage(stage));
            notifier.stageEntered(batchId, stage);
            Map<String, Object> out = preparation.run(stage, spec, items);
            JobPatch complete = JobPatch.completeStage(stage);
            for (Map.Entry<String, Object> e : out.entrySet()) {
                complete = complete.withProgress(e.getKey(), e.getValue());
            }
            store.mergeJob(batchId, complete);
            notifier.stageCompleted(batchId, stage);
            prepared.putAll(out);
        }

        store.mergeJob(batchId, JobPatch.enterStage(PipelineStage.VIDEO_DISPATCH));
        notifier.stageEntered(batchId, PipelineStage.VIDEO_DISPATCH);
        WindowProgress window = new WindowProgress(batchId, items, done);

        Map<?, ?> prompts = prepared.get("prompts") instanceof Map<?, ?> m ? m : Map.of();
        Map<String, Object> options = itemOptions(spec, prepared);
        int duration = spec.durationSeconds() != null ? spec.durationSeconds() : props.getDefaultDurationSec();

        List<Future<ItemState>> futures = new ArrayList<>();
        for (BatchItem item : items) {
            if (item.isTerminal()) {
                continue;
            }
            Object rewritten = prompts.get(String.valueOf(item.getId()));
            String prompt = rewritten != null ? rewritten.toString() : spec.prompt();
            ItemPipeline.ItemRun run = new ItemPipeline.ItemRun(batchId, engine.get(), prompt, duration,
                    spec.referenceImageRefsOrEmpty(), spec.sourceVideoRefsOrEmpty(), options, deadline, window);
            try {
                futures.add(itemExecutor.submit(() -> runItem(item, run)));
            } catch (TaskRejectedException e) {
                LOGGER.error("Item {} rejected by executor batch={}: {}", item.getId(), batchId, e.getMessage());
                failItem(item, run, PipelineError.of(ErrorKind.ENGINE_ERROR, "Item executor saturated").exhausted());
            }
        }

        if (!awaitAll(batchId, futures, deadline)) {
            futures.forEach(f -> f.cancel(true));
            return timeOut(batchId, null);
        }
        window.completeAll();
        return finish(batchId, null, true);
    }

    private ItemState runItem(BatchItem item, ItemPipeline.ItemRun run) {
        try {
            return itemPipeline.run(item, run);
        } catch (RuntimeException e) {
            LOGGER.error("Item {} crashed batch={}: {}", item.getId(), run.batchId(), e.toString(), e);
            failItem(item, run, PipelineError.of(ErrorKind.ENGINE_ERROR, String.valueOf(e.getMessage())).exhausted());
            return ItemState.FAILED;
        }
    }

    private void failItem(BatchItem item, ItemPipeline.ItemRun run, PipelineError error) {
        store.mergeItem(item.getId(), ItemPatch.failed(ItemState.FAILED, error))
                .ifPresent(updated -> notifier.itemChanged(run.batchId(), item.getId(), ItemState.FAILED,
                        updated.getRetryCount(), error));
        run.listener().passed(item.getId(), PipelineStage.URL_VALIDATE);
    }

    /**
     * @return {@code false} when the batch deadline passed before every item finished
     */
    private boolean awaitAll(UUID batchId, List<Future<ItemState>> futures, Instant deadline) {
        for (Future<ItemState> future : futures) {
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            if (remaining <= 0) {
                return future.isDone() && allDone(futures);
            }
            try {
                future.get(remaining, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                LOGGER.error("Item task failed batch={}: {}", batchId, String.valueOf(e.getCause()), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    private static boolean allDone(List<Future<ItemState>> futures) {
        return futures.stream().allMatch(Future::isDone);
    }

    private BatchStatus timeOut(UUID batchId, PipelineStage stage) {
        String where = stage == null ? "item window" : stage.label();
        PipelineError error = PipelineError.of(ErrorKind.TIMEOUT_ERROR,
                "Batch timeout of %ds exceeded during %s".formatted(props.getBatchTimeout().toSeconds(), where));
        int closed = store.terminateRemaining(batchId, ItemState.TIMED_OUT, error);
        LOGGER.warn("BATCH TIMEOUT batch={} stage={} itemsTimedOut={}", batchId, where, closed);
        return finish(batchId, error, false);
    }

    private BatchStatus finish(UUID batchId, PipelineError error, boolean markComplete) {
        List<BatchItem> items = store.listItems(batchId);
        int ready = 0;
        int failed = 0;
        int timedOut = 0;
        List<String> artifacts = new ArrayList<>();
        for (BatchItem item : items) {
            switch (item.getState()) {
                case READY -> {
                    ready++;
                    artifacts.add(item.getArtifactUrl());
                }
                case FAILED -> failed++;
                case TIMED_OUT -> timedOut++;
                default -> LOGGER.warn("Item {} not terminal at batch end state={}", item.getId(), item.getState());
            }
        }
        BatchStatus status = BatchStatus.aggregate(ready, items.size());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("ready", ready);
        summary.put("failed", failed);
        summary.put("timedOut", timedOut);
        summary.put("total", items.size());
        summary.put("validatedArtifactRefs", artifacts);

        Map<String, Object> progress = Map.of("summary", summary);
        JobPatch patch = markComplete
                ? new JobPatch(status, PipelineStage.COMPLETE, List.of(PipelineStage.COMPLETE), progress, null, false)
                : new JobPatch(status, null, List.of(), progress, error, false);
        store.mergeJob(batchId, patch);
        if (markComplete) {
            notifier.stageCompleted(batchId, PipelineStage.COMPLETE);
        }
        notifier.batchFinished(batchId, status, ready, items.size());
        return status;
    }

    private Optional<EngineDefinition> resolveEngine(BatchJob job) {
        Object id = job.getDecision() == null ? null : job.getDecision().get("engineId");
        return registry.getById(id == null ? null : String.valueOf(id));
    }

    private static Map<String, Object> itemOptions(BatchSpecRequest spec, Map<String, Object> prepared) {
        Map<String, Object> options = new LinkedHashMap<>();
        if (prepared.get("voice") instanceof Map<?, ?> voice && "prepared".equals(voice.get("status"))) {
            options.put("voice", voice);
        }
        if (spec.language() != null) options.put("language", spec.language());
        if (spec.platform() != null) options.put("platform", spec.platform());
        return options;
    }

    /**
     * Marks a window stage complete once every item is past it. Flags only ever move forward.
     */
    private final class WindowProgress implements ItemPipeline.StageListener {
        private final UUID batchId;
        private final Map<UUID, Integer> furthest = new HashMap<>();
        private final Set<PipelineStage> completed = EnumSet.noneOf(PipelineStage.class);

        WindowProgress(UUID batchId, List<BatchItem> items, Set<String> alreadyDone) {
            this.batchId = batchId;
            for (BatchItem item : items) {
                furthest.put(item.getId(), item.isTerminal() ? WINDOW.size() - 1 : -1);
            }
            for (PipelineStage stage : WINDOW) {
                if (alreadyDone.contains(stage.label())) {
                    completed.add(stage);
                }
            }
        }

        @Override
        public synchronized void passed(UUID itemId, PipelineStage stage) {
            int index = WINDOW.indexOf(stage);
            if (index < 0) {
                return;
            }
            furthest.merge(itemId, index, Math::max);
            int lowest = furthest.values().stream().mapToInt(Integer::intValue).min().orElse(WINDOW.size() - 1);
            markUpTo(lowest);
        }

        synchronized void completeAll() {
            markUpTo(WINDOW.size() - 1);
        }

        private void markUpTo(int lowest) {
            for (int i = 0; i <= lowest; i++) {
                PipelineStage stage = WINDOW.get(i);
                if (completed.add(stage)) {
                    JobPatch patch = JobPatch.completeStage(stage);
                    if (i + 1 < WINDOW.size()) {
                        patch = patch.withStage(WINDOW.get(i + 1));
                    }
                    store.mergeJob(batchId, patch);
                    notifier.stageCompleted(batchId, stage);
                    if (i + 1 < WINDOW.size()) {
                        notifier.stageEntered(batchId, WINDOW.get(i + 1));
                    }
                }
            }
        }
    }
}
