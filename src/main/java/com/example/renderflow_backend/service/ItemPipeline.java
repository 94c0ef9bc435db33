package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.PipelineProperties;
import com.example.renderflow_backend.engine.GenerationEngineRouter;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.Submission;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.TaskStatus;
import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.ItemPatch;
import com.example.renderflow_backend.service.Interfaces.ArtifactStorage;
import com.example.renderflow_backend.service.Interfaces.BatchJobStore;
import com.example.renderflow_backend.service.Interfaces.ProgressNotifier;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.ItemState;
import com.example.renderflow_backend.util.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one item from QUEUED to a terminal state.
 * <p>
 * Each attempt runs the whole chain: generate, post-process, check the produced artifact, upload, then check
 * the stored URL. A retryable failure (ENGINE_ERROR, ARTIFACT_ERROR) re-dispatches generation after an
 * exponential backoff until the attempt budget is spent; a TIMEOUT_ERROR ends the item as TIMED_OUT, any other error as FAILED.
 */
@Service
public class ItemPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(ItemPipeline.class);

    /** Receives the furthest window stage an item has got past. */
    @FunctionalInterface
    public interface StageListener {
        void passed(UUID itemId, PipelineStage stage);
    }

    public record ItemRun(UUID batchId,
                          EngineDefinition engine,
                          String prompt,
                          int durationSec,
                          List<String> referenceImageRefs,
                          List<String> sourceVideoRefs,
                          Map<String, Object> options,
                          Instant deadline,
                          StageListener listener) {
    }

    private final BatchJobStore store;
    private final GenerationEngineRouter engines;
    private final AsyncTaskTracker tasks;
    private final ItemPostProcessor postProcessor;
    private final ArtifactStorage storage;
    private final ArtifactValidator validator;
    private final ProgressNotifier notifier;
    private final PipelineProperties props;
    private final Clock clock;

    public ItemPipeline(BatchJobStore store, GenerationEngineRouter engines, AsyncTaskTracker tasks,
                        ItemPostProcessor postProcessor, ArtifactStorage storage, ArtifactValidator validator,
                        ProgressNotifier notifier, PipelineProperties props, Clock clock) {
        this.store = store;
        this.engines = engines;
        this.tasks = tasks;
        this.postProcessor = postProcessor;
        this.storage = storage;
        this.validator = validator;
        this.notifier = notifier;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @return the terminal state reached, or the state the item was left in when another writer finished it
     */
    public ItemState run(BatchItem item, ItemRun run) {
        int maxAttempts = Math.max(1, props.getMaxAttempts());
        PipelineError last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int retries = attempt - 1;
            if (retries > 0 && !backoff(retries, run.deadline())) {
                return finish(item, run, ItemState.TIMED_OUT,
                        PipelineError.of(ErrorKind.TIMEOUT_ERROR, "Batch deadline reached before retry"), retries);
            }

            Optional<BatchItem> started = store.mergeItem(item.getId(), ItemPatch.to(ItemState.GENERATING)
                    .withEngine(run.engine().id())
                    .withRetryCount(retries));
            if (started.isEmpty()) {
                return currentState(item);
            }
            notifier.itemChanged(run.batchId(), item.getId(), ItemState.GENERATING, retries, null);

            try {
                String artifact = attempt(item, run);
                Optional<BatchItem> ready = store.mergeItem(item.getId(), ItemPatch.to(ItemState.READY)
                        .withArtifactUrl(artifact)
                        .clearingError());
                if (ready.isEmpty()) {
                    return currentState(item);
                }
                run.listener().passed(item.getId(), PipelineStage.URL_VALIDATE);
                notifier.itemChanged(run.batchId(), item.getId(), ItemState.READY, retries, null);
                return ItemState.READY;
            } catch (PipelineException e) {
                last = e.getError();
            } catch (RuntimeException e) {
                LOGGER.error("Item {} attempt={} unexpected failure: {}", item.getId(), attempt, e.toString(), e);
                last = PipelineError.of(ErrorKind.ENGINE_ERROR, String.valueOf(e.getMessage()));
            }

            if (last.kind() == ErrorKind.TIMEOUT_ERROR) {
                return finish(item, run, ItemState.TIMED_OUT, last, retries);
            }
            if (!last.retryable()) {
                return finish(item, run, ItemState.FAILED, last, retries);
            }
            LOGGER.warn("Item {} attempt={}/{} failed kind={} message={}", item.getId(), attempt, maxAttempts,
                    last.kind(), last.message());
            if (store.mergeItem(item.getId(), new ItemPatch(null, null, null, null, null, last, false)).isEmpty()) {
                return currentState(item);
            }
            notifier.itemChanged(run.batchId(), item.getId(), currentState(item), retries, last);
        }

        return finish(item, run, ItemState.FAILED, last.exhausted(), maxAttempts - 1);
    }

    private String attempt(BatchItem item, ItemRun run) {
        String generated = generate(item, run);
        run.listener().passed(item.getId(), PipelineStage.VIDEO_DISPATCH);

        advance(item, run, ItemState.ENCODING);
        String processed = generated;
        for (PipelineStage step : PipelineStage.encodingSteps()) {
            checkDeadline(run, step);
            processed = postProcessor.apply(step, item.getId(), processed, item.getRatio(), run.options());
            run.listener().passed(item.getId(), step);
        }

        advance(item, run, ItemState.UPLOADING);
        checkDeadline(run, PipelineStage.UPLOAD);
        if (!validator.validate(processed)) {
            throw PipelineException.artifact("Produced artifact failed validation: " + processed);
        }
        String stored = storage.upload(run.batchId(), item.getId(), processed);
        run.listener().passed(item.getId(), PipelineStage.UPLOAD);

        advance(item, run, ItemState.VALIDATING_URL);
        store.mergeItem(item.getId(), new ItemPatch(null, null, null, stored, null, null, false));
        if (!validator.validate(stored)) {
            throw PipelineException.artifact("Stored artifact failed validation: " + stored);
        }
        return stored;
    }

    private String generate(BatchItem item, ItemRun run) {
        Instant stageDeadline = earliest(clock.instant().plus(props.getStageTimeout()), run.deadline());
        GenerationEngine engine = engines.forEngine(run.engine());
        Submission submission = engine.submit(new GenerationEngine.Request(run.batchId(), item.getId(), run.engine(),
                run.prompt(), item.getRatio(), run.durationSec(), run.referenceImageRefs(), run.sourceVideoRefs(),
                run.options()));

        if (submission instanceof Submission.Completed completed) {
            return completed.artifactUrl();
        }
        String handle = ((Submission.Pending) submission).taskHandle();
        tasks.expect(handle);
        store.mergeItem(item.getId(), new ItemPatch(null, null, handle, null, null, null, false));
        try {
            return awaitTask(engine, run.engine(), handle, stageDeadline);
        } finally {
            tasks.forget(handle);
        }
    }

    private String awaitTask(GenerationEngine engine, EngineDefinition definition, String handle, Instant stageDeadline) {
        while (true) {
            Duration remaining = Duration.between(clock.instant(), stageDeadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw PipelineException.timeout("Generation task %s exceeded the stage timeout".formatted(handle));
            }
            Duration wait = remaining.compareTo(props.getPollInterval()) < 0 ? remaining : props.getPollInterval();
            Optional<TaskStatus> pushed;
            try {
                pushed = tasks.await(handle, wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw PipelineException.timeout("Interrupted while waiting for task " + handle);
            }
            TaskStatus status = pushed.orElseGet(() -> engine.poll(definition, handle));
            switch (status.state()) {
                case SUCCEEDED -> {
                    return status.artifactUrl();
                }
                case FAILED -> throw PipelineException.engine(
                        "Engine %s task %s failed: %s".formatted(definition.id(), handle, status.error()), null);
                case PENDING -> LOGGER.debug("Task {} still pending engine={}", handle, definition.id());
            }
        }
    }

    private void advance(BatchItem item, ItemRun run, ItemState state) {
        Optional<BatchItem> moved = store.mergeItem(item.getId(), ItemPatch.to(state));
        if (moved.isEmpty()) {
            // finished elsewhere (batch timeout); stop this attempt without retrying
            throw PipelineException.timeout("Item " + item.getId() + " was closed while " + state);
        }
        notifier.itemChanged(run.batchId(), item.getId(), state, moved.get().getRetryCount(), null);
    }

    private void checkDeadline(ItemRun run, PipelineStage stage) {
        if (!clock.instant().isBefore(run.deadline())) {
            throw PipelineException.timeout("Batch deadline reached before " + stage.label());
        }
    }

    private ItemState finish(BatchItem item, ItemRun run, ItemState terminal, PipelineError error, int retries) {
        Optional<BatchItem> done = store.mergeItem(item.getId(), ItemPatch.failed(terminal, error).withRetryCount(retries));
        if (done.isEmpty()) {
            return currentState(item);
        }
        run.listener().passed(item.getId(), PipelineStage.URL_VALIDATE);
        notifier.itemChanged(run.batchId(), item.getId(), terminal, retries, error);
        return terminal;
    }

    private ItemState currentState(BatchItem item) {
        return store.findItem(item.getId()).map(BatchItem::getState).orElse(item.getState());
    }

    /**
     * Sleeps before retry number {@code retry}.
     *
     * @return {@code false} when the batch deadline would pass first or the thread was interrupted
     */
    private boolean backoff(int retry, Instant deadline) {
        Duration delay = props.backoffFor(retry);
        if (!clock.instant().plus(delay).isBefore(deadline)) {
            return false;
        }
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
