package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.EngineProperties;
import com.example.renderflow_backend.config.PipelineProperties;
import com.example.renderflow_backend.dto.batch.BatchSpecRequest;
import com.example.renderflow_backend.dto.batch.BatchStatusResponse;
import com.example.renderflow_backend.dto.batch.BatchSubmitResponse;
import com.example.renderflow_backend.dto.engine.EngineCallbackRequest;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.TaskStatus;
import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.exception.PipelineException;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.model.ItemPatch;
import com.example.renderflow_backend.model.JobPatch;
import com.example.renderflow_backend.service.Interfaces.EnvironmentProbe;
import com.example.renderflow_backend.service.decision.DecisionScorer;
import com.example.renderflow_backend.service.decision.EnvironmentSnapshot;
import com.example.renderflow_backend.service.decision.LocalFirstPolicy;
import com.example.renderflow_backend.service.decision.ScoringWeights;
import com.example.renderflow_backend.testutil.InMemoryBatchJobStore;
import com.example.renderflow_backend.util.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchOrchestratorTest {

    private InMemoryBatchJobStore store;
    private AsyncTaskTracker tasks;
    private PipelineProperties props;
    private BatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryBatchJobStore();
        tasks = new AsyncTaskTracker();
        props = new PipelineProperties();
        CapabilityRegistry registry = CapabilityRegistry.withDefaults();
        DecisionScorer scorer = new DecisionScorer(registry, new LocalFirstPolicy(registry), ScoringWeights.defaults());
        EnvironmentProbe probe = EnvironmentSnapshot::unavailable;
        orchestrator = new BatchOrchestrator(store, scorer, probe, tasks, props, new EngineProperties(),
                new ObjectMapper().findAndRegisterModules());
    }

    private static BatchSpecRequest spec(String prompt, Integer variations, List<String> ratios, Integer duration) {
        return new BatchSpecRequest(prompt, null, null, null, variations, ratios, null, null, null, duration,
                null, "en", "tiktok", null, null);
    }

    @Test
    void submitPersistsOneItemPerVariationAndRatio() {
        BatchSubmitResponse response = orchestrator.submit(spec("summer sale", 3, List.of("9:16", "1:1"), 8));

        assertThat(response.status()).isEqualTo(BatchStatus.QUEUED);
        assertThat(response.itemCount()).isEqualTo(6);
        assertThat(response.engineId()).isEqualTo("nanobanana");

        List<BatchItem> items = store.listItems(response.jobId());
        assertThat(items).extracting(BatchItem::getOrdinal).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(items).extracting(BatchItem::getRatio)
                .containsExactly("9:16", "1:1", "9:16", "1:1", "9:16", "1:1");
        assertThat(items).allSatisfy(item -> {
            assertThat(item.getState()).isEqualTo(ItemState.QUEUED);
            assertThat(item.getBatchId()).isEqualTo(response.jobId());
        });

        BatchJob job = store.findJob(response.jobId()).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(BatchStatus.QUEUED);
        assertThat(job.getSpec()).containsEntry("prompt", "summer sale");
        assertThat(job.getDecision()).containsEntry("engineId", "nanobanana");
    }

    @Test
    void ratiosDefaultAndDuplicatesCollapse() {
        BatchSubmitResponse defaulted = orchestrator.submit(spec("promo", 2, null, null));
        BatchSubmitResponse deduped = orchestrator.submit(spec("promo", 1, List.of("1:1", " 1:1 ", "16:9"), null));

        assertThat(store.listItems(defaulted.jobId())).extracting(BatchItem::getRatio)
                .containsExactly("9:16", "9:16");
        assertThat(store.listItems(deduped.jobId())).extracting(BatchItem::getRatio)
                .containsExactly("1:1", "16:9");
    }

    @Test
    void invalidSpecsAreRejectedWithoutPersisting() {
        props.setMaxVariations(4);

        assertValidationError(null);
        assertValidationError(spec("promo", 0, null, null));
        assertValidationError(spec("  ", 1, null, null));
        assertValidationError(spec("promo", 1, List.of("portrait"), null));
        assertValidationError(spec("promo", 3, List.of("9:16", "1:1"), null));
        assertValidationError(spec("promo", 1, null, 0));

        assertThat(store.claimQueued(10)).isEmpty();
    }

    private void assertValidationError(BatchSpecRequest spec) {
        assertThatThrownBy(() -> orchestrator.submit(spec))
                .isInstanceOf(PipelineException.class)
                .extracting(e -> ((PipelineException) e).getKind())
                .isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    void sourceReferencesAloneAreEnoughInput() {
        BatchSpecRequest fromSources = new BatchSpecRequest(null, List.of("storage://ads/ref.mp4"), null, null, 1,
                null, null, null, null, null, null, null, null, null, null);

        assertThat(orchestrator.submit(fromSources).itemCount()).isEqualTo(1);
    }

    @Test
    void configurationErrorFromSelectionPersistsNothing() {
        DecisionScorer failing = mock(DecisionScorer.class);
        when(failing.selectEngine(any())).thenThrow(PipelineException.configuration("No engine available"));
        BatchOrchestrator withoutEngines = new BatchOrchestrator(store, failing, EnvironmentSnapshot::unavailable,
                tasks, props, new EngineProperties(), new ObjectMapper());

        assertThatThrownBy(() -> withoutEngines.submit(spec("promo", 2, null, null)))
                .isInstanceOf(PipelineException.class)
                .extracting(e -> ((PipelineException) e).getKind())
                .isEqualTo(ErrorKind.CONFIGURATION_ERROR);
        assertThat(store.claimQueued(10)).isEmpty();
    }

    @Test
    void statusReportsCountsErrorsAndProgress() {
        UUID id = orchestrator.submit(spec("promo", 1, List.of("9:16", "1:1"), null)).jobId();
        store.mergeJob(id, JobPatch.completeStage(PipelineStage.DECONSTRUCT));
        store.mergeJob(id, JobPatch.completeStage(PipelineStage.REWRITE).withStage(PipelineStage.VOICE_PREP));
        List<BatchItem> items = store.listItems(id);
        store.mergeItem(items.get(1).getId(), ItemPatch.failed(ItemState.FAILED,
                PipelineError.of(ErrorKind.ENGINE_ERROR, "provider 500").exhausted()));

        BatchStatusResponse status = orchestrator.getStatus(id);

        assertThat(status.status()).isEqualTo(BatchStatus.QUEUED);
        assertThat(status.currentStage()).isEqualTo("voice-prep");
        assertThat(status.completedStages()).containsExactly("deconstruct", "rewrite");
        // (2/11 * 0.5 + 1/2 * 0.5) * 100
        assertThat(status.progressPercent()).isEqualTo(34);
        assertThat(status.counts()).isEqualTo(new BatchStatusResponse.Counts(1, 0, 1, 0, 2));
        assertThat(status.items()).containsEntry(items.get(0).getId(), ItemState.QUEUED)
                .containsEntry(items.get(1).getId(), ItemState.FAILED);
        assertThat(status.errors()).containsOnlyKeys(items.get(1).getId());
        assertThat(status.errors().get(items.get(1).getId()).retryable()).isFalse();
        assertThat(status.validatedArtifactRefs()).isEmpty();
        assertThat(status.engineId()).isEqualTo("nanobanana");
        assertThat(status.batchError()).isNull();
    }

    @Test
    void terminalBatchReportsFullProgressAndBatchError() {
        UUID id = orchestrator.submit(spec("promo", 1, null, null)).jobId();
        store.terminateRemaining(id, ItemState.TIMED_OUT, PipelineError.of(ErrorKind.TIMEOUT_ERROR, "late"));
        store.mergeJob(id, JobPatch.failure(PipelineError.of(ErrorKind.TIMEOUT_ERROR, "Batch timeout exceeded")));

        BatchStatusResponse status = orchestrator.getStatus(id);

        assertThat(status.status()).isEqualTo(BatchStatus.FAILED);
        assertThat(status.progressPercent()).isEqualTo(100);
        assertThat(status.counts().timedOut()).isEqualTo(1);
        assertThat(status.batchError().kind()).isEqualTo(ErrorKind.TIMEOUT_ERROR);
    }

    @Test
    void unknownBatchIsNotFound() {
        assertThatThrownBy(() -> orchestrator.getStatus(UUID.randomUUID()))
                .isInstanceOf(ResponseStatusException.class)
                .extracting(e -> ((ResponseStatusException) e).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void callbackResolvesWaitingTask() throws InterruptedException {
        UUID id = orchestrator.submit(spec("promo", 1, null, null)).jobId();
        BatchItem item = store.listItems(id).get(0);
        store.mergeItem(item.getId(), ItemPatch.to(ItemState.GENERATING).withTaskHandle("task-42"));
        tasks.expect("task-42");

        boolean accepted = orchestrator.resolveTask(
                new EngineCallbackRequest("task-42", "kling_standard", "completed", "https://cdn/v.mp4", null));

        assertThat(accepted).isTrue();
        Optional<TaskStatus> pushed = tasks.await("task-42", Duration.ofMillis(50));
        assertThat(pushed).contains(TaskStatus.succeeded("https://cdn/v.mp4"));
    }

    @Test
    void lateCallbackForKnownItemIsAcknowledgedWithoutRetainingIt() {
        UUID id = orchestrator.submit(spec("promo", 1, null, null)).jobId();
        BatchItem item = store.listItems(id).get(0);
        store.mergeItem(item.getId(), ItemPatch.to(ItemState.GENERATING).withTaskHandle("task-43"));

        boolean accepted = orchestrator.resolveTask(
                new EngineCallbackRequest("task-43", "kling_standard", "completed", "https://cdn/v.mp4", null));

        assertThat(accepted).isTrue();
        assertThat(tasks.tracked()).isZero();
    }

    @Test
    void callbackForUnknownHandleIsRefused() {
        assertThat(orchestrator.resolveTask(new EngineCallbackRequest("nope", null, "completed", "u", null)))
                .isFalse();
    }
}
