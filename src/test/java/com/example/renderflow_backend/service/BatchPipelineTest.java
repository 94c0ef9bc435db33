package com.example.renderflow_backend.service;

import com.example.renderflow_backend.config.EngineProperties;
import com.example.renderflow_backend.config.PipelineProperties;
import com.example.renderflow_backend.dto.batch.BatchSpecRequest;
import com.example.renderflow_backend.dto.batch.BatchStatusResponse;
import com.example.renderflow_backend.engine.registry.CapabilityRegistry;
import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.model.BatchItem;
import com.example.renderflow_backend.model.BatchJob;
import com.example.renderflow_backend.model.ItemPatch;
import com.example.renderflow_backend.model.JobPatch;
import com.example.renderflow_backend.service.Interfaces.ProgressNotifier;
import com.example.renderflow_backend.service.decision.DecisionScorer;
import com.example.renderflow_backend.service.decision.EnvironmentSnapshot;
import com.example.renderflow_backend.service.decision.LocalFirstPolicy;
import com.example.renderflow_backend.service.decision.ScoringWeights;
import com.example.renderflow_backend.testutil.InMemoryBatchJobStore;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.ItemState;
import com.example.renderflow_backend.util.PipelineStage;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BatchPipelineTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private InMemoryBatchJobStore store;
    private ItemPipeline itemPipeline;
    private ProgressNotifier notifier;
    private ContentPreparationService preparation;
    private PipelineProperties props;
    private BatchPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new InMemoryBatchJobStore();
        itemPipeline = mock(ItemPipeline.class);
        notifier = mock(ProgressNotifier.class);
        preparation = spy(new ContentPreparationService());
        props = new PipelineProperties();
        pipeline = new BatchPipeline(store, preparation, itemPipeline, CapabilityRegistry.withDefaults(), notifier,
                props, mapper, Clock.systemUTC(), new SimpleAsyncTaskExecutor("item-"));
    }

    private BatchJob queue(String engineId, int variations, List<String> ratios) {
        BatchSpecRequest spec = new BatchSpecRequest("sneaker ad on a rooftop", null, null, null, variations, ratios,
                null, null, null, 8, "US", "en", "tiktok", null, null);
        Map<String, Object> specMap = mapper.convertValue(spec, new TypeReference<>() {});
        Map<String, Object> decision = engineId == null ? Map.of() : Map.of("engineId", engineId);
        List<BatchItem> items = new ArrayList<>();
        int ordinal = 0;
        for (int v = 0; v < variations; v++) {
            for (String ratio : ratios) {
                items.add(new BatchItem(null, ordinal++, ratio));
            }
        }
        UUID id = store.insert(new BatchJob(specMap, decision), items);
        return store.claimQueued(1).stream().filter(j -> j.getId().equals(id)).findFirst().orElseThrow();
    }

    private void outcome(Function<BatchItem, ItemState> byItem) {
        when(itemPipeline.run(any(), any())).thenAnswer(inv -> {
            BatchItem item = inv.getArgument(0);
            ItemState target = byItem.apply(item);
            if (target == ItemState.READY) {
                for (ItemState step : List.of(ItemState.GENERATING, ItemState.ENCODING, ItemState.UPLOADING,
                        ItemState.VALIDATING_URL)) {
                    store.mergeItem(item.getId(), ItemPatch.to(step));
                }
                store.mergeItem(item.getId(), ItemPatch.to(ItemState.READY)
                        .withArtifactUrl("storage://out/" + item.getOrdinal() + ".mp4"));
            } else {
                store.mergeItem(item.getId(), ItemPatch.failed(target,
                        PipelineError.of(ErrorKind.ENGINE_ERROR, "provider 500").exhausted()));
            }
            return target;
        });
    }

    @Test
    void allItemsReadyCompletesBatchWithEveryStage() {
        BatchJob job = queue("nanobanana", 2, List.of("9:16"));
        outcome(item -> ItemState.READY);

        BatchStatus status = pipeline.run(job);

        assertThat(status).isEqualTo(BatchStatus.COMPLETED);
        BatchJob done = store.findJob(job.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(done.getCurrentStage()).isEqualTo(PipelineStage.COMPLETE);
        assertThat(done.getCompletedStages()).containsExactly(Arrays.stream(PipelineStage.values())
                .map(PipelineStage::label).toArray(String[]::new));
        assertThat(done.getFinishedAt()).isNotNull();
        assertThat(done.getProgress()).containsKeys("brief", "prompts", "voice", "summary");
        verify(notifier).batchFinished(job.getId(), BatchStatus.COMPLETED, 2, 2);
    }

    @Test
    void mixedOutcomesArePartial() {
        BatchJob job = queue("nanobanana", 2, List.of("9:16", "1:1"));
        outcome(item -> item.getOrdinal() % 2 == 0 ? ItemState.READY : ItemState.FAILED);

        assertThat(pipeline.run(job)).isEqualTo(BatchStatus.PARTIAL);

        List<BatchItem> items = store.listItems(job.getId());
        assertThat(items).extracting(BatchItem::getState)
                .containsExactly(ItemState.READY, ItemState.FAILED, ItemState.READY, ItemState.FAILED);
        @SuppressWarnings("unchecked")
        Map<String, Object> summary = (Map<String, Object>) store.findJob(job.getId()).orElseThrow()
                .getProgress().get("summary");
        assertThat(summary).containsEntry("ready", 2).containsEntry("failed", 2).containsEntry("total", 4);
        assertThat((List<?>) summary.get("validatedArtifactRefs")).hasSize(2);
    }

    @Test
    void noSuccessesFailsBatch() {
        BatchJob job = queue("nanobanana", 3, List.of("9:16"));
        outcome(item -> ItemState.FAILED);

        assertThat(pipeline.run(job)).isEqualTo(BatchStatus.FAILED);
        assertThat(store.findJob(job.getId()).orElseThrow().getStatus()).isEqualTo(BatchStatus.FAILED);
    }

    @Test
    void itemsAreDispatchedWithRewrittenPrompts() {
        BatchJob job = queue("nanobanana", 2, List.of("9:16"));
        outcome(item -> ItemState.READY);

        pipeline.run(job);

        ArgumentCaptor<ItemPipeline.ItemRun> runs = ArgumentCaptor.forClass(ItemPipeline.ItemRun.class);
        verify(itemPipeline, times(2)).run(any(), runs.capture());
        assertThat(runs.getAllValues()).extracting(ItemPipeline.ItemRun::prompt)
                .allSatisfy(p -> assertThat(p).startsWith("sneaker ad on a rooftop | variation"))
                .doesNotHaveDuplicates();
        assertThat(runs.getAllValues()).allSatisfy(r -> {
            assertThat(r.engine().id()).isEqualTo("nanobanana");
            assertThat(r.durationSec()).isEqualTo(8);
            assertThat(r.options()).containsEntry("language", "en");
        });
    }

    @Test
    void hardTimeoutClosesOutstandingItems() {
        props.setBatchTimeout(Duration.ofMillis(400));
        BatchJob job = queue("nanobanana", 2, List.of("9:16"));
        when(itemPipeline.run(any(), any())).thenAnswer(inv -> {
            BatchItem item = inv.getArgument(0);
            if (item.getOrdinal() == 0) {
                store.mergeItem(item.getId(), ItemPatch.to(ItemState.GENERATING));
                store.mergeItem(item.getId(), ItemPatch.to(ItemState.ENCODING));
                store.mergeItem(item.getId(), ItemPatch.to(ItemState.UPLOADING));
                store.mergeItem(item.getId(), ItemPatch.to(ItemState.VALIDATING_URL));
                store.mergeItem(item.getId(), ItemPatch.to(ItemState.READY).withArtifactUrl("storage://out/0.mp4"));
                return ItemState.READY;
            }
            store.mergeItem(item.getId(), ItemPatch.to(ItemState.GENERATING));
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ItemState.GENERATING;
        });

        BatchStatus status = pipeline.run(job);

        assertThat(status).isEqualTo(BatchStatus.PARTIAL);
        List<BatchItem> items = store.listItems(job.getId());
        assertThat(items.get(0).getState()).isEqualTo(ItemState.READY);
        assertThat(items.get(1).getState()).isEqualTo(ItemState.TIMED_OUT);
        assertThat(items.get(1).lastError().kind()).isEqualTo(ErrorKind.TIMEOUT_ERROR);
        BatchJob done = store.findJob(job.getId()).orElseThrow();
        assertThat(done.getErrorKind()).isEqualTo(ErrorKind.TIMEOUT_ERROR);
        assertThat(done.getCompletedStages()).doesNotContain(PipelineStage.COMPLETE.label());
    }

    @Test
    void unknownEngineFailsEveryItemWithConfigurationError() {
        BatchJob job = queue("retired-engine", 2, List.of("9:16"));

        assertThat(pipeline.run(job)).isEqualTo(BatchStatus.FAILED);

        assertThat(store.listItems(job.getId())).allSatisfy(item -> {
            assertThat(item.getState()).isEqualTo(ItemState.FAILED);
            assertThat(item.lastError().kind()).isEqualTo(ErrorKind.CONFIGURATION_ERROR);
        });
        verifyNoInteractions(itemPipeline);
    }

    @Test
    void resumedBatchSkipsCompletedStagesAndFinishedItems() {
        BatchJob job = queue("nanobanana", 2, List.of("9:16"));
        store.mergeJob(job.getId(), JobPatch.completeStage(PipelineStage.DECONSTRUCT));
        BatchItem first = store.listItems(job.getId()).get(0);
        store.mergeItem(first.getId(), ItemPatch.failed(ItemState.FAILED,
                PipelineError.of(ErrorKind.ENGINE_ERROR, "earlier run").exhausted()));
        outcome(item -> ItemState.READY);

        BatchStatus status = pipeline.run(store.findJob(job.getId()).orElseThrow());

        assertThat(status).isEqualTo(BatchStatus.PARTIAL);
        verify(preparation, never()).run(eq(PipelineStage.DECONSTRUCT), any(), any());
        verify(itemPipeline, times(1)).run(any(), any());
    }

    private BatchStatusResponse statusOf(UUID jobId) {
        CapabilityRegistry registry = CapabilityRegistry.withDefaults();
        BatchOrchestrator orchestrator = new BatchOrchestrator(store,
                new DecisionScorer(registry, new LocalFirstPolicy(registry), ScoringWeights.defaults()),
                EnvironmentSnapshot::unavailable, new AsyncTaskTracker(), props, new EngineProperties(), mapper);
        return orchestrator.getStatus(jobId);
    }

    @Test
    void threeValidatedAndTwoExhaustedOfFiveIsPartialWithTwoErrors() {
        BatchJob job = queue("nanobanana", 5, List.of("9:16"));
        outcome(item -> item.getOrdinal() < 3 ? ItemState.READY : ItemState.FAILED);

        assertThat(pipeline.run(job)).isEqualTo(BatchStatus.PARTIAL);

        BatchStatusResponse status = statusOf(job.getId());
        assertThat(status.status()).isEqualTo(BatchStatus.PARTIAL);
        assertThat(status.validatedArtifactRefs()).hasSize(3);
        assertThat(status.errors()).hasSize(2)
                .allSatisfy((id, error) -> assertThat(error.kind()).isEqualTo(ErrorKind.ENGINE_ERROR));
        List<BatchItem> items = store.listItems(job.getId());
        assertThat(status.errors()).containsOnlyKeys(items.get(3).getId(), items.get(4).getId());
    }

    @Test
    void timeoutWithTwoOfFiveStillGeneratingTimesOutExactlyThoseTwo() {
        props.setBatchTimeout(Duration.ofMillis(500));
        BatchJob job = queue("nanobanana", 5, List.of("9:16"));
        when(itemPipeline.run(any(), any())).thenAnswer(inv -> {
            BatchItem item = inv.getArgument(0);
            if (item.getOrdinal() < 3) {
                for (ItemState step : List.of(ItemState.GENERATING, ItemState.ENCODING, ItemState.UPLOADING,
                        ItemState.VALIDATING_URL)) {
                    store.mergeItem(item.getId(), ItemPatch.to(step));
                }
                store.mergeItem(item.getId(), ItemPatch.to(ItemState.READY)
                        .withArtifactUrl("storage://out/" + item.getOrdinal() + ".mp4"));
                return ItemState.READY;
            }
            store.mergeItem(item.getId(), ItemPatch.to(ItemState.GENERATING));
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ItemState.GENERATING;
        });

        BatchStatus status = pipeline.run(job);

        assertThat(status).isEqualTo(BatchStatus.PARTIAL);
        assertThat(store.findJob(job.getId()).orElseThrow().getStatus().isTerminal()).isTrue();
        assertThat(store.listItems(job.getId())).extracting(BatchItem::getState)
                .containsExactly(ItemState.READY, ItemState.READY, ItemState.READY,
                        ItemState.TIMED_OUT, ItemState.TIMED_OUT);
        assertThat(statusOf(job.getId()).errors()).hasSize(2)
                .allSatisfy((id, error) -> assertThat(error.kind()).isEqualTo(ErrorKind.TIMEOUT_ERROR));
    }
}
