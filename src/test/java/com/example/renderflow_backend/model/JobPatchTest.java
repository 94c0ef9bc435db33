package com.example.renderflow_backend.model;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ErrorKind;
import com.example.renderflow_backend.util.PipelineStage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobPatchTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void completedStagesOnlyGrowAndNeverDuplicate() {
        BatchJob job = new BatchJob(Map.of(), Map.of());
        JobPatch.completeStage(PipelineStage.DECONSTRUCT).applyTo(job, NOW);
        JobPatch.completeStage(PipelineStage.REWRITE).withStage(PipelineStage.VOICE_PREP).applyTo(job, NOW);
        JobPatch.completeStage(PipelineStage.DECONSTRUCT).applyTo(job, NOW);

        assertThat(job.getCompletedStages()).containsExactly("deconstruct", "rewrite");
        assertThat(job.getCurrentStage()).isEqualTo(PipelineStage.VOICE_PREP);
    }

    @Test
    void progressIsMergedKeyByKey() {
        BatchJob job = new BatchJob(Map.of(), Map.of());
        JobPatch.empty().withProgress("brief", "a").applyTo(job, NOW);
        JobPatch.empty().withProgress("voice", "skipped").applyTo(job, NOW);

        assertThat(job.getProgress()).containsEntry("brief", "a").containsEntry("voice", "skipped");
    }

    @Test
    void terminalStatusStampsFinishTimeAndFreezesTheJob() {
        BatchJob job = new BatchJob(Map.of(), Map.of());
        JobPatch.empty().withStatus(BatchStatus.RUNNING).started().applyTo(job, NOW);
        boolean failed = JobPatch.failure(PipelineError.of(ErrorKind.TIMEOUT_ERROR, "late")).applyTo(job, NOW);

        assertThat(failed).isTrue();
        assertThat(job.getStartedAt()).isEqualTo(NOW);
        assertThat(job.getFinishedAt()).isEqualTo(NOW);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.TIMEOUT_ERROR);

        boolean reopened = JobPatch.empty().withStatus(BatchStatus.RUNNING).applyTo(job, NOW.plusSeconds(5));
        assertThat(reopened).isFalse();
        assertThat(job.getStatus()).isEqualTo(BatchStatus.FAILED);
    }
}
