package com.example.renderflow_backend.model;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.PipelineStage;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial update of a {@link BatchJob}. Completed stages only ever grow; progress entries are merged key by
 * key.
 */
public record JobPatch(
        BatchStatus status,
        PipelineStage currentStage,
        List<PipelineStage> completedStages,
        Map<String, Object> progress,
        PipelineError error,
        boolean markStarted
) {

    public JobPatch {
        completedStages = completedStages == null ? List.of() : List.copyOf(completedStages);
        progress = progress == null ? Map.of() : Map.copyOf(progress);
    }

    public static JobPatch empty() {
        return new JobPatch(null, null, List.of(), Map.of(), null, false);
    }

    public static JobPatch enterStage(PipelineStage stage) {
        return empty().withStage(stage);
    }

    public static JobPatch completeStage(PipelineStage stage) {
        return new JobPatch(null, null, List.of(stage), Map.of(), null, false);
    }

    public static JobPatch failure(PipelineError error) {
        return new JobPatch(BatchStatus.FAILED, null, List.of(), Map.of(), error, false);
    }

    public JobPatch withStage(PipelineStage stage) {
        return new JobPatch(status, stage, completedStages, progress, error, markStarted);
    }

    public JobPatch withStatus(BatchStatus value) {
        return new JobPatch(value, currentStage, completedStages, progress, error, markStarted);
    }

    public JobPatch withProgress(String key, Object value) {
        Map<String, Object> merged = new HashMap<>(progress);
        merged.put(key, value);
        return new JobPatch(status, currentStage, completedStages, merged, error, markStarted);
    }

    public JobPatch started() {
        return new JobPatch(status, currentStage, completedStages, progress, error, true);
    }

    /**
     * @return {@code false} when the job is already terminal and was left unchanged
     */
    public boolean applyTo(BatchJob job, Instant now) {
        if (job.getStatus() != null && job.getStatus().isTerminal()) {
            return false;
        }
        if (status != null) {
            job.setStatus(status);
            if (status.isTerminal() && job.getFinishedAt() == null) {
                job.setFinishedAt(now);
            }
        }
        if (currentStage != null) job.setCurrentStage(currentStage);
        for (PipelineStage stage : completedStages) {
            if (!job.getCompletedStages().contains(stage.label())) {
                job.getCompletedStages().add(stage.label());
            }
        }
        if (!progress.isEmpty()) {
            Map<String, Object> merged = new HashMap<>(job.getProgress());
            merged.putAll(progress);
            job.setProgress(merged);
        }
        if (error != null) {
            job.setErrorKind(error.kind());
            job.setErrorMessage(error.message());
        }
        if (markStarted && job.getStartedAt() == null) {
            job.setStartedAt(now);
        }
        return true;
    }
}
