package com.example.renderflow_backend.dto.batch;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ItemState;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record BatchStatusResponse(
        UUID jobId,
        BatchStatus status,
        String currentStage,
        List<String> completedStages,
        int progressPercent,
        Map<UUID, ItemState> items,
        List<ItemView> itemDetails,
        List<String> validatedArtifactRefs,
        Map<UUID, PipelineError> errors,
        Counts counts,
        String engineId,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt,
        PipelineError batchError
) {
    public record Counts(int completed, int validated, int failed, int timedOut, int total) {}

    public record ItemView(UUID id, int ordinal, String ratio, ItemState state, String engineId, String artifactUrl,
                           int retryCount) {}
}
