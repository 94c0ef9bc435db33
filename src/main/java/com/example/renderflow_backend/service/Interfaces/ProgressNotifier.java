package com.example.renderflow_backend.service.Interfaces;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.util.BatchStatus;
import com.example.renderflow_backend.util.ItemState;
import com.example.renderflow_backend.util.PipelineStage;

import java.util.UUID;

public interface ProgressNotifier {
    void stageEntered(UUID batchId, PipelineStage stage);

    void stageCompleted(UUID batchId, PipelineStage stage);

    void itemChanged(UUID batchId, UUID itemId, ItemState state, int retryCount, PipelineError error);

    void batchFinished(UUID batchId, BatchStatus status, int ready, int total);
}
