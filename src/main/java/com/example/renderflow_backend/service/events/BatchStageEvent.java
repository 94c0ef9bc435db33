package com.example.renderflow_backend.service.events;

import com.example.renderflow_backend.util.PipelineStage;

import java.time.Instant;
import java.util.UUID;

public record BatchStageEvent(UUID batchId, PipelineStage stage, Phase phase, Instant at) {
    public enum Phase { ENTERED, COMPLETED }
}
