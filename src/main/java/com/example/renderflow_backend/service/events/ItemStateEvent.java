package com.example.renderflow_backend.service.events;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.util.ItemState;

import java.time.Instant;
import java.util.UUID;

/**
 * @param error last error, {@code null} on success transitions
 */
public record ItemStateEvent(UUID batchId, UUID itemId, ItemState state, int retryCount, PipelineError error,
                             Instant at) {
}
