package com.example.renderflow_backend.model;

import com.example.renderflow_backend.exception.PipelineError;
import com.example.renderflow_backend.util.ItemState;

import java.time.Instant;

/**
 * Partial update of a {@link BatchItem}. {@code null} fields are left untouched.
 */
public record ItemPatch(
        ItemState state,
        String engineId,
        String taskHandle,
        String artifactUrl,
        Integer retryCount,
        PipelineError error,
        boolean clearError
) {

    public enum Outcome {
        APPLIED,
        /** The item is terminal and was left unchanged. */
        TERMINAL,
        /** The requested state is not reachable from the current one. */
        ILLEGAL_TRANSITION
    }

    public static ItemPatch to(ItemState state) {
        return new ItemPatch(state, null, null, null, null, null, false);
    }

    public static ItemPatch failed(ItemState terminal, PipelineError error) {
        return new ItemPatch(terminal, null, null, null, null, error, false);
    }

    public ItemPatch withEngine(String value) {
        return new ItemPatch(state, value, taskHandle, artifactUrl, retryCount, error, clearError);
    }

    public ItemPatch withTaskHandle(String value) {
        return new ItemPatch(state, engineId, value, artifactUrl, retryCount, error, clearError);
    }

    public ItemPatch withArtifactUrl(String value) {
        return new ItemPatch(state, engineId, taskHandle, value, retryCount, error, clearError);
    }

    public ItemPatch withRetryCount(int value) {
        return new ItemPatch(state, engineId, taskHandle, artifactUrl, value, error, clearError);
    }

    public ItemPatch withError(PipelineError value) {
        return new ItemPatch(state, engineId, taskHandle, artifactUrl, retryCount, value, false);
    }

    public ItemPatch clearingError() {
        return new ItemPatch(state, engineId, taskHandle, artifactUrl, retryCount, null, true);
    }

    public Outcome applyTo(BatchItem item, Instant now) {
        if (item.isTerminal()) {
            return Outcome.TERMINAL;
        }
        if (state != null && state != item.getState()) {
            if (!item.getState().canTransitionTo(state)) {
                return Outcome.ILLEGAL_TRANSITION;
            }
        }
        if (state != null) {
            if (state != item.getState() || state == ItemState.GENERATING) {
                item.setStageEnteredAt(now);
            }
            item.setState(state);
        }
        if (engineId != null) item.setEngineId(engineId);
        if (taskHandle != null) item.setTaskHandle(taskHandle);
        if (artifactUrl != null) item.setArtifactUrl(artifactUrl);
        if (retryCount != null) item.setRetryCount(retryCount);
        if (clearError) {
            item.recordError(null);
        } else if (error != null) {
            item.recordError(error);
        }
        return Outcome.APPLIED;
    }
}
