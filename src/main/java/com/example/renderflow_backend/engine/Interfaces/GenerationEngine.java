package com.example.renderflow_backend.engine.Interfaces;

import com.example.renderflow_backend.engine.registry.EngineDefinition;
import com.example.renderflow_backend.exception.PipelineException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One HTTP call per (item, engine). The engine either answers with the artifact directly or hands back a
 * task handle that is later resolved by {@link #poll} or by the completion webhook.
 */
public interface GenerationEngine {
    record Request(UUID batchId,
                   UUID itemId,
                   EngineDefinition engine,
                   String prompt,
                   String ratio,
                   int durationSec,
                   List<String> referenceImageRefs,
                   List<String> sourceVideoRefs,
                   Map<String, Object> options) {
        public Request {
            referenceImageRefs = referenceImageRefs == null ? List.of() : List.copyOf(referenceImageRefs);
            sourceVideoRefs = sourceVideoRefs == null ? List.of() : List.copyOf(sourceVideoRefs);
            options = options == null ? Map.of() : Map.copyOf(options);
        }
    }

    sealed interface Submission {
        record Completed(String artifactUrl) implements Submission {}

        record Pending(String taskHandle) implements Submission {}
    }

    record TaskStatus(State state, String artifactUrl, String error) {
        public enum State { PENDING, SUCCEEDED, FAILED }

        public static TaskStatus pending() {
            return new TaskStatus(State.PENDING, null, null);
        }

        public static TaskStatus succeeded(String artifactUrl) {
            return new TaskStatus(State.SUCCEEDED, artifactUrl, null);
        }

        public static TaskStatus failed(String error) {
            return new TaskStatus(State.FAILED, null, error);
        }
    }

    /** @throws PipelineException with ENGINE_ERROR on non-success or malformed responses */
    Submission submit(Request request);

    TaskStatus poll(EngineDefinition engine, String taskHandle);
}
