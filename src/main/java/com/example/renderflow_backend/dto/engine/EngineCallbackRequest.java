package com.example.renderflow_backend.dto.engine;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

/**
 * Completion webhook sent by async engines.
 */
public record EngineCallbackRequest(
        @NotBlank @JsonAlias({"job_id", "task_id", "taskId"}) String taskHandle,
        String engine,
        @NotBlank String status,
        @JsonAlias({"video_url", "url"}) String artifactUrl,
        @JsonAlias({"error_message"}) String error
) {
}
