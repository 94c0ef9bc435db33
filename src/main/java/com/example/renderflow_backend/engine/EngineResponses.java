package com.example.renderflow_backend.engine;

import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.Submission;
import com.example.renderflow_backend.engine.Interfaces.GenerationEngine.TaskStatus;
import com.example.renderflow_backend.exception.PipelineException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Set;

/**
 * Reads the loosely shaped JSON the render backend, edge functions and providers answer with.
 */
public final class EngineResponses {
    private static final Set<String> DONE = Set.of("completed", "complete", "succeeded", "success", "done", "ready");
    private static final Set<String> FAILED = Set.of("failed", "failure", "error", "cancelled", "canceled");

    private static final String[] URL_FIELDS = {"url", "video_url", "videoUrl", "output_url", "artifactUrl"};
    private static final String[] HANDLE_FIELDS = {"taskId", "task_id", "job_id", "jobId", "id"};
    private static final String[] ERROR_FIELDS = {"error", "error_message", "message"};

    private EngineResponses() {
    }

    static Submission toSubmission(JsonNode root, String engineId) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw PipelineException.engine("Empty response from engine " + engineId, null);
        }
        String status = text(root, "status");
        String url = first(root, URL_FIELDS);
        if (isFailed(status)) {
            throw PipelineException.engine("Engine %s rejected request: %s".formatted(engineId,
                    orDefault(first(root, ERROR_FIELDS), status)), null);
        }
        if (url != null) {
            return new Submission.Completed(url);
        }
        String handle = first(root, HANDLE_FIELDS);
        if (handle != null) {
            return new Submission.Pending(handle);
        }
        throw PipelineException.engine("Engine %s answered without artifact or task handle".formatted(engineId), null);
    }

    static TaskStatus toTaskStatus(JsonNode root, String engineId) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw PipelineException.engine("Empty poll response from engine " + engineId, null);
        }
        return toTaskStatus(text(root, "status"), first(root, URL_FIELDS), first(root, ERROR_FIELDS));
    }

    /** Maps a loose status word plus url and error onto a task status; also used for webhook payloads. */
    public static TaskStatus toTaskStatus(String status, String url, String error) {
        if (isFailed(status)) {
            return TaskStatus.failed(orDefault(error, status));
        }
        if (isDone(status) || (status == null && url != null)) {
            return url == null ? TaskStatus.failed("completed without artifact url") : TaskStatus.succeeded(url);
        }
        return TaskStatus.pending();
    }

    private static boolean isDone(String status) {
        return status != null && DONE.contains(status.toLowerCase(Locale.ROOT));
    }

    private static boolean isFailed(String status) {
        return status != null && FAILED.contains(status.toLowerCase(Locale.ROOT));
    }

    private static String first(JsonNode root, String[] fields) {
        for (String field : fields) {
            String value = text(root, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText("");
        return value.isBlank() ? null : value;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : (fallback == null ? "unknown" : fallback);
    }
}
