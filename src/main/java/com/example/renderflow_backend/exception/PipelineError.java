package com.example.renderflow_backend.exception;

import com.example.renderflow_backend.util.ErrorKind;

/**
 * Structured error recorded on items and batches and returned by the API.
 */
public record PipelineError(ErrorKind kind, String message, boolean retryable) {

    public static PipelineError of(ErrorKind kind, String message) {
        return new PipelineError(kind, message, kind.isRetryable());
    }

    /** Same error, marked as no longer retryable (retry budget spent). */
    public PipelineError exhausted() {
        return new PipelineError(kind, message, false);
    }
}
