package com.example.renderflow_backend.util;

/**
 * Error taxonomy shared by items, batches and the HTTP layer.
 */
public enum ErrorKind {
    /** Remote invocation returned non-success or a malformed payload. */
    ENGINE_ERROR(true),
    /** Generation reported success but the artifact failed validation. */
    ARTIFACT_ERROR(true),
    TIMEOUT_ERROR(false),
    /** No engine satisfies the decision context; fatal for the request. */
    CONFIGURATION_ERROR(false),
    /** Malformed batch spec, rejected before processing. */
    VALIDATION_ERROR(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String code() {
        return name().toLowerCase();
    }
}
