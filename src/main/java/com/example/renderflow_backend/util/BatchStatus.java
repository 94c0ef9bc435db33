package com.example.renderflow_backend.util;

/**
 * Aggregate status of a batch job. PARTIAL means at least one item reached READY and at least one did not.
 */
public enum BatchStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIAL || this == FAILED;
    }

    public static BatchStatus aggregate(int ready, int total) {
        if (total > 0 && ready == total) {
            return COMPLETED;
        }
        return ready > 0 ? PARTIAL : FAILED;
    }
}
