package com.example.renderflow_backend.util;

public enum ExecutionMode {
    /** Self-hosted render backend. */
    LOCAL,
    /** Managed provider APIs. */
    AGENT,
    /** Serverless edge functions. */
    EDGE
}
