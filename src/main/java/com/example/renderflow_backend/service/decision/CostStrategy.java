package com.example.renderflow_backend.service.decision;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CostStrategy {
    LOCAL_FIRST("local-first"),
    CLOUD_FALLBACK("cloud-fallback"),
    EDGE_FALLBACK("edge-fallback");

    private final String label;

    CostStrategy(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
