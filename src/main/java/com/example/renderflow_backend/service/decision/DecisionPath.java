package com.example.renderflow_backend.service.decision;

public enum DecisionPath {
    LOCAL_FIRST,
    SCORED,
    FREE_TIER_FALLBACK
}
