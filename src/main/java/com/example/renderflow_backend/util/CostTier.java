package com.example.renderflow_backend.util;

public enum CostTier {
    FREE,
    BUDGET,
    PREMIUM
}
