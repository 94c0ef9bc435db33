package com.example.renderflow_backend.util;

public enum QualityTier {
    FAST(70),
    BALANCED(85),
    CINEMATIC(95);

    private final int factorScore;

    QualityTier(int factorScore) {
        this.factorScore = factorScore;
    }

    public int factorScore() {
        return factorScore;
    }
}
