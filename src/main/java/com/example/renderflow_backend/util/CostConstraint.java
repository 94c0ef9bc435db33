package com.example.renderflow_backend.util;

/**
 * Spending ceiling requested by the caller. Tiers are cumulative: a BUDGET constraint admits FREE
 * and BUDGET engines, PREMIUM admits everything. AI_CHOOSES applies no ceiling.
 */
public enum CostConstraint {
    FREE,
    BUDGET,
    PREMIUM,
    AI_CHOOSES;

    public boolean includes(CostTier tier) {
        return switch (this) {
            case FREE -> tier == CostTier.FREE;
            case BUDGET -> tier == CostTier.FREE || tier == CostTier.BUDGET;
            case PREMIUM, AI_CHOOSES -> true;
        };
    }
}
