package com.example.renderflow_backend.service.decision;

import java.math.BigDecimal;
import java.util.List;

public record CostEstimate(
        BigDecimal min,
        BigDecimal max,
        BigDecimal optimized,
        List<CostBreakdown> breakdown,
        CostStrategy strategy,
        int freeCount,
        int paidCount
) {
    public CostEstimate {
        breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
    }
}
