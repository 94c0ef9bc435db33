package com.example.renderflow_backend.service.decision;

import com.example.renderflow_backend.util.OperationType;

import java.math.BigDecimal;

public record CostBreakdown(
        String engineId,
        String engineName,
        OperationType operationType,
        BigDecimal unitCost,
        int quantity,
        BigDecimal totalCost,
        boolean paid
) {
}
