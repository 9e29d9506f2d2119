package com.pocketpilot.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record DailyBudgetResponseDto(
        LocalDate date,
        BigDecimal baseBudget,
        List<PrescriptionResponseDto.AdjustmentDto> adjustments,
        BigDecimal effectiveBudget,
        String traceId
) {
}
