package com.pocketpilot.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Budget for a single day: the prescription's base daily amount plus that day's adjustments.
 * The effective amount may be negative.
 */
public record DailyBudget(
        UUID userId,
        LocalDate date,
        BigDecimal baseBudget,
        List<BudgetPrescription.BehaviorAdjustment> adjustments,
        BigDecimal effectiveBudget
) {
    public DailyBudget {
        adjustments = List.copyOf(adjustments);
    }
}
