package com.pocketpilot.budget.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrescriptionResponseDto(
        String id,
        String month,
        SourceDto source,
        IncomeDto income,
        StrategyResponseDto strategy,
        AnalysisDto analysis,
        List<DailyAllocationDto> dailyAllocations,
        List<MonthlyAllocationDto> monthlyAllocations,
        List<AdjustmentDto> behaviorAdjustments,
        BigDecimal totalDailyBudget,
        List<TipDto> tips,
        Instant lastUpdated,
        String traceId
) {
    public record SourceDto(
            String month,
            String rule,
            String reason,
            BigDecimal dataCompleteness,
            int daysWithData,
            int daysInMonth,
            int transactionCount,
            String confidence,
            Map<String, BigDecimal> categorySpending
    ) {
    }

    public record IncomeDto(BigDecimal netIncome, String source) {
    }

    public record AnalysisDto(
            Map<String, BigDecimal> fixedNeeds,
            BigDecimal fixedTotal,
            BigDecimal food,
            BigDecimal transport,
            BigDecimal projectedBudget,
            BigDecimal remainingBudget,
            boolean sustainable,
            String validationCase,
            BigDecimal scaleFactor,
            List<String> warnings,
            List<String> adjustments
    ) {
    }

    public record DailyAllocationDto(String category, BigDecimal dailyAmount, BigDecimal historicalDailyAverage, String description) {
    }

    public record MonthlyAllocationDto(String category, BigDecimal monthlyAmount, boolean fixed, String description) {
    }

    public record AdjustmentDto(String type, BigDecimal amount, String reason, LocalDate effectiveDate) {
    }

    public record TipDto(String category, String title, String message, String action, int priority) {
    }
}
