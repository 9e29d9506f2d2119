package com.pocketpilot.budget.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

public record BudgetPrescription(
        String id,
        UUID userId,
        YearMonth month,
        YearMonth sourceMonth,
        MonthDataSelection.SelectionRule selectionRule,
        String selectionReason,
        BigDecimal dataCompleteness,
        int daysWithData,
        int daysInSourceMonth,
        int transactionCount,
        ConfidenceLevel confidence,
        BigDecimal netIncome,
        NetIncomeSource netIncomeSource,
        BudgetStrategy strategy,
        BudgetStrategy.Split strategySplit,
        SortedMap<String, BigDecimal> sourceSpending,
        CategoryBudgetAnalysis analysis,
        List<DailyAllocation> dailyAllocations,
        List<MonthlyAllocation> monthlyAllocations,
        List<BehaviorAdjustment> behaviorAdjustments,
        List<BudgetingTip> tips,
        Instant lastUpdated
) {
    public BudgetPrescription {
        sourceSpending = Collections.unmodifiableSortedMap(new TreeMap<>(sourceSpending));
        dailyAllocations = List.copyOf(dailyAllocations);
        monthlyAllocations = List.copyOf(monthlyAllocations);
        behaviorAdjustments = List.copyOf(behaviorAdjustments);
        tips = List.copyOf(tips);
    }

    public static String idFor(UUID userId, YearMonth month) {
        return userId + "_" + month.getYear() + "_" + String.format("%02d", month.getMonthValue());
    }

    public BigDecimal totalDailyBudget() {
        return dailyAllocations.stream()
                .map(DailyAllocation::dailyAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal totalMonthlyFixedBudget() {
        return monthlyAllocations.stream()
                .filter(MonthlyAllocation::fixed)
                .map(MonthlyAllocation::monthlyAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public boolean isStale(Instant now, Duration freshnessWindow) {
        return lastUpdated.plus(freshnessWindow).isBefore(now);
    }

    public enum NetIncomeSource {
        DECLARED_NET,
        DECLARED_GROSS,
        SOURCE_MONTH_INCOME,
        ESTIMATED_FROM_EXPENSES
    }

    public record DailyAllocation(String category, BigDecimal dailyAmount, BigDecimal historicalDailyAverage, String description) {
    }

    public record MonthlyAllocation(String category, BigDecimal monthlyAmount, boolean fixed, String description) {
    }

    public record BehaviorAdjustment(Type type, BigDecimal amount, String reason, LocalDate effectiveDate) {
        public enum Type {
            ROLLOVER,
            OVERSPENDING,
            WEEKEND,
            PAYDAY
        }
    }

    public record BudgetingTip(String category, String title, String message, String action, BudgetStrategy strategy, int priority) {
    }
}
