package com.pocketpilot.budget.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Month chosen as the statistical basis of a budget, with the rule that selected it.
 */
public record MonthDataSelection(
        YearMonth selectedMonth,
        SortedMap<String, BigDecimal> categorySpending,
        int daysWithData,
        int totalDaysInMonth,
        int transactionCount,
        BigDecimal dataCompleteness,
        DataQuality quality,
        SelectionRule ruleApplied,
        String selectionReason
) {
    public MonthDataSelection {
        categorySpending = Collections.unmodifiableSortedMap(new TreeMap<>(categorySpending));
    }

    public enum DataQuality {
        EMPTY,
        INSUFFICIENT,
        USABLE,
        STRONG,
        RELIABLE
    }

    public enum SelectionRule {
        PREVIOUS_MONTH_RELIABLE,
        PREVIOUS_MONTH_STRONG,
        PREVIOUS_MONTH_USABLE,
        LAST_RELIABLE_MONTH,
        FALLBACK_PREVIOUS_MONTH,
        FALLBACK_MOST_RECENT_MONTH;

        public boolean carriesForward() {
            return this == PREVIOUS_MONTH_RELIABLE || this == PREVIOUS_MONTH_STRONG || this == PREVIOUS_MONTH_USABLE;
        }
    }
}
