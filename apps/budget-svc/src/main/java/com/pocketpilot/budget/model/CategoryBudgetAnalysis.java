package com.pocketpilot.budget.model;

import java.math.BigDecimal;
import java.util.List;

public record CategoryBudgetAnalysis(
        BigDecimal netIncome,
        FixedNeeds fixedNeeds,
        FlexibleNeeds flexibleNeeds,
        BigDecimal projectedBudget,
        BigDecimal remainingBudget,
        boolean sustainable,
        ValidationCase validationCase,
        BigDecimal scaleFactor,
        List<String> warnings,
        List<String> adjustments
) {
    public CategoryBudgetAnalysis {
        if (projectedBudget.compareTo(fixedNeeds.total().add(flexibleNeeds.total())) != 0) {
            throw new IllegalStateException("projected budget must equal fixed plus flexible needs");
        }
        if (remainingBudget.signum() < 0 && sustainable) {
            throw new IllegalStateException("a negative remaining budget cannot be sustainable");
        }
        warnings = List.copyOf(warnings);
        adjustments = List.copyOf(adjustments);
    }

    public record FixedNeeds(
            BigDecimal housingAndUtilities,
            BigDecimal debt,
            BigDecimal groceries,
            BigDecimal healthAndPersonalCare,
            BigDecimal education,
            BigDecimal childcare
    ) {
        public BigDecimal total() {
            return housingAndUtilities
                    .add(debt)
                    .add(groceries)
                    .add(healthAndPersonalCare)
                    .add(education)
                    .add(childcare);
        }
    }

    public record FlexibleNeeds(BigDecimal food, BigDecimal transport) {
        public BigDecimal total() {
            return food.add(transport);
        }
    }

    /**
     * Which branch of the net-income validation produced the final figures.
     */
    public enum ValidationCase {
        WITHIN_INCOME,
        FIXED_EXCEEDS_INCOME,
        PROPORTIONAL_SCALING,
        FLOORS_EXCEED_INCOME
    }
}
