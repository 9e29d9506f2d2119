package com.pocketpilot.budget.analytics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Budget taxonomy. Labels are matched exactly and case-sensitively; every alias of a category
 * contributes to the same bucket.
 */
public enum BudgetCategory {
    HOUSING_AND_UTILITIES("Housing & Utilities", NeedClass.FIXED_NEED, "Housing and Utilities"),
    DEBT("Debt", NeedClass.FIXED_NEED, "Debt/Loans", "Loan Payment"),
    GROCERIES("Groceries", NeedClass.FIXED_NEED),
    HEALTH_AND_PERSONAL_CARE("Health and Personal Care", NeedClass.FIXED_NEED),
    EDUCATION("Education", NeedClass.FIXED_NEED),
    CHILDCARE("Childcare", NeedClass.FIXED_NEED),
    FOOD("Food", NeedClass.FLEXIBLE_NEED),
    TRANSPORT("Transportation", NeedClass.FLEXIBLE_NEED, "Transport");

    private static final Map<String, BudgetCategory> BY_LABEL = new HashMap<>();

    static {
        for (BudgetCategory category : values()) {
            for (String label : category.labels) {
                BY_LABEL.put(label, category);
            }
        }
    }

    private final String displayName;
    private final NeedClass needClass;
    private final List<String> labels;

    BudgetCategory(String displayName, NeedClass needClass, String... aliases) {
        this.displayName = displayName;
        this.needClass = needClass;
        List<String> all = new ArrayList<>();
        all.add(displayName);
        all.addAll(Arrays.asList(aliases));
        this.labels = List.copyOf(all);
    }

    public String displayName() {
        return displayName;
    }

    public NeedClass needClass() {
        return needClass;
    }

    public List<String> labels() {
        return labels;
    }

    public static Optional<BudgetCategory> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_LABEL.get(label));
    }
}
