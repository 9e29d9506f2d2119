package com.pocketpilot.budget.model;

/**
 * Budgeting archetypes. Each carries a fixed Needs/Wants/Savings split; the family-centric
 * split additionally depends on the number of children.
 */
public enum BudgetStrategy {
    DEBT_HEAVY_RECOVERY("Debt Recovery", new Split(70, 20, 10)),
    RISK_CONTROL("Income Protection", new Split(40, 40, 20)),
    CONSERVATIVE("Wealth Protection", new Split(75, 10, 15)),
    FAMILY_CENTRIC("Family Focus", new Split(60, 25, 15)),
    BUILDER("Growth Strategy", new Split(60, 20, 20)),
    BALANCED("Balanced Plan", new Split(50, 30, 20));

    private static final Split FAMILY_MEDIUM = new Split(65, 20, 15);
    private static final Split FAMILY_LARGE = new Split(70, 15, 15);

    private final String displayName;
    private final Split baseSplit;

    BudgetStrategy(String displayName, Split baseSplit) {
        this.displayName = displayName;
        this.baseSplit = baseSplit;
    }

    public String displayName() {
        return displayName;
    }

    public Split split() {
        return baseSplit;
    }

    public Split split(int numberOfChildren) {
        if (this != FAMILY_CENTRIC) {
            return baseSplit;
        }
        if (numberOfChildren >= 6) {
            return FAMILY_LARGE;
        }
        if (numberOfChildren >= 3) {
            return FAMILY_MEDIUM;
        }
        return baseSplit;
    }

    public record Split(int needsPercent, int wantsPercent, int savingsPercent) {
        public Split {
            if (needsPercent + wantsPercent + savingsPercent != 100) {
                throw new IllegalArgumentException("split must total 100");
            }
        }

        @Override
        public String toString() {
            return needsPercent + "/" + wantsPercent + "/" + savingsPercent;
        }
    }
}
