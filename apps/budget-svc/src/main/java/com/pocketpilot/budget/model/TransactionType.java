package com.pocketpilot.budget.model;

public enum TransactionType {
    INCOME,
    EXPENSE,
    RECURRING_EXPENSE,
    SAVINGS,
    SAVINGS_WITHDRAWAL,
    DEBT,
    DEBT_PAYMENT,
    EMERGENCY_FUND,
    EMERGENCY_FUND_WITHDRAWAL;

    public boolean isSpending() {
        return this == EXPENSE || this == RECURRING_EXPENSE;
    }
}
