package com.pocketpilot.budget.analytics;

public class InvalidBudgetInputException extends IllegalArgumentException {

    public InvalidBudgetInputException(String message) {
        super(message);
    }
}
