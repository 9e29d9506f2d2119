package com.pocketpilot.budget.model;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH
}
