package com.pocketpilot.budget.analytics;

public enum NeedClass {
    FIXED_NEED,
    FLEXIBLE_NEED,
    EXCLUDED
}
