package com.pocketpilot.budget.controller.dto;

public record StrategyResponseDto(
        String strategy,
        String displayName,
        int needsPercent,
        int wantsPercent,
        int savingsPercent
) {
}
