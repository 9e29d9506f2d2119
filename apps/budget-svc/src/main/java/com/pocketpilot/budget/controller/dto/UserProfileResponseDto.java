package com.pocketpilot.budget.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserProfileResponseDto(
        String userId,
        BigDecimal monthlyNetIncome,
        BigDecimal monthlyGrossIncome,
        String currency,
        String incomeFrequency,
        String profession,
        boolean hasChildren,
        int numberOfChildren,
        long activeDebts
) {
}
