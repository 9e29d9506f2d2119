package com.pocketpilot.budget.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionResponseDto(
        String id,
        String userId,
        BigDecimal amount,
        String type,
        String category,
        LocalDate date,
        String description
) {
}
