package com.pocketpilot.budget.controller.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionUpdateRequestDto(
        @Size(min = 1, max = 64) String category,
        @DecimalMin(value = "0.01") BigDecimal amount,
        LocalDate date
) {
}
