package com.pocketpilot.budget.controller.dto;

import com.pocketpilot.budget.model.TransactionType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

public record TransactionRequestDto(
        @NotNull @DecimalMin(value = "0.01") BigDecimal amount,
        @NotNull TransactionType type,
        @Size(max = 64) String category,
        @NotNull LocalDate date,
        @Size(max = 255) String description
) {
}
