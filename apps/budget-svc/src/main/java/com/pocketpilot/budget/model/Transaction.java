package com.pocketpilot.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

public record Transaction(
        UUID id,
        UUID userId,
        BigDecimal amount,
        TransactionType type,
        String category,
        LocalDate occurredOn,
        String description
) {
    public Transaction {
        if (id == null || userId == null) {
            throw new IllegalArgumentException("id and userId must be provided");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must be provided");
        }
        if (occurredOn == null) {
            throw new IllegalArgumentException("occurredOn must be provided");
        }
        category = category == null ? "" : category;
    }

    public YearMonth month() {
        return YearMonth.from(occurredOn);
    }

    public Transaction withCategory(String newCategory) {
        return new Transaction(id, userId, amount, type, newCategory, occurredOn, description);
    }

    public Transaction withAmount(BigDecimal newAmount) {
        return new Transaction(id, userId, newAmount, type, category, occurredOn, description);
    }

    public Transaction withOccurredOn(LocalDate newDate) {
        return new Transaction(id, userId, amount, type, category, newDate, description);
    }
}
