package com.pocketpilot.budget.repository;

import com.pocketpilot.budget.model.Transaction;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TransactionRepository {

    Transaction save(Transaction transaction);

    Optional<Transaction> findById(UUID transactionId);

    List<Transaction> findByUserIdAndRange(UUID userId, LocalDate fromInclusive, LocalDate toExclusive);

    default List<Transaction> findByUserIdAndMonth(UUID userId, YearMonth month) {
        return findByUserIdAndRange(userId, month.atDay(1), month.plusMonths(1).atDay(1));
    }

    void deleteById(UUID transactionId);
}
