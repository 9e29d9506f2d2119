package com.pocketpilot.budget.repository;

import com.pocketpilot.budget.model.Transaction;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTransactionRepository implements TransactionRepository {

    private final Map<UUID, Transaction> storage = new ConcurrentHashMap<>();

    @Override
    public Transaction save(Transaction transaction) {
        storage.put(transaction.id(), transaction);
        return transaction;
    }

    @Override
    public Optional<Transaction> findById(UUID transactionId) {
        return Optional.ofNullable(storage.get(transactionId));
    }

    @Override
    public List<Transaction> findByUserIdAndRange(UUID userId, LocalDate fromInclusive, LocalDate toExclusive) {
        return storage.values().stream()
                .filter(tx -> tx.userId().equals(userId))
                .filter(tx -> !tx.occurredOn().isBefore(fromInclusive) && tx.occurredOn().isBefore(toExclusive))
                .sorted(Comparator.comparing(Transaction::occurredOn).thenComparing(Transaction::id))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void deleteById(UUID transactionId) {
        storage.remove(transactionId);
    }
}
