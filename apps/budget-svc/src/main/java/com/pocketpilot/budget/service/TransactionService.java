package com.pocketpilot.budget.service;

import com.pocketpilot.budget.model.Transaction;
import com.pocketpilot.budget.model.TransactionType;
import com.pocketpilot.budget.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records transaction changes and invalidates every prescription built from an affected month.
 */
@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;
    private final PrescriptionService prescriptionService;
    private final MonthlyTransactionCache transactionCache;

    public TransactionService(
            TransactionRepository transactionRepository,
            PrescriptionService prescriptionService,
            MonthlyTransactionCache transactionCache
    ) {
        this.transactionRepository = transactionRepository;
        this.prescriptionService = prescriptionService;
        this.transactionCache = transactionCache;
    }

    public List<Transaction> listTransactions(UUID userId, YearMonth month) {
        return transactionRepository.findByUserIdAndMonth(userId, month);
    }

    public Transaction recordTransaction(
            UUID userId,
            BigDecimal amount,
            TransactionType type,
            String category,
            LocalDate occurredOn,
            String description
    ) {
        Transaction saved = transactionRepository.save(
                new Transaction(UUID.randomUUID(), userId, amount, type, category, occurredOn, description));
        log.debug("Recorded transaction {} for user {} on {}", saved.id(), userId, occurredOn);
        invalidate(userId, saved.month());
        return saved;
    }

    public Transaction updateTransaction(
            UUID userId,
            UUID transactionId,
            Optional<String> category,
            Optional<BigDecimal> amount,
            Optional<LocalDate> occurredOn
    ) {
        Transaction existing = requireOwned(userId, transactionId);
        Transaction updated = existing;
        if (category.isPresent()) {
            updated = updated.withCategory(category.get());
        }
        if (amount.isPresent()) {
            updated = updated.withAmount(amount.get());
        }
        if (occurredOn.isPresent()) {
            updated = updated.withOccurredOn(occurredOn.get());
        }
        Transaction saved = transactionRepository.save(updated);
        invalidate(userId, existing.month());
        if (!existing.month().equals(saved.month())) {
            invalidate(userId, saved.month());
        }
        return saved;
    }

    public void deleteTransaction(UUID userId, UUID transactionId) {
        Transaction existing = requireOwned(userId, transactionId);
        transactionRepository.deleteById(transactionId);
        log.debug("Deleted transaction {} for user {}", transactionId, userId);
        invalidate(userId, existing.month());
    }

    private Transaction requireOwned(UUID userId, UUID transactionId) {
        return transactionRepository.findById(transactionId)
                .filter(tx -> tx.userId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Transaction not found"));
    }

    private void invalidate(UUID userId, YearMonth month) {
        transactionCache.invalidate(userId, month);
        prescriptionService.invalidateSourceMonth(userId, month);
    }
}
