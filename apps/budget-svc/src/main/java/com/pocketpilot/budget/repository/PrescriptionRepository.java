package com.pocketpilot.budget.repository;

import com.pocketpilot.budget.model.BudgetPrescription;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;

/**
 * Store of generated prescriptions, one per user and month. Implementations replace whole
 * records so readers never observe a partial write, and signal failures with
 * {@link PrescriptionStoreException}.
 */
public interface PrescriptionRepository {

    Optional<BudgetPrescription> findByUserIdAndMonth(UUID userId, YearMonth month);

    BudgetPrescription save(BudgetPrescription prescription);

    /**
     * @return number of prescriptions removed
     */
    int deleteByUserIdAndSourceMonth(UUID userId, YearMonth sourceMonth);

    void deleteById(String prescriptionId);

    boolean existsByUserId(UUID userId);
}
