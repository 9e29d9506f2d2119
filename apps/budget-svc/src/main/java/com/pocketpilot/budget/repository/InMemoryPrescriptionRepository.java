package com.pocketpilot.budget.repository;

import com.pocketpilot.budget.model.BudgetPrescription;
import java.time.YearMonth;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryPrescriptionRepository implements PrescriptionRepository {

    private final Map<String, BudgetPrescription> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<BudgetPrescription> findByUserIdAndMonth(UUID userId, YearMonth month) {
        return Optional.ofNullable(storage.get(BudgetPrescription.idFor(userId, month)));
    }

    @Override
    public BudgetPrescription save(BudgetPrescription prescription) {
        storage.put(prescription.id(), prescription);
        return prescription;
    }

    @Override
    public int deleteByUserIdAndSourceMonth(UUID userId, YearMonth sourceMonth) {
        int removed = 0;
        for (Map.Entry<String, BudgetPrescription> entry : storage.entrySet()) {
            BudgetPrescription prescription = entry.getValue();
            if (prescription.userId().equals(userId)
                    && sourceMonth.equals(prescription.sourceMonth())
                    && storage.remove(entry.getKey(), prescription)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void deleteById(String prescriptionId) {
        storage.remove(prescriptionId);
    }

    @Override
    public boolean existsByUserId(UUID userId) {
        return storage.values().stream().anyMatch(p -> p.userId().equals(userId));
    }
}
