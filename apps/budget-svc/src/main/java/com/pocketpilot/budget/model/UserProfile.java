package com.pocketpilot.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;

/**
 * Profile attributes that drive income resolution and strategy selection. Read-only for the
 * duration of a budget computation.
 */
public record UserProfile(
        UUID userId,
        BigDecimal monthlyNetIncome,
        BigDecimal monthlyGrossIncome,
        String currency,
        IncomeFrequency incomeFrequency,
        Profession profession,
        LocalDate birthDate,
        CivilStatus civilStatus,
        HouseholdSituation householdSituation,
        boolean hasChildren,
        int numberOfChildren,
        boolean businessOwner,
        List<DebtStatus> debtStatuses,
        Set<SavingsInstrument> savingsInstruments,
        BigDecimal emergencyFundBalance
) {
    public UserProfile {
        if (userId == null) {
            throw new IllegalArgumentException("userId must be provided");
        }
        if (numberOfChildren < 0) {
            throw new IllegalArgumentException("numberOfChildren must not be negative");
        }
        currency = currency == null || currency.isBlank() ? "PHP" : currency;
        debtStatuses = debtStatuses == null ? List.of() : List.copyOf(debtStatuses);
        savingsInstruments = savingsInstruments == null ? Set.of() : Set.copyOf(savingsInstruments);
    }

    public OptionalInt ageOn(LocalDate date) {
        if (birthDate == null || date == null || birthDate.isAfter(date)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Period.between(birthDate, date).getYears());
    }

    /**
     * Number of debts the user currently carries. Each list entry is one debt, so two credit
     * cards count twice; {@link DebtStatus#NONE} entries are ignored.
     */
    public long activeDebtCount() {
        return debtStatuses.stream()
                .filter(status -> status != null && status != DebtStatus.NONE)
                .count();
    }

    public enum IncomeFrequency {
        FIXED,
        IRREGULAR
    }

    public enum Profession {
        STUDENT,
        EMPLOYEE,
        SELF_EMPLOYED,
        RETIRED,
        UNEMPLOYED
    }

    public enum CivilStatus {
        SINGLE,
        MARRIED,
        WIDOWED,
        LIVING_WITH_PARTNER,
        OTHER
    }

    public enum HouseholdSituation {
        RENTING,
        MORTGAGE,
        OWN_HOUSE,
        LIVES_WITH_FAMILY,
        OTHER
    }

    public enum DebtStatus {
        NONE,
        CREDIT_CARD,
        PERSONAL_LOAN,
        BUSINESS_LOAN,
        STUDENT_LOAN,
        OTHER
    }

    public enum SavingsInstrument {
        NONE,
        SMALL_SAVINGS,
        EMERGENCY_FUND,
        INVESTMENTS
    }
}
