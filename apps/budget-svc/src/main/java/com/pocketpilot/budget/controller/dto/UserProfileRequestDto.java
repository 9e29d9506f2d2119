package com.pocketpilot.budget.controller.dto;

import com.pocketpilot.budget.model.UserProfile;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public record UserProfileRequestDto(
        @DecimalMin(value = "0.00") BigDecimal monthlyNetIncome,
        @DecimalMin(value = "0.00") BigDecimal monthlyGrossIncome,
        @Size(min = 3, max = 3) String currency,
        UserProfile.IncomeFrequency incomeFrequency,
        UserProfile.Profession profession,
        LocalDate birthDate,
        UserProfile.CivilStatus civilStatus,
        UserProfile.HouseholdSituation householdSituation,
        Boolean hasChildren,
        @Min(0) Integer numberOfChildren,
        Boolean businessOwner,
        List<UserProfile.DebtStatus> debtStatuses,
        Set<UserProfile.SavingsInstrument> savingsInstruments,
        @DecimalMin(value = "0.00") BigDecimal emergencyFundBalance
) {
}
