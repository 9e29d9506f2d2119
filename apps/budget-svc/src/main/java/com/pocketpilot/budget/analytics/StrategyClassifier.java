package com.pocketpilot.budget.analytics;

import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.UserProfile;
import com.pocketpilot.budget.model.UserProfile.CivilStatus;
import com.pocketpilot.budget.model.UserProfile.HouseholdSituation;
import com.pocketpilot.budget.model.UserProfile.IncomeFrequency;
import com.pocketpilot.budget.model.UserProfile.Profession;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;
import org.springframework.stereotype.Component;

/**
 * Picks a budgeting strategy from profile attributes. Rules are evaluated top to bottom and the
 * first match wins; {@link BudgetStrategy#BALANCED} is the default.
 */
@Component
public class StrategyClassifier {

    private static final int CONSERVATIVE_AGE = 55;
    private static final int DEBT_HEAVY_MIN_DEBTS = 2;
    private static final Set<CivilStatus> PARTNERED_OR_SINGLE = EnumSet.of(
            CivilStatus.SINGLE, CivilStatus.MARRIED, CivilStatus.WIDOWED, CivilStatus.LIVING_WITH_PARTNER);
    private static final Set<CivilStatus> BALANCED_STATUSES = EnumSet.of(
            CivilStatus.SINGLE, CivilStatus.MARRIED, CivilStatus.WIDOWED);

    private static final List<Rule> RULES = List.of(
            new Rule(BudgetStrategy.DEBT_HEAVY_RECOVERY,
                    (profile, date) -> profile.activeDebtCount() >= DEBT_HEAVY_MIN_DEBTS),
            new Rule(BudgetStrategy.RISK_CONTROL,
                    (profile, date) -> profile.incomeFrequency() == IncomeFrequency.IRREGULAR
                            || profile.profession() == Profession.UNEMPLOYED
                            || profile.businessOwner()),
            new Rule(BudgetStrategy.CONSERVATIVE,
                    (profile, date) -> (isSenior(profile, date) || profile.profession() == Profession.RETIRED)
                            && hasFixedIncome(profile)),
            new Rule(BudgetStrategy.FAMILY_CENTRIC,
                    (profile, date) -> profile.hasChildren()
                            && hasFixedIncome(profile)
                            && PARTNERED_OR_SINGLE.contains(profile.civilStatus())),
            new Rule(BudgetStrategy.BUILDER,
                    (profile, date) -> PARTNERED_OR_SINGLE.contains(profile.civilStatus())
                            && !profile.hasChildren()
                            && profile.householdSituation() == HouseholdSituation.MORTGAGE),
            new Rule(BudgetStrategy.BALANCED,
                    (profile, date) -> !profile.hasChildren()
                            && profile.householdSituation() != HouseholdSituation.MORTGAGE
                            && hasFixedIncome(profile)
                            && BALANCED_STATUSES.contains(profile.civilStatus()))
    );

    public BudgetStrategy classify(UserProfile profile, LocalDate evaluationDate) {
        if (profile == null) {
            return BudgetStrategy.BALANCED;
        }
        return RULES.stream()
                .filter(rule -> rule.matches().test(profile, evaluationDate))
                .map(Rule::strategy)
                .findFirst()
                .orElse(BudgetStrategy.BALANCED);
    }

    public BudgetStrategy.Split splitFor(UserProfile profile, LocalDate evaluationDate) {
        BudgetStrategy strategy = classify(profile, evaluationDate);
        return strategy.split(profile == null ? 0 : profile.numberOfChildren());
    }

    private static boolean isSenior(UserProfile profile, LocalDate date) {
        return profile.ageOn(date).orElse(0) >= CONSERVATIVE_AGE;
    }

    private static boolean hasFixedIncome(UserProfile profile) {
        return profile.incomeFrequency() == IncomeFrequency.FIXED;
    }

    private record Rule(BudgetStrategy strategy, BiPredicate<UserProfile, LocalDate> matches) {
    }
}
