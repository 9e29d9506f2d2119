package com.pocketpilot.budget.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.UserProfile;
import com.pocketpilot.budget.model.UserProfile.CivilStatus;
import com.pocketpilot.budget.model.UserProfile.DebtStatus;
import com.pocketpilot.budget.model.UserProfile.HouseholdSituation;
import com.pocketpilot.budget.model.UserProfile.IncomeFrequency;
import com.pocketpilot.budget.model.UserProfile.Profession;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class StrategyClassifierTest {

    private static final LocalDate EVALUATED_ON = LocalDate.of(2024, 6, 1);

    private final StrategyClassifier classifier = new StrategyClassifier();

    @Test
    void twoCreditCardsMeanDebtRecoveryRegardlessOfOtherAttributes() {
        ProfileBuilder builder = new ProfileBuilder()
                .debts(DebtStatus.CREDIT_CARD, DebtStatus.CREDIT_CARD)
                .income(IncomeFrequency.IRREGULAR)
                .birthDate(LocalDate.of(1950, 1, 1))
                .businessOwner(true);

        assertThat(classifier.classify(builder.build(), EVALUATED_ON)).isEqualTo(BudgetStrategy.DEBT_HEAVY_RECOVERY);
        assertThat(BudgetStrategy.DEBT_HEAVY_RECOVERY.split().toString()).isEqualTo("70/20/10");
    }

    @Test
    void singleDebtDoesNotTriggerDebtRecovery() {
        UserProfile profile = new ProfileBuilder().debts(DebtStatus.PERSONAL_LOAN, DebtStatus.NONE).build();

        assertThat(classifier.classify(profile, EVALUATED_ON)).isEqualTo(BudgetStrategy.BALANCED);
    }

    @Test
    void irregularIncomeUnemploymentOrBusinessMeanRiskControl() {
        assertThat(classifier.classify(new ProfileBuilder().income(IncomeFrequency.IRREGULAR).build(), EVALUATED_ON))
                .isEqualTo(BudgetStrategy.RISK_CONTROL);
        assertThat(classifier.classify(new ProfileBuilder().profession(Profession.UNEMPLOYED).build(), EVALUATED_ON))
                .isEqualTo(BudgetStrategy.RISK_CONTROL);
        assertThat(classifier.classify(new ProfileBuilder().businessOwner(true).build(), EVALUATED_ON))
                .isEqualTo(BudgetStrategy.RISK_CONTROL);
    }

    @Test
    void seniorsAndRetireesWithFixedIncomeAreConservative() {
        assertThat(classifier.classify(new ProfileBuilder().birthDate(LocalDate.of(1969, 5, 31)).build(), EVALUATED_ON))
                .isEqualTo(BudgetStrategy.CONSERVATIVE);
        assertThat(classifier.classify(new ProfileBuilder().profession(Profession.RETIRED).build(), EVALUATED_ON))
                .isEqualTo(BudgetStrategy.CONSERVATIVE);
        assertThat(classifier.classify(new ProfileBuilder().birthDate(LocalDate.of(1969, 6, 2)).build(), EVALUATED_ON))
                .isEqualTo(BudgetStrategy.BALANCED);
    }

    @Test
    void parentsWithFixedIncomeAreFamilyCentric() {
        UserProfile profile = new ProfileBuilder().civilStatus(CivilStatus.MARRIED).children(2).build();

        assertThat(classifier.classify(profile, EVALUATED_ON)).isEqualTo(BudgetStrategy.FAMILY_CENTRIC);
        assertThat(classifier.splitFor(profile, EVALUATED_ON)).isEqualTo(new BudgetStrategy.Split(60, 25, 15));
    }

    @Test
    void familySplitDependsOnNumberOfChildren() {
        assertThat(BudgetStrategy.FAMILY_CENTRIC.split(0)).isEqualTo(new BudgetStrategy.Split(60, 25, 15));
        assertThat(BudgetStrategy.FAMILY_CENTRIC.split(2)).isEqualTo(new BudgetStrategy.Split(60, 25, 15));
        assertThat(BudgetStrategy.FAMILY_CENTRIC.split(3)).isEqualTo(new BudgetStrategy.Split(65, 20, 15));
        assertThat(BudgetStrategy.FAMILY_CENTRIC.split(5)).isEqualTo(new BudgetStrategy.Split(65, 20, 15));
        assertThat(BudgetStrategy.FAMILY_CENTRIC.split(6)).isEqualTo(new BudgetStrategy.Split(70, 15, 15));
        assertThat(BudgetStrategy.BALANCED.split(6)).isEqualTo(new BudgetStrategy.Split(50, 30, 20));
    }

    @Test
    void mortgageHoldersWithoutChildrenAreBuilders() {
        UserProfile profile = new ProfileBuilder()
                .civilStatus(CivilStatus.LIVING_WITH_PARTNER)
                .household(HouseholdSituation.MORTGAGE)
                .build();

        assertThat(classifier.classify(profile, EVALUATED_ON)).isEqualTo(BudgetStrategy.BUILDER);
    }

    @Test
    void unmatchedProfilesFallBackToBalanced() {
        UserProfile otherStatusParent = new ProfileBuilder().civilStatus(CivilStatus.OTHER).children(1).build();

        assertThat(classifier.classify(otherStatusParent, EVALUATED_ON)).isEqualTo(BudgetStrategy.BALANCED);
        assertThat(classifier.classify(null, EVALUATED_ON)).isEqualTo(BudgetStrategy.BALANCED);
    }

    @Test
    void everyCombinationYieldsOneStableStrategy() {
        for (IncomeFrequency income : IncomeFrequency.values()) {
            for (Profession profession : Profession.values()) {
                for (CivilStatus status : CivilStatus.values()) {
                    for (HouseholdSituation household : HouseholdSituation.values()) {
                        for (int children : new int[]{0, 3}) {
                            UserProfile profile = new ProfileBuilder()
                                    .income(income)
                                    .profession(profession)
                                    .civilStatus(status)
                                    .household(household)
                                    .children(children)
                                    .build();
                            BudgetStrategy first = classifier.classify(profile, EVALUATED_ON);
                            assertThat(first).isNotNull();
                            assertThat(classifier.classify(profile, EVALUATED_ON)).isEqualTo(first);
                        }
                    }
                }
            }
        }
    }

    @Test
    void everySplitTotalsOneHundred() {
        for (BudgetStrategy strategy : BudgetStrategy.values()) {
            for (int children = 0; children <= 7; children++) {
                BudgetStrategy.Split split = strategy.split(children);
                assertThat(split.needsPercent() + split.wantsPercent() + split.savingsPercent()).isEqualTo(100);
            }
        }
    }

    private static final class ProfileBuilder {
        private IncomeFrequency income = IncomeFrequency.FIXED;
        private Profession profession = Profession.EMPLOYEE;
        private LocalDate birthDate = LocalDate.of(1994, 3, 10);
        private CivilStatus civilStatus = CivilStatus.SINGLE;
        private HouseholdSituation household = HouseholdSituation.RENTING;
        private int children;
        private boolean businessOwner;
        private final List<DebtStatus> debts = new ArrayList<>();

        ProfileBuilder income(IncomeFrequency value) {
            this.income = value;
            return this;
        }

        ProfileBuilder profession(Profession value) {
            this.profession = value;
            return this;
        }

        ProfileBuilder birthDate(LocalDate value) {
            this.birthDate = value;
            return this;
        }

        ProfileBuilder civilStatus(CivilStatus value) {
            this.civilStatus = value;
            return this;
        }

        ProfileBuilder household(HouseholdSituation value) {
            this.household = value;
            return this;
        }

        ProfileBuilder children(int value) {
            this.children = value;
            return this;
        }

        ProfileBuilder businessOwner(boolean value) {
            this.businessOwner = value;
            return this;
        }

        ProfileBuilder debts(DebtStatus... values) {
            this.debts.addAll(List.of(values));
            return this;
        }

        UserProfile build() {
            return new UserProfile(UUID.randomUUID(), null, null, null, income, profession, birthDate,
                    civilStatus, household, children > 0, children, businessOwner, debts, null, null);
        }
    }
}
