package com.pocketpilot.budget.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.BudgetPrescription.BudgetingTip;
import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CoachingTipServiceTest {

    private CoachingTipService tipService;
    private CategoryBudgetCalculator calculator;

    @BeforeEach
    void setUp() {
        PocketPilotProperties props = PocketPilotProperties.defaults();
        tipService = new CoachingTipService(props);
        calculator = new CategoryBudgetCalculator(props);
    }

    @Test
    void strategyTipsAreLimitedAndOrderedByPriority() {
        List<BudgetingTip> tips = tipService.strategyTips(BudgetStrategy.DEBT_HEAVY_RECOVERY, BudgetStrategy.DEBT_HEAVY_RECOVERY.split());

        assertThat(tips).hasSize(3);
        assertThat(tips).extracting(BudgetingTip::priority).containsExactly(1, 2, 3);
        assertThat(tips).allSatisfy(tip -> assertThat(tip.strategy()).isEqualTo(BudgetStrategy.DEBT_HEAVY_RECOVERY));
    }

    @Test
    void everyStrategyHasTips() {
        for (BudgetStrategy strategy : BudgetStrategy.values()) {
            assertThat(tipService.strategyTips(strategy, strategy.split())).isNotEmpty();
        }
    }

    @Test
    void familyTipsFollowHouseholdTier() {
        BudgetStrategy family = BudgetStrategy.FAMILY_CENTRIC;

        List<BudgetingTip> small = tipService.strategyTips(family, family.split(2));
        List<BudgetingTip> growing = tipService.strategyTips(family, family.split(3));
        List<BudgetingTip> large = tipService.strategyTips(family, family.split(6));

        assertThat(small.get(0).title()).isEqualTo("Family Essentials First");
        assertThat(growing.get(0).title()).isEqualTo("Budget as a Team");
        assertThat(large.get(0).title()).isEqualTo("Needs Only");
        assertThat(tipService.strategyTips(family, family.split(5))).isEqualTo(growing);
        assertThat(large).allSatisfy(tip -> assertThat(tip.strategy()).isEqualTo(family));
    }

    @Test
    void unsustainableBudgetLeadsWithAlert() {
        CategoryBudgetAnalysis analysis = calculator.calculate(new BigDecimal("30000"),
                Map.of("Housing & Utilities", new BigDecimal("27000"), "Food", new BigDecimal("3000")), 30, 30);

        List<BudgetingTip> tips = tipService.analysisTips(analysis, BudgetStrategy.BALANCED);

        assertThat(tips.get(0).title()).isEqualTo("Budget Alert");
        assertThat(tips.size()).isLessThanOrEqualTo(5);
    }

    @Test
    void nudgesFollowDataCompleteness() {
        assertThat(tipService.progressNudge(new BigDecimal("59.99"), BudgetStrategy.BALANCED)).isEmpty();
        assertThat(tipService.progressNudge(new BigDecimal("60"), BudgetStrategy.BALANCED))
                .hasValueSatisfying(tip -> assertThat(tip.title()).isEqualTo("Almost There"));
        assertThat(tipService.progressNudge(new BigDecimal("75"), BudgetStrategy.BALANCED))
                .hasValueSatisfying(tip -> assertThat(tip.title()).isEqualTo("Great Job"));
        assertThat(tipService.progressNudge(new BigDecimal("80"), BudgetStrategy.BALANCED))
                .hasValueSatisfying(tip -> assertThat(tip.title()).isEqualTo("Excellent Tracking"));
    }

    @Test
    void combinesAnalysisStrategyAndProgressTips() {
        CategoryBudgetAnalysis analysis = calculator.calculate(new BigDecimal("50000"),
                Map.of("Groceries", new BigDecimal("5000"), "Food", new BigDecimal("3000")), 30, 30);

        List<BudgetingTip> tips = tipService.tipsFor(analysis, BudgetStrategy.BUILDER, BudgetStrategy.BUILDER.split(), new BigDecimal("85"));

        assertThat(tips).extracting(BudgetingTip::category).contains(
                CoachingTipService.ANALYSIS_CATEGORY, CoachingTipService.STRATEGY_CATEGORY, CoachingTipService.PROGRESS_CATEGORY);
        assertThat(tips.get(tips.size() - 1).category()).isEqualTo(CoachingTipService.PROGRESS_CATEGORY);
    }
}
