package com.pocketpilot.budget.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.BudgetPrescription.BehaviorAdjustment;
import com.pocketpilot.budget.model.BudgetPrescription.DailyAllocation;
import com.pocketpilot.budget.model.BudgetPrescription.MonthlyAllocation;
import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AllocationEngineTest {

    private static final Map<String, BigDecimal> SPENDING = Map.of(
            "Housing & Utilities", new BigDecimal("25000"),
            "Food", new BigDecimal("3200"),
            "Transportation", new BigDecimal("4800"));

    private AllocationEngine engine;
    private CategoryBudgetAnalysis analysis;

    @BeforeEach
    void setUp() {
        PocketPilotProperties props = PocketPilotProperties.defaults();
        engine = new AllocationEngine(props);
        analysis = new CategoryBudgetCalculator(props).calculate(new BigDecimal("50000"), SPENDING, 30, 30);
    }

    @Test
    void dividesFlexibleNeedsAcrossTheMonth() {
        List<DailyAllocation> daily = engine.dailyAllocations(analysis, SPENDING, 30, 30, null);

        assertThat(daily).extracting(DailyAllocation::category).containsExactly("Food", "Transportation");
        assertThat(daily.get(0).dailyAmount()).isEqualByComparingTo("106.67");
        assertThat(daily.get(0).historicalDailyAverage()).isEqualByComparingTo("106.67");
        assertThat(daily.get(1).dailyAmount()).isEqualByComparingTo("160.00");
        assertThat(engine.baseDailyBudget(daily)).isEqualByComparingTo("266.67");
    }

    @Test
    void scalesDailyAllocationsDownToCap() {
        List<DailyAllocation> daily = engine.dailyAllocations(analysis, SPENDING, 30, 30, new BigDecimal("200"));

        assertThat(engine.baseDailyBudget(daily)).isLessThanOrEqualTo(new BigDecimal("200.01"));
        assertThat(daily.get(0).dailyAmount()).isEqualByComparingTo("80.00");
        assertThat(daily.get(1).dailyAmount()).isEqualByComparingTo("120.00");
        assertThat(daily.get(0).historicalDailyAverage()).isEqualByComparingTo("106.67");
    }

    @Test
    void capAboveTotalLeavesAllocationsUntouched() {
        List<DailyAllocation> daily = engine.dailyAllocations(analysis, SPENDING, 30, 30, new BigDecimal("1000"));

        assertThat(engine.baseDailyBudget(daily)).isEqualByComparingTo("266.67");
    }

    @Test
    void monthlyAllocationsCoverFixedNeedsAndSavingsTarget() {
        List<MonthlyAllocation> monthly = engine.monthlyAllocations(analysis, BudgetStrategy.BALANCED.split());

        assertThat(monthly).extracting(MonthlyAllocation::category)
                .containsExactly("Housing & Utilities", AllocationEngine.SAVINGS_CATEGORY);
        assertThat(monthly.get(0).monthlyAmount()).isEqualByComparingTo("25000");
        assertThat(monthly.get(0).fixed()).isTrue();
        assertThat(monthly.get(1).monthlyAmount()).isEqualByComparingTo("10000");
        assertThat(monthly.get(1).fixed()).isFalse();
    }

    @Test
    void underspendRollsOverAndFridayGetsWeekendBonus() {
        LocalDate friday = LocalDate.of(2024, 6, 14);

        List<BehaviorAdjustment> adjustments = engine.behaviorAdjustments(new BigDecimal("300"), new BigDecimal("250"), friday);

        assertThat(adjustments).extracting(BehaviorAdjustment::type)
                .containsExactly(BehaviorAdjustment.Type.ROLLOVER, BehaviorAdjustment.Type.WEEKEND);
        assertThat(adjustments.get(0).amount()).isEqualByComparingTo("50");
        assertThat(adjustments.get(1).amount()).isEqualByComparingTo("60");
        assertThat(engine.effectiveDailyBudget(new BigDecimal("300"), adjustments, friday)).isEqualByComparingTo("410");
    }

    @Test
    void allAdjustmentsComposeAdditivelyInAnyOrder() {
        LocalDate saturdayPayday = LocalDate.of(2024, 6, 15);

        List<BehaviorAdjustment> adjustments = engine.behaviorAdjustments(new BigDecimal("300"), new BigDecimal("400"), saturdayPayday);
        List<BehaviorAdjustment> reversed = new ArrayList<>(adjustments);
        Collections.reverse(reversed);

        assertThat(adjustments).extracting(BehaviorAdjustment::type).containsExactlyInAnyOrder(
                BehaviorAdjustment.Type.OVERSPENDING, BehaviorAdjustment.Type.WEEKEND, BehaviorAdjustment.Type.PAYDAY);
        assertThat(engine.effectiveDailyBudget(new BigDecimal("300"), adjustments, saturdayPayday)).isEqualByComparingTo("305");
        assertThat(engine.effectiveDailyBudget(new BigDecimal("300"), reversed, saturdayPayday)).isEqualByComparingTo("305");
    }

    @Test
    void overspendingCanDriveBudgetNegative() {
        LocalDate wednesday = LocalDate.of(2024, 6, 12);

        List<BehaviorAdjustment> adjustments = engine.behaviorAdjustments(new BigDecimal("100"), new BigDecimal("500"), wednesday);

        assertThat(adjustments).singleElement().satisfies(adjustment -> {
            assertThat(adjustment.type()).isEqualTo(BehaviorAdjustment.Type.OVERSPENDING);
            assertThat(adjustment.amount()).isEqualByComparingTo("-400");
        });
        assertThat(engine.effectiveDailyBudget(new BigDecimal("100"), adjustments, wednesday)).isEqualByComparingTo("-300");
    }

    @Test
    void adjustmentsForOtherDaysAreIgnored() {
        LocalDate friday = LocalDate.of(2024, 6, 14);
        List<BehaviorAdjustment> adjustments = engine.behaviorAdjustments(new BigDecimal("300"), BigDecimal.ZERO, friday);

        assertThat(engine.effectiveDailyBudget(new BigDecimal("300"), adjustments, friday.plusDays(1))).isEqualByComparingTo("300");
    }

    @Test
    void paydaysAreFifteenthThirtiethOrLastDayOfShortMonths() {
        assertThat(AllocationEngine.isPayday(LocalDate.of(2024, 6, 15))).isTrue();
        assertThat(AllocationEngine.isPayday(LocalDate.of(2024, 4, 30))).isTrue();
        assertThat(AllocationEngine.isPayday(LocalDate.of(2024, 2, 29))).isTrue();
        assertThat(AllocationEngine.isPayday(LocalDate.of(2023, 2, 28))).isTrue();
        assertThat(AllocationEngine.isPayday(LocalDate.of(2024, 2, 28))).isFalse();
        assertThat(AllocationEngine.isPayday(LocalDate.of(2024, 3, 31))).isFalse();
        assertThat(AllocationEngine.isPayday(LocalDate.of(2024, 6, 16))).isFalse();
    }
}
