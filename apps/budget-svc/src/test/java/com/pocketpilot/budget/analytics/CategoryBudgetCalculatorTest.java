package com.pocketpilot.budget.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis.ValidationCase;
import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CategoryBudgetCalculatorTest {

    private CategoryBudgetCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new CategoryBudgetCalculator(PocketPilotProperties.defaults());
    }

    @Test
    void acceptsProjectionThatFitsIncome() {
        CategoryBudgetAnalysis analysis = calculator.calculate(
                new BigDecimal("50000"),
                spending("Housing & Utilities", "25000", "Food", "3200", "Transportation", "4800"),
                30, 30);

        assertThat(analysis.validationCase()).isEqualTo(ValidationCase.WITHIN_INCOME);
        assertThat(analysis.flexibleNeeds().food()).isEqualByComparingTo("3200");
        assertThat(analysis.flexibleNeeds().transport()).isEqualByComparingTo("4800");
        assertThat(analysis.projectedBudget()).isEqualByComparingTo("33000");
        assertThat(analysis.remainingBudget()).isEqualByComparingTo("17000");
        assertThat(analysis.sustainable()).isTrue();
        assertThat(analysis.warnings()).isEmpty();
        assertThat(analysis.scaleFactor()).isNull();
    }

    @Test
    void scalesFlexibleNeedsAndRederivesTransportWhenFoodHitsFloor() {
        CategoryBudgetAnalysis analysis = calculator.calculate(
                new BigDecimal("30000"),
                spending("Housing & Utilities", "25000", "Food", "3200", "Transportation", "4800"),
                30, 30);

        assertThat(analysis.validationCase()).isEqualTo(ValidationCase.PROPORTIONAL_SCALING);
        assertThat(analysis.scaleFactor()).isEqualByComparingTo("0.625");
        assertThat(analysis.flexibleNeeds().food()).isEqualByComparingTo("3000");
        assertThat(analysis.flexibleNeeds().transport()).isEqualByComparingTo("2000");
        assertThat(analysis.projectedBudget()).isEqualByComparingTo("30000");
        assertThat(analysis.remainingBudget()).isEqualByComparingTo("0");
        assertThat(analysis.sustainable()).isTrue();
        assertThat(analysis.warnings()).containsExactly(CategoryBudgetCalculator.WARNING_ADJUSTED);
    }

    @Test
    void rederivesFoodWhenTransportHitsFloor() {
        CategoryBudgetAnalysis analysis = calculator.calculate(
                new BigDecimal("30000"),
                spending("Housing & Utilities", "25000", "Food", "7000", "Transportation", "1600"),
                30, 30);

        assertThat(analysis.validationCase()).isEqualTo(ValidationCase.PROPORTIONAL_SCALING);
        assertThat(analysis.flexibleNeeds().transport()).isEqualByComparingTo("1500");
        assertThat(analysis.flexibleNeeds().food()).isEqualByComparingTo("3500");
        assertThat(analysis.projectedBudget()).isEqualByComparingTo("30000");
    }

    @Test
    void fixedAboveIncomeDropsFlexibleToFloors() {
        CategoryBudgetAnalysis analysis = calculator.calculate(
                new BigDecimal("30000"),
                spending("Housing & Utilities", "20000", "Debt/Loans", "12000", "Food", "9000", "Transportation", "6000"),
                30, 30);

        assertThat(analysis.validationCase()).isEqualTo(ValidationCase.FIXED_EXCEEDS_INCOME);
        assertThat(analysis.fixedNeeds().debt()).isEqualByComparingTo("12000");
        assertThat(analysis.flexibleNeeds().food()).isEqualByComparingTo("3000");
        assertThat(analysis.flexibleNeeds().transport()).isEqualByComparingTo("1500");
        assertThat(analysis.remainingBudget()).isEqualByComparingTo("-6500");
        assertThat(analysis.sustainable()).isFalse();
        assertThat(analysis.adjustments()).containsExactly(CategoryBudgetCalculator.ADJUSTMENT_FIXED_EXCEEDS);
        assertThat(analysis.warnings()).containsExactly(
                CategoryBudgetCalculator.WARNING_EXCEEDS_INCOME,
                CategoryBudgetCalculator.WARNING_ADJUSTED,
                CategoryBudgetCalculator.WARNING_UNSUSTAINABLE);
    }

    @Test
    void floorsAboveIncomeAreUnsustainableWithoutScaling() {
        CategoryBudgetAnalysis analysis = calculator.calculate(
                new BigDecimal("30000"),
                spending("Housing & Utilities", "27000", "Food", "3200", "Transportation", "4800"),
                30, 30);

        assertThat(analysis.validationCase()).isEqualTo(ValidationCase.FLOORS_EXCEED_INCOME);
        assertThat(analysis.scaleFactor()).isNull();
        assertThat(analysis.flexibleNeeds().food()).isEqualByComparingTo("3000");
        assertThat(analysis.flexibleNeeds().transport()).isEqualByComparingTo("1500");
        assertThat(analysis.remainingBudget()).isEqualByComparingTo("-1500");
        assertThat(analysis.sustainable()).isFalse();
    }

    @Test
    void projectsDailyAverageOntoTargetMonthWithFloors() {
        CategoryBudgetAnalysis analysis = calculator.calculate(
                new BigDecimal("100000"),
                spending("Food", "4000", "Transport", "500"),
                20, 31);

        assertThat(analysis.flexibleNeeds().food()).isEqualByComparingTo("6200");
        assertThat(analysis.flexibleNeeds().transport()).isEqualByComparingTo("1550");
    }

    @Test
    void sumsAliasesOfTheSameCategory() {
        CategoryBudgetAnalysis analysis = calculator.calculate(
                new BigDecimal("100000"),
                spending("Housing & Utilities", "1000", "Housing and Utilities", "500", "Loan Payment", "700", "Debt", "300"),
                10, 30);

        assertThat(analysis.fixedNeeds().housingAndUtilities()).isEqualByComparingTo("1500");
        assertThat(analysis.fixedNeeds().debt()).isEqualByComparingTo("1000");
    }

    @Test
    void projectedBudgetAlwaysEqualsFixedPlusFlexible() {
        String[][] cases = {
                {"50000", "25000", "3200", "4800"},
                {"30000", "25000", "3200", "4800"},
                {"30000", "27000", "3200", "4800"},
                {"30000", "32000", "9000", "6000"},
                {"12345.67", "3333.33", "1111.11", "2222.22"}
        };
        for (String[] c : cases) {
            CategoryBudgetAnalysis analysis = calculator.calculate(
                    new BigDecimal(c[0]),
                    spending("Groceries", c[1], "Food", c[2], "Transportation", c[3]),
                    17, 31);
            assertThat(analysis.projectedBudget())
                    .isEqualByComparingTo(analysis.fixedNeeds().total().add(analysis.flexibleNeeds().total()));
            assertThat(analysis.flexibleNeeds().food()).isGreaterThanOrEqualTo(new BigDecimal("3100"));
            assertThat(analysis.flexibleNeeds().transport()).isGreaterThanOrEqualTo(new BigDecimal("1550"));
        }
    }

    @Test
    void rejectsNonPositiveIncome() {
        assertThatThrownBy(() -> calculator.calculate(BigDecimal.ZERO, Map.of(), 10, 30))
                .isInstanceOf(InvalidBudgetInputException.class)
                .hasMessageContaining("Net income");
    }

    @Test
    void rejectsNonPositiveLoggedDays() {
        assertThatThrownBy(() -> calculator.calculate(new BigDecimal("1000"), Map.of(), 0, 30))
                .isInstanceOf(InvalidBudgetInputException.class)
                .hasMessageContaining("Logged days");
    }

    private static Map<String, BigDecimal> spending(String... pairs) {
        Map<String, BigDecimal> map = new TreeMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], new BigDecimal(pairs[i + 1]));
        }
        return map;
    }
}
