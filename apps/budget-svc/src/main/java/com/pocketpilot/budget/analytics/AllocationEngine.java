package com.pocketpilot.budget.analytics;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.BudgetPrescription.BehaviorAdjustment;
import com.pocketpilot.budget.model.BudgetPrescription.DailyAllocation;
import com.pocketpilot.budget.model.BudgetPrescription.MonthlyAllocation;
import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis.FixedNeeds;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns an analysis into daily and monthly allocations and computes the same-day behavior
 * adjustments applied on top of the base daily budget.
 */
@Component
public class AllocationEngine {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Set<DayOfWeek> WEEKEND_DAYS = EnumSet.of(DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);
    private static final int SECOND_PAYDAY = 30;
    private static final int FIRST_PAYDAY = 15;
    public static final String SAVINGS_CATEGORY = "Savings";

    private final BigDecimal weekendBonusRate;
    private final BigDecimal paydayBonusRate;

    @Autowired
    public AllocationEngine(PocketPilotProperties properties) {
        this(properties.adjustments());
    }

    AllocationEngine(PocketPilotProperties.Adjustments adjustments) {
        this.weekendBonusRate = adjustments.weekendBonusRate();
        this.paydayBonusRate = adjustments.paydayBonusRate();
    }

    /**
     * Daily allocations for food and transport. When {@code maxDailyBudget} is given and the
     * allocations exceed it, every allocation is scaled down by the same factor.
     */
    public List<DailyAllocation> dailyAllocations(
            CategoryBudgetAnalysis analysis,
            Map<String, BigDecimal> sourceSpending,
            int loggedDays,
            int daysInTargetMonth,
            BigDecimal maxDailyBudget
    ) {
        if (daysInTargetMonth <= 0) {
            throw new InvalidBudgetInputException("Days in target month must be positive");
        }
        BigDecimal days = BigDecimal.valueOf(daysInTargetMonth);
        BigDecimal food = analysis.flexibleNeeds().food().divide(days, 2, RoundingMode.HALF_UP);
        BigDecimal transport = analysis.flexibleNeeds().transport().divide(days, 2, RoundingMode.HALF_UP);

        BigDecimal total = food.add(transport);
        if (maxDailyBudget != null && maxDailyBudget.signum() >= 0 && total.compareTo(maxDailyBudget) > 0 && total.signum() > 0) {
            BigDecimal factor = maxDailyBudget.divide(total, 10, RoundingMode.HALF_UP);
            food = food.multiply(factor).setScale(2, RoundingMode.HALF_UP);
            transport = transport.multiply(factor).setScale(2, RoundingMode.HALF_UP);
        }

        List<DailyAllocation> allocations = new ArrayList<>();
        allocations.add(new DailyAllocation(
                BudgetCategory.FOOD.displayName(),
                food,
                historicalDailyAverage(sourceSpending, BudgetCategory.FOOD, loggedDays),
                "Meals and dining out"
        ));
        allocations.add(new DailyAllocation(
                BudgetCategory.TRANSPORT.displayName(),
                transport,
                historicalDailyAverage(sourceSpending, BudgetCategory.TRANSPORT, loggedDays),
                "Commute and travel"
        ));
        return allocations;
    }

    /**
     * Monthly allocations for every non-zero fixed need, followed by the strategy's savings
     * target.
     */
    public List<MonthlyAllocation> monthlyAllocations(CategoryBudgetAnalysis analysis, BudgetStrategy.Split split) {
        FixedNeeds fixed = analysis.fixedNeeds();
        List<MonthlyAllocation> allocations = new ArrayList<>();
        addFixed(allocations, BudgetCategory.HOUSING_AND_UTILITIES, fixed.housingAndUtilities(), "Rent, mortgage and utility bills");
        addFixed(allocations, BudgetCategory.DEBT, fixed.debt(), "Loan and credit payments");
        addFixed(allocations, BudgetCategory.GROCERIES, fixed.groceries(), "Grocery shopping");
        addFixed(allocations, BudgetCategory.HEALTH_AND_PERSONAL_CARE, fixed.healthAndPersonalCare(), "Medical and personal care");
        addFixed(allocations, BudgetCategory.EDUCATION, fixed.education(), "Tuition and school expenses");
        addFixed(allocations, BudgetCategory.CHILDCARE, fixed.childcare(), "Childcare and child expenses");
        if (split != null) {
            BigDecimal savings = analysis.netIncome()
                    .multiply(BigDecimal.valueOf(split.savingsPercent()))
                    .divide(HUNDRED, 2, RoundingMode.HALF_UP);
            if (savings.signum() > 0) {
                allocations.add(new MonthlyAllocation(SAVINGS_CATEGORY, savings, false,
                        split.savingsPercent() + "% of net income set aside"));
            }
        }
        return allocations;
    }

    public BigDecimal baseDailyBudget(Collection<DailyAllocation> allocations) {
        return allocations.stream()
                .map(DailyAllocation::dailyAmount)
                .reduce(ZERO, BigDecimal::add);
    }

    /**
     * Adjustments effective on {@code date}. Amounts are signed and never clamped.
     *
     * @param yesterdaySpent flexible spending recorded the day before {@code date}
     */
    public List<BehaviorAdjustment> behaviorAdjustments(BigDecimal baseDailyBudget, BigDecimal yesterdaySpent, LocalDate date) {
        BigDecimal base = baseDailyBudget.setScale(2, RoundingMode.HALF_UP);
        BigDecimal spent = yesterdaySpent == null ? ZERO : yesterdaySpent.setScale(2, RoundingMode.HALF_UP);
        List<BehaviorAdjustment> adjustments = new ArrayList<>();
        int comparison = spent.compareTo(base);
        if (comparison < 0) {
            adjustments.add(new BehaviorAdjustment(BehaviorAdjustment.Type.ROLLOVER, base.subtract(spent),
                    "Unused budget from yesterday carries over", date));
        } else if (comparison > 0) {
            adjustments.add(new BehaviorAdjustment(BehaviorAdjustment.Type.OVERSPENDING, base.subtract(spent),
                    "Yesterday's overspending reduces today's budget", date));
        }
        if (WEEKEND_DAYS.contains(date.getDayOfWeek())) {
            adjustments.add(new BehaviorAdjustment(BehaviorAdjustment.Type.WEEKEND,
                    base.multiply(weekendBonusRate).setScale(2, RoundingMode.HALF_UP),
                    "Weekend allowance for social activities", date));
        }
        if (isPayday(date)) {
            adjustments.add(new BehaviorAdjustment(BehaviorAdjustment.Type.PAYDAY,
                    base.multiply(paydayBonusRate).setScale(2, RoundingMode.HALF_UP),
                    "Payday allowance", date));
        }
        return adjustments;
    }

    public BigDecimal effectiveDailyBudget(BigDecimal baseDailyBudget, Collection<BehaviorAdjustment> adjustments, LocalDate date) {
        return adjustments.stream()
                .filter(adjustment -> date.equals(adjustment.effectiveDate()))
                .map(BehaviorAdjustment::amount)
                .reduce(baseDailyBudget.setScale(2, RoundingMode.HALF_UP), BigDecimal::add);
    }

    static boolean isPayday(LocalDate date) {
        int day = date.getDayOfMonth();
        if (day == FIRST_PAYDAY || day == SECOND_PAYDAY) {
            return true;
        }
        return date.lengthOfMonth() < SECOND_PAYDAY && day == date.lengthOfMonth();
    }

    private BigDecimal historicalDailyAverage(Map<String, BigDecimal> spending, BudgetCategory category, int loggedDays) {
        if (loggedDays <= 0) {
            return ZERO;
        }
        return CategoryClassifier.total(spending, category).divide(BigDecimal.valueOf(loggedDays), 2, RoundingMode.HALF_UP);
    }

    private void addFixed(List<MonthlyAllocation> allocations, BudgetCategory category, BigDecimal amount, String description) {
        if (amount.signum() > 0) {
            allocations.add(new MonthlyAllocation(category.displayName(), amount, true, description));
        }
    }
}
