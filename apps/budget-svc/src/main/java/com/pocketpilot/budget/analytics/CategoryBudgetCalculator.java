package com.pocketpilot.budget.analytics;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis.FixedNeeds;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis.FlexibleNeeds;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis.ValidationCase;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits historical spending into fixed and flexible needs and fits them against net income.
 *
 * <p>Fixed needs are taken at their exact historical amount. Food and transport are projected
 * from their daily average over the logged days, never below the configured daily floors.
 */
@Component
public class CategoryBudgetCalculator {

    private static final Logger log = LoggerFactory.getLogger(CategoryBudgetCalculator.class);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    private static final int RATIO_SCALE = 10;

    static final String WARNING_EXCEEDS_INCOME = "Expenses exceed income";
    static final String WARNING_ADJUSTED = "Flexible categories adjusted to fit net income";
    static final String WARNING_UNSUSTAINABLE = "Budget unsustainable";
    static final String ADJUSTMENT_FIXED_EXCEEDS = "Even minimum food and transport spending cannot be covered after fixed expenses";

    private final BigDecimal foodDailyFloor;
    private final BigDecimal transportDailyFloor;

    @Autowired
    public CategoryBudgetCalculator(PocketPilotProperties properties) {
        this(properties.budget());
    }

    CategoryBudgetCalculator(PocketPilotProperties.Budget budget) {
        this.foodDailyFloor = budget.foodDailyFloor();
        this.transportDailyFloor = budget.transportDailyFloor();
    }

    public CategoryBudgetAnalysis calculate(BigDecimal netIncome, Map<String, BigDecimal> categorySpending, int loggedDays, int daysInTargetMonth) {
        if (netIncome == null || netIncome.signum() <= 0) {
            throw new InvalidBudgetInputException("Net income must be positive");
        }
        if (loggedDays <= 0) {
            throw new InvalidBudgetInputException("Logged days must be positive");
        }
        if (daysInTargetMonth <= 0) {
            throw new InvalidBudgetInputException("Days in target month must be positive");
        }
        if (categorySpending == null) {
            throw new InvalidBudgetInputException("Category spending must be provided");
        }
        BigDecimal net = money(netIncome);
        FixedNeeds fixed = fixedNeeds(categorySpending);
        BigDecimal foodFloor = money(foodDailyFloor.multiply(BigDecimal.valueOf(daysInTargetMonth)));
        BigDecimal transportFloor = money(transportDailyFloor.multiply(BigDecimal.valueOf(daysInTargetMonth)));
        FlexibleNeeds projected = new FlexibleNeeds(
                project(CategoryClassifier.total(categorySpending, BudgetCategory.FOOD), loggedDays, daysInTargetMonth, foodFloor),
                project(CategoryClassifier.total(categorySpending, BudgetCategory.TRANSPORT), loggedDays, daysInTargetMonth, transportFloor)
        );
        Validation validation = validate(net, fixed.total(), projected, foodFloor, transportFloor);
        BigDecimal projectedBudget = fixed.total().add(validation.flexible().total());
        BigDecimal remaining = net.subtract(projectedBudget);

        List<String> warnings = new ArrayList<>();
        if (projectedBudget.compareTo(net) > 0) {
            warnings.add(WARNING_EXCEEDS_INCOME);
        }
        if (!validation.adjustments().isEmpty()) {
            warnings.add(WARNING_ADJUSTED);
        }
        if (!validation.sustainable()) {
            warnings.add(WARNING_UNSUSTAINABLE);
        }
        log.debug("Budget case {} net={} fixed={} flexible={} remaining={}",
                validation.validationCase(), net, fixed.total(), validation.flexible().total(), remaining);
        return new CategoryBudgetAnalysis(
                net,
                fixed,
                validation.flexible(),
                projectedBudget,
                remaining,
                validation.sustainable(),
                validation.validationCase(),
                validation.scaleFactor(),
                warnings,
                validation.adjustments()
        );
    }

    public FixedNeeds fixedNeeds(Map<String, BigDecimal> spending) {
        return new FixedNeeds(
                CategoryClassifier.total(spending, BudgetCategory.HOUSING_AND_UTILITIES),
                CategoryClassifier.total(spending, BudgetCategory.DEBT),
                CategoryClassifier.total(spending, BudgetCategory.GROCERIES),
                CategoryClassifier.total(spending, BudgetCategory.HEALTH_AND_PERSONAL_CARE),
                CategoryClassifier.total(spending, BudgetCategory.EDUCATION),
                CategoryClassifier.total(spending, BudgetCategory.CHILDCARE)
        );
    }

    private BigDecimal project(BigDecimal logged, int loggedDays, int daysInTargetMonth, BigDecimal floor) {
        BigDecimal monthly = money(logged
                .multiply(BigDecimal.valueOf(daysInTargetMonth))
                .divide(BigDecimal.valueOf(loggedDays), RATIO_SCALE, RoundingMode.HALF_UP));
        return monthly.max(floor);
    }

    private Validation validate(BigDecimal net, BigDecimal fixedTotal, FlexibleNeeds flexible, BigDecimal foodFloor, BigDecimal transportFloor) {
        FlexibleNeeds floors = new FlexibleNeeds(foodFloor, transportFloor);
        BigDecimal fixedPlusFloors = fixedTotal.add(floors.total());

        // floors are positive, so fixed needs above income can never leave room for them
        if (fixedTotal.compareTo(net) > 0) {
            return new Validation(ValidationCase.FIXED_EXCEEDS_INCOME, floors, false, null, List.of(ADJUSTMENT_FIXED_EXCEEDS));
        }

        if (fixedTotal.add(flexible.total()).compareTo(net) <= 0) {
            return new Validation(ValidationCase.WITHIN_INCOME, flexible, true, null, List.of());
        }

        if (fixedPlusFloors.compareTo(net) > 0) {
            return new Validation(ValidationCase.FLOORS_EXCEED_INCOME, floors, false, null,
                    List.of("Fixed expenses plus minimum food and transport exceed net income"));
        }

        BigDecimal available = net.subtract(fixedTotal);
        BigDecimal scale = available.divide(flexible.total(), RATIO_SCALE, RoundingMode.HALF_UP);
        List<String> adjustments = new ArrayList<>();
        adjustments.add("Scaled food and transport by " + scale.setScale(4, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString()
                + " to fit within net income");

        BigDecimal food = money(flexible.food().multiply(scale));
        BigDecimal transport = available.subtract(food);
        if (food.compareTo(foodFloor) < 0) {
            food = foodFloor;
            transport = available.subtract(food).max(transportFloor);
            adjustments.add("Food raised to its minimum; transport takes the remaining budget");
        } else if (transport.compareTo(transportFloor) < 0) {
            transport = transportFloor;
            food = available.subtract(transport).max(foodFloor);
            adjustments.add("Transport raised to its minimum; food takes the remaining budget");
        }
        FlexibleNeeds adjusted = new FlexibleNeeds(food, transport);
        boolean sustainable = fixedTotal.add(adjusted.total()).compareTo(net) <= 0;
        return new Validation(ValidationCase.PROPORTIONAL_SCALING, adjusted, sustainable, scale, adjustments);
    }

    private static BigDecimal money(BigDecimal value) {
        return value == null ? ZERO : value.setScale(2, RoundingMode.HALF_UP);
    }

    private record Validation(
            ValidationCase validationCase,
            FlexibleNeeds flexible,
            boolean sustainable,
            BigDecimal scaleFactor,
            List<String> adjustments
    ) {
    }
}
