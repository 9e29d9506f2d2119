package com.pocketpilot.budget.analytics;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps category labels onto the budget taxonomy and decides which historical categories carry
 * into a new budget.
 */
@Component
public class CategoryClassifier {

    private final int inactiveAfterMonths;

    @Autowired
    public CategoryClassifier(PocketPilotProperties properties) {
        this(properties.categories().inactiveAfterMonths());
    }

    CategoryClassifier(int inactiveAfterMonths) {
        this.inactiveAfterMonths = inactiveAfterMonths;
    }

    public NeedClass classify(String label) {
        return BudgetCategory.fromLabel(label)
                .map(BudgetCategory::needClass)
                .orElse(NeedClass.EXCLUDED);
    }

    /**
     * Sum of an exact category and all of its aliases in the given spending map.
     */
    public static BigDecimal total(Map<String, BigDecimal> spending, BudgetCategory category) {
        BigDecimal sum = BigDecimal.ZERO;
        for (String label : category.labels()) {
            BigDecimal value = spending.get(label);
            if (value != null) {
                sum = sum.add(value);
            }
        }
        return sum.setScale(2, RoundingMode.HALF_UP);
    }

    public static SortedMap<String, BigDecimal> spendingByCategory(Collection<Transaction> transactions) {
        return transactions.stream()
                .filter(tx -> tx.type().isSpending())
                .collect(Collectors.groupingBy(
                        Transaction::category,
                        TreeMap::new,
                        Collectors.reducing(BigDecimal.ZERO, Transaction::amount, BigDecimal::add)
                ));
    }

    /**
     * Builds the spending map used for a budget. Categories present in the source month keep
     * their source value; other categories seen within the activity window get their average
     * over the months they appeared in; categories idle for too long are dropped.
     *
     * @param sourceMonth     the month selected as the basis of the budget
     * @param monthlySpending spending per month across the history window
     */
    public SortedMap<String, BigDecimal> preserveCategories(YearMonth sourceMonth, Map<YearMonth, ? extends Map<String, BigDecimal>> monthlySpending) {
        SortedMap<String, BigDecimal> preserved = new TreeMap<>();
        Map<String, BigDecimal> source = monthlySpending.containsKey(sourceMonth) ? monthlySpending.get(sourceMonth) : Map.of();
        source.forEach((category, amount) -> {
            if (amount != null && amount.signum() > 0) {
                preserved.put(category, amount.setScale(2, RoundingMode.HALF_UP));
            }
        });

        Map<String, YearMonth> lastSeen = new HashMap<>();
        Map<String, BigDecimal> totals = new HashMap<>();
        Map<String, Integer> monthsSeen = new HashMap<>();
        monthlySpending.forEach((month, spending) -> spending.forEach((category, amount) -> {
            if (amount == null || amount.signum() <= 0) {
                return;
            }
            lastSeen.merge(category, month, (a, b) -> a.isAfter(b) ? a : b);
            totals.merge(category, amount, BigDecimal::add);
            monthsSeen.merge(category, 1, Integer::sum);
        }));

        YearMonth cutoff = sourceMonth.minusMonths(inactiveAfterMonths);
        for (Map.Entry<String, YearMonth> entry : lastSeen.entrySet()) {
            String category = entry.getKey();
            if (preserved.containsKey(category)) {
                continue;
            }
            if (!entry.getValue().isAfter(cutoff)) {
                continue;
            }
            BigDecimal average = totals.get(category)
                    .divide(BigDecimal.valueOf(monthsSeen.get(category)), 2, RoundingMode.HALF_UP);
            preserved.put(category, average);
        }
        return preserved;
    }
}
