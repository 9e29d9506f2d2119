package com.pocketpilot.budget.analytics;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.MonthDataSelection;
import com.pocketpilot.budget.model.MonthDataSelection.DataQuality;
import com.pocketpilot.budget.model.MonthDataSelection.SelectionRule;
import com.pocketpilot.budget.model.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Chooses which past month's spending a new budget is based on.
 *
 * <p>The previous month is carried forward when it is at least usable. Otherwise the most
 * recent reliable month within the look-back window wins, then the previous month if it has any
 * spending at all, then the most recent month with any spending.
 */
@Component
public class HistoricalDataSelector {

    private static final Logger log = LoggerFactory.getLogger(HistoricalDataSelector.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PocketPilotProperties.Selection thresholds;

    @Autowired
    public HistoricalDataSelector(PocketPilotProperties properties) {
        this(properties.selection());
    }

    HistoricalDataSelector(PocketPilotProperties.Selection thresholds) {
        this.thresholds = thresholds;
    }

    public int lookBackMonths() {
        return thresholds.lookBackMonths();
    }

    /**
     * @param currentMonth month the budget is for; never a candidate itself
     * @param history      transactions per month; missing months are treated as empty
     */
    public Optional<MonthDataSelection> select(YearMonth currentMonth, Map<YearMonth, List<Transaction>> history) {
        YearMonth previous = currentMonth.minusMonths(1);
        MonthSnapshot previousSnapshot = snapshot(previous, history.getOrDefault(previous, List.of()));
        Step step = Step.EVALUATE_PREVIOUS;
        while (true) {
            switch (step) {
                case EVALUATE_PREVIOUS -> {
                    SelectionRule rule = switch (previousSnapshot.quality()) {
                        case RELIABLE -> SelectionRule.PREVIOUS_MONTH_RELIABLE;
                        case STRONG -> SelectionRule.PREVIOUS_MONTH_STRONG;
                        case USABLE -> SelectionRule.PREVIOUS_MONTH_USABLE;
                        default -> null;
                    };
                    if (rule != null) {
                        return Optional.of(toSelection(previousSnapshot, rule));
                    }
                    step = Step.SEARCH_LAST_RELIABLE;
                }
                case SEARCH_LAST_RELIABLE -> {
                    Optional<MonthSnapshot> reliable = olderMonths(currentMonth, history)
                            .filter(snapshot -> snapshot.quality() == DataQuality.RELIABLE)
                            .findFirst();
                    if (reliable.isPresent()) {
                        return Optional.of(toSelection(reliable.get(), SelectionRule.LAST_RELIABLE_MONTH));
                    }
                    step = Step.FALLBACK_PREVIOUS;
                }
                case FALLBACK_PREVIOUS -> {
                    if (previousSnapshot.quality() != DataQuality.EMPTY) {
                        return Optional.of(toSelection(previousSnapshot, SelectionRule.FALLBACK_PREVIOUS_MONTH));
                    }
                    step = Step.FALLBACK_MOST_RECENT;
                }
                case FALLBACK_MOST_RECENT -> {
                    Optional<MonthSnapshot> recent = olderMonths(currentMonth, history)
                            .filter(snapshot -> snapshot.quality() != DataQuality.EMPTY)
                            .findFirst();
                    if (recent.isPresent()) {
                        return Optional.of(toSelection(recent.get(), SelectionRule.FALLBACK_MOST_RECENT_MONTH));
                    }
                    step = Step.FAILED;
                }
                case FAILED -> {
                    log.debug("No month with spending data found before {}", currentMonth);
                    return Optional.empty();
                }
                default -> throw new IllegalStateException("Unhandled selection step " + step);
            }
        }
    }

    public DataQuality grade(BigDecimal completeness, int transactionCount) {
        if (transactionCount == 0) {
            return DataQuality.EMPTY;
        }
        if (meets(completeness, transactionCount, thresholds.reliableCompleteness(), thresholds.reliableTransactions())) {
            return DataQuality.RELIABLE;
        }
        if (meets(completeness, transactionCount, thresholds.strongCompleteness(), thresholds.strongTransactions())) {
            return DataQuality.STRONG;
        }
        if (meets(completeness, transactionCount, thresholds.usableCompleteness(), thresholds.usableTransactions())) {
            return DataQuality.USABLE;
        }
        return DataQuality.INSUFFICIENT;
    }

    MonthSnapshot snapshot(YearMonth month, List<Transaction> transactions) {
        List<Transaction> spending = transactions.stream()
                .filter(tx -> tx.type().isSpending())
                .filter(tx -> month.equals(tx.month()))
                .toList();
        Set<LocalDate> days = spending.stream().map(Transaction::occurredOn).collect(Collectors.toSet());
        int totalDays = month.lengthOfMonth();
        BigDecimal completeness = BigDecimal.valueOf(days.size())
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalDays), 2, RoundingMode.HALF_UP);
        return new MonthSnapshot(
                month,
                CategoryClassifier.spendingByCategory(spending),
                days.size(),
                totalDays,
                spending.size(),
                completeness,
                grade(completeness, spending.size())
        );
    }

    private Stream<MonthSnapshot> olderMonths(YearMonth currentMonth, Map<YearMonth, List<Transaction>> history) {
        return IntStream.rangeClosed(1, thresholds.lookBackMonths())
                .mapToObj(currentMonth::minusMonths)
                .map(month -> snapshot(month, history.getOrDefault(month, List.of())));
    }

    private boolean meets(BigDecimal completeness, int transactionCount, int minCompleteness, int minTransactions) {
        return completeness.compareTo(BigDecimal.valueOf(minCompleteness)) >= 0 || transactionCount >= minTransactions;
    }

    private MonthDataSelection toSelection(MonthSnapshot snapshot, SelectionRule rule) {
        String reason = describe(snapshot, rule);
        log.debug("Selected {} via {}: {}", snapshot.month(), rule, reason);
        return new MonthDataSelection(
                snapshot.month(),
                snapshot.spending(),
                snapshot.daysWithData(),
                snapshot.totalDays(),
                snapshot.transactionCount(),
                snapshot.completeness(),
                snapshot.quality(),
                rule,
                reason
        );
    }

    private String describe(MonthSnapshot snapshot, SelectionRule rule) {
        String stats = String.format("%s: %s%% of days logged, %d transactions",
                snapshot.month(), snapshot.completeness().stripTrailingZeros().toPlainString(), snapshot.transactionCount());
        return switch (rule) {
            case PREVIOUS_MONTH_RELIABLE -> "Previous month has reliable data (" + stats + ")";
            case PREVIOUS_MONTH_STRONG -> "Previous month has strong data (" + stats + ")";
            case PREVIOUS_MONTH_USABLE -> "Previous month has usable data (" + stats + ")";
            case LAST_RELIABLE_MONTH -> "Previous month is incomplete; using last reliable month (" + stats + ")";
            case FALLBACK_PREVIOUS_MONTH -> "No reliable month found; using previous month as is (" + stats + ")";
            case FALLBACK_MOST_RECENT_MONTH -> "No recent data; using most recent month with spending (" + stats + ")";
        };
    }

    private enum Step {
        EVALUATE_PREVIOUS,
        SEARCH_LAST_RELIABLE,
        FALLBACK_PREVIOUS,
        FALLBACK_MOST_RECENT,
        FAILED
    }

    record MonthSnapshot(
            YearMonth month,
            SortedMap<String, BigDecimal> spending,
            int daysWithData,
            int totalDays,
            int transactionCount,
            BigDecimal completeness,
            DataQuality quality
    ) {
    }
}
