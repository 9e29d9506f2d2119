package com.pocketpilot.budget.service;

import com.pocketpilot.budget.analytics.AllocationEngine;
import com.pocketpilot.budget.analytics.CategoryBudgetCalculator;
import com.pocketpilot.budget.analytics.CategoryClassifier;
import com.pocketpilot.budget.analytics.CoachingTipService;
import com.pocketpilot.budget.analytics.HistoricalDataSelector;
import com.pocketpilot.budget.analytics.NeedClass;
import com.pocketpilot.budget.analytics.StrategyClassifier;
import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.BudgetPrescription;
import com.pocketpilot.budget.model.BudgetPrescription.BehaviorAdjustment;
import com.pocketpilot.budget.model.BudgetPrescription.DailyAllocation;
import com.pocketpilot.budget.model.BudgetPrescription.NetIncomeSource;
import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import com.pocketpilot.budget.model.ConfidenceLevel;
import com.pocketpilot.budget.model.DailyBudget;
import com.pocketpilot.budget.model.MonthDataSelection;
import com.pocketpilot.budget.model.MonthDataSelection.DataQuality;
import com.pocketpilot.budget.model.Transaction;
import com.pocketpilot.budget.model.UserProfile;
import com.pocketpilot.budget.repository.PrescriptionRepository;
import com.pocketpilot.budget.repository.PrescriptionStoreException;
import com.pocketpilot.budget.repository.UserProfileRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Generates, caches and invalidates monthly budget prescriptions.
 *
 * <p>Each read-modify-write of a user's prescription for a month runs under a lock keyed by
 * user and month, so concurrent regenerations are serialized. A generation that overlaps a
 * transaction change is rebuilt, so a prescription computed from outdated transactions never
 * outlives the invalidation that should have removed it.
 */
@Service
public class PrescriptionService {

    private static final Logger log = LoggerFactory.getLogger(PrescriptionService.class);
    private static final Set<String> NON_EARNED_INCOME_CATEGORIES = Set.of("Debt Income", "Emergency Fund Withdrawal");
    private static final int MAX_GENERATION_ATTEMPTS = 3;

    private final PrescriptionRepository prescriptionRepository;
    private final UserProfileRepository userProfileRepository;
    private final MonthlyTransactionCache transactionCache;
    private final HistoricalDataSelector dataSelector;
    private final CategoryClassifier categoryClassifier;
    private final CategoryBudgetCalculator budgetCalculator;
    private final AllocationEngine allocationEngine;
    private final StrategyClassifier strategyClassifier;
    private final CoachingTipService tipService;
    private final PocketPilotProperties.Prescription settings;
    private final int categoryHistoryMonths;
    private final Clock clock;
    private final KeyedLocks<String> locks = new KeyedLocks<>();

    public PrescriptionService(
            PrescriptionRepository prescriptionRepository,
            UserProfileRepository userProfileRepository,
            MonthlyTransactionCache transactionCache,
            HistoricalDataSelector dataSelector,
            CategoryClassifier categoryClassifier,
            CategoryBudgetCalculator budgetCalculator,
            AllocationEngine allocationEngine,
            StrategyClassifier strategyClassifier,
            CoachingTipService tipService,
            PocketPilotProperties properties,
            Clock clock
    ) {
        this.prescriptionRepository = prescriptionRepository;
        this.userProfileRepository = userProfileRepository;
        this.transactionCache = transactionCache;
        this.dataSelector = dataSelector;
        this.categoryClassifier = categoryClassifier;
        this.budgetCalculator = budgetCalculator;
        this.allocationEngine = allocationEngine;
        this.strategyClassifier = strategyClassifier;
        this.tipService = tipService;
        this.settings = properties.prescription();
        this.categoryHistoryMonths = properties.categories().historyMonths();
        this.clock = clock;
    }

    /**
     * Computes and stores a fresh prescription for the month containing {@code today}.
     *
     * @return empty when there is not enough data to budget from yet
     */
    public Optional<BudgetPrescription> generate(UUID userId, LocalDate today) {
        YearMonth month = YearMonth.from(today);
        return withLock(userId, month, () -> doGenerate(userId, today));
    }

    /**
     * Returns the stored prescription while it is within the freshness window, otherwise
     * regenerates it.
     */
    public Optional<BudgetPrescription> getOrGenerate(UUID userId, LocalDate today) {
        YearMonth month = YearMonth.from(today);
        return withLock(userId, month, () -> {
            Optional<BudgetPrescription> existing = prescriptionRepository.findByUserIdAndMonth(userId, month);
            if (existing.isPresent() && !existing.get().isStale(clock.instant(), settings.freshness())) {
                log.debug("Serving stored prescription {}", existing.get().id());
                return existing;
            }
            return doGenerate(userId, today);
        });
    }

    public Optional<DailyBudget> dailyBudget(UUID userId, LocalDate date) {
        return getOrGenerate(userId, date).map(prescription -> {
            BigDecimal base = prescription.totalDailyBudget();
            List<BehaviorAdjustment> adjustments = allocationEngine.behaviorAdjustments(base, flexibleSpendOn(userId, date.minusDays(1)), date);
            BigDecimal effective = allocationEngine.effectiveDailyBudget(base, adjustments, date);
            return new DailyBudget(userId, date, base, adjustments, effective);
        });
    }

    /**
     * Deletes every prescription of the user whose source month is {@code sourceMonth}.
     */
    public int invalidateSourceMonth(UUID userId, YearMonth sourceMonth) {
        transactionCache.invalidate(userId, sourceMonth);
        int removed = prescriptionRepository.deleteByUserIdAndSourceMonth(userId, sourceMonth);
        if (removed > 0) {
            log.info("Invalidated {} prescription(s) for user {} built from {}", removed, userId, sourceMonth);
        }
        return removed;
    }

    private Optional<BudgetPrescription> doGenerate(UUID userId, LocalDate today) {
        for (int attempt = 1; ; attempt++) {
            long dataVersion = transactionCache.version(userId);
            Optional<BudgetPrescription> built = build(userId, today);
            BudgetPrescription saved = built.map(this::persist).orElse(null);
            if (transactionCache.version(userId) == dataVersion) {
                return Optional.ofNullable(saved);
            }
            if (attempt == MAX_GENERATION_ATTEMPTS) {
                if (saved != null) {
                    prescriptionRepository.deleteById(saved.id());
                    log.warn("Transactions of user {} kept changing while generating {}; returning it unsaved", userId, saved.id());
                }
                return Optional.ofNullable(saved);
            }
            log.info("Transactions of user {} changed during generation for {}; rebuilding", userId, YearMonth.from(today));
        }
    }

    private Optional<BudgetPrescription> build(UUID userId, LocalDate today) {
        UserProfile profile = userProfileRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User profile not found"));
        YearMonth month = YearMonth.from(today);

        Map<YearMonth, List<Transaction>> history = new HashMap<>();
        for (int i = 1; i <= dataSelector.lookBackMonths(); i++) {
            YearMonth candidate = month.minusMonths(i);
            history.put(candidate, transactionCache.get(userId, candidate));
        }
        Optional<MonthDataSelection> selected = dataSelector.select(month, history);
        if (selected.isEmpty()) {
            log.info("No spending history for user {}; prescription for {} not generated", userId, month);
            return Optional.empty();
        }
        MonthDataSelection selection = selected.get();

        if (!prescriptionRepository.existsByUserId(userId) && !meetsFirstTimeGate(selection)) {
            log.info("First prescription for user {} deferred: {}% of days and {} transactions in {}",
                    userId, selection.dataCompleteness(), selection.transactionCount(), selection.selectedMonth());
            return Optional.empty();
        }

        SortedMap<String, BigDecimal> spending = categoryClassifier.preserveCategories(
                selection.selectedMonth(), monthlySpending(userId, selection.selectedMonth(), month, history));
        BigDecimal totalSpending = spending.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalSpending.signum() <= 0) {
            log.info("No spending to budget from for user {} in {}", userId, selection.selectedMonth());
            return Optional.empty();
        }

        List<Transaction> sourceTransactions = history.getOrDefault(selection.selectedMonth(), List.of());
        IncomeResolution income = resolveNetIncome(profile, sourceTransactions);
        if (income.amount().signum() <= 0) {
            log.info("Net income for user {} is not positive; prescription for {} not generated", userId, month);
            return Optional.empty();
        }

        int daysInMonth = month.lengthOfMonth();
        CategoryBudgetAnalysis analysis = budgetCalculator.calculate(income.amount(), spending, selection.daysWithData(), daysInMonth);
        BudgetStrategy strategy = strategyClassifier.classify(profile, today);
        BudgetStrategy.Split split = strategy.split(profile.numberOfChildren());

        List<DailyAllocation> daily = allocationEngine.dailyAllocations(analysis, spending, selection.daysWithData(), daysInMonth, null);
        List<BehaviorAdjustment> adjustments = allocationEngine.behaviorAdjustments(
                allocationEngine.baseDailyBudget(daily), flexibleSpendOn(userId, today.minusDays(1)), today);

        Instant now = clock.instant();
        BudgetPrescription prescription = new BudgetPrescription(
                BudgetPrescription.idFor(userId, month),
                userId,
                month,
                selection.selectedMonth(),
                selection.ruleApplied(),
                selection.selectionReason(),
                selection.dataCompleteness(),
                selection.daysWithData(),
                selection.totalDaysInMonth(),
                selection.transactionCount(),
                confidenceFor(selection.quality()),
                income.amount(),
                income.source(),
                strategy,
                split,
                spending,
                analysis,
                daily,
                allocationEngine.monthlyAllocations(analysis, split),
                adjustments,
                tipService.tipsFor(analysis, strategy, split, selection.dataCompleteness()),
                now
        );
        log.info("Generated prescription {} from {} ({}, strategy {}, sustainable={})",
                prescription.id(), selection.selectedMonth(), selection.ruleApplied(), strategy, analysis.sustainable());
        return Optional.of(prescription);
    }

    private BudgetPrescription persist(BudgetPrescription prescription) {
        try {
            return prescriptionRepository.save(prescription);
        } catch (PrescriptionStoreException ex) {
            log.warn("Failed to store prescription {}; returning it unsaved: {}", prescription.id(), ex.getMessage());
            return prescription;
        }
    }

    private boolean meetsFirstTimeGate(MonthDataSelection selection) {
        return selection.dataCompleteness().compareTo(BigDecimal.valueOf(settings.firstTimeMinCompleteness())) >= 0
                || selection.transactionCount() >= settings.firstTimeMinTransactions();
    }

    private Map<YearMonth, SortedMap<String, BigDecimal>> monthlySpending(
            UUID userId, YearMonth sourceMonth, YearMonth currentMonth, Map<YearMonth, List<Transaction>> loaded) {
        Map<YearMonth, SortedMap<String, BigDecimal>> byMonth = new LinkedHashMap<>();
        for (YearMonth m = sourceMonth.minusMonths(categoryHistoryMonths); !m.isAfter(currentMonth); m = m.plusMonths(1)) {
            List<Transaction> transactions = loaded.containsKey(m) ? loaded.get(m) : transactionCache.get(userId, m);
            SortedMap<String, BigDecimal> spending = CategoryClassifier.spendingByCategory(transactions);
            if (!spending.isEmpty()) {
                byMonth.put(m, spending);
            }
        }
        return byMonth;
    }

    /**
     * Declared net income, then declared gross, then income recorded in the source month, then
     * an estimate from the source month's spending.
     */
    IncomeResolution resolveNetIncome(UserProfile profile, List<Transaction> sourceTransactions) {
        if (profile.monthlyNetIncome() != null && profile.monthlyNetIncome().signum() > 0) {
            return new IncomeResolution(money(profile.monthlyNetIncome()), NetIncomeSource.DECLARED_NET);
        }
        if (profile.monthlyGrossIncome() != null && profile.monthlyGrossIncome().signum() > 0) {
            return new IncomeResolution(money(profile.monthlyGrossIncome()), NetIncomeSource.DECLARED_GROSS);
        }
        BigDecimal recorded = sourceTransactions.stream()
                .filter(this::countsAsIncome)
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (recorded.signum() > 0) {
            return new IncomeResolution(money(recorded), NetIncomeSource.SOURCE_MONTH_INCOME);
        }
        BigDecimal sourceSpending = sourceTransactions.stream()
                .filter(tx -> tx.type().isSpending())
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new IncomeResolution(money(sourceSpending.multiply(settings.estimatedIncomeMultiplier())),
                NetIncomeSource.ESTIMATED_FROM_EXPENSES);
    }

    private boolean countsAsIncome(Transaction transaction) {
        return switch (transaction.type()) {
            case INCOME -> !NON_EARNED_INCOME_CATEGORIES.contains(transaction.category());
            case DEBT, EMERGENCY_FUND_WITHDRAWAL -> true;
            default -> false;
        };
    }

    private BigDecimal flexibleSpendOn(UUID userId, LocalDate date) {
        return transactionCache.get(userId, YearMonth.from(date)).stream()
                .filter(tx -> date.equals(tx.occurredOn()))
                .filter(tx -> tx.type().isSpending())
                .filter(tx -> categoryClassifier.classify(tx.category()) == NeedClass.FLEXIBLE_NEED)
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static ConfidenceLevel confidenceFor(DataQuality quality) {
        return switch (quality) {
            case RELIABLE -> ConfidenceLevel.HIGH;
            case STRONG, USABLE -> ConfidenceLevel.MEDIUM;
            default -> ConfidenceLevel.LOW;
        };
    }

    private <T> T withLock(UUID userId, YearMonth month, Supplier<T> action) {
        return locks.withLock(BudgetPrescription.idFor(userId, month), action);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    record IncomeResolution(BigDecimal amount, NetIncomeSource source) {
    }
}
