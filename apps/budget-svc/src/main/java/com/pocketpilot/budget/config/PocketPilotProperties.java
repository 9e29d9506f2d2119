package com.pocketpilot.budget.config;

import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "pocketpilot")
public record PocketPilotProperties(
        Budget budget,
        Adjustments adjustments,
        Selection selection,
        Prescription prescription,
        Categories categories,
        Cache cache
) {

    @ConstructorBinding
    public PocketPilotProperties {
        // every section is optional; accessors fall back to defaults
    }

    public static PocketPilotProperties defaults() {
        return new PocketPilotProperties(null, null, null, null, null, null);
    }

    public Budget budget() {
        return budget != null ? budget : new Budget(null, null);
    }

    public Adjustments adjustments() {
        return adjustments != null ? adjustments : new Adjustments(null, null);
    }

    public Selection selection() {
        return selection != null ? selection : new Selection(null, null, null, null, null, null, null);
    }

    public Prescription prescription() {
        return prescription != null ? prescription : new Prescription(null, null, null, null, null, null);
    }

    public Categories categories() {
        return categories != null ? categories : new Categories(null, null);
    }

    public Cache cache() {
        return cache != null ? cache : new Cache(null);
    }

    /**
     * Minimum daily amounts for the flexible categories.
     */
    public record Budget(BigDecimal foodDailyFloor, BigDecimal transportDailyFloor) {
        public Budget {
            foodDailyFloor = foodDailyFloor != null ? foodDailyFloor : new BigDecimal("100");
            transportDailyFloor = transportDailyFloor != null ? transportDailyFloor : new BigDecimal("50");
            if (foodDailyFloor.signum() < 0 || transportDailyFloor.signum() < 0) {
                throw new IllegalArgumentException("daily floors must not be negative");
            }
        }
    }

    public record Adjustments(BigDecimal weekendBonusRate, BigDecimal paydayBonusRate) {
        public Adjustments {
            weekendBonusRate = weekendBonusRate != null ? weekendBonusRate : new BigDecimal("0.20");
            paydayBonusRate = paydayBonusRate != null ? paydayBonusRate : new BigDecimal("0.15");
            if (weekendBonusRate.signum() < 0 || paydayBonusRate.signum() < 0) {
                throw new IllegalArgumentException("bonus rates must not be negative");
            }
        }
    }

    /**
     * Quality thresholds used to grade a month of history. A month reaches a tier when either its
     * completeness percentage or its spending transaction count meets the tier's threshold.
     */
    public record Selection(
            Integer reliableCompleteness,
            Integer reliableTransactions,
            Integer strongCompleteness,
            Integer strongTransactions,
            Integer usableCompleteness,
            Integer usableTransactions,
            Integer lookBackMonths
    ) {
        public Selection {
            reliableCompleteness = reliableCompleteness != null ? reliableCompleteness : 80;
            reliableTransactions = reliableTransactions != null ? reliableTransactions : 25;
            strongCompleteness = strongCompleteness != null ? strongCompleteness : 70;
            strongTransactions = strongTransactions != null ? strongTransactions : 20;
            usableCompleteness = usableCompleteness != null ? usableCompleteness : 50;
            usableTransactions = usableTransactions != null ? usableTransactions : 15;
            lookBackMonths = lookBackMonths != null ? lookBackMonths : 12;
            if (lookBackMonths <= 0) {
                throw new IllegalArgumentException("lookBackMonths must be positive");
            }
            if (reliableCompleteness < strongCompleteness || strongCompleteness < usableCompleteness) {
                throw new IllegalArgumentException("completeness thresholds must be ordered reliable >= strong >= usable");
            }
            if (reliableTransactions < strongTransactions || strongTransactions < usableTransactions) {
                throw new IllegalArgumentException("transaction thresholds must be ordered reliable >= strong >= usable");
            }
        }
    }

    public record Prescription(
            Duration freshness,
            Integer firstTimeMinCompleteness,
            Integer firstTimeMinTransactions,
            BigDecimal estimatedIncomeMultiplier,
            Integer maxAnalysisTips,
            Integer maxStrategyTips
    ) {
        public Prescription {
            freshness = freshness != null ? freshness : Duration.ofHours(6);
            firstTimeMinCompleteness = firstTimeMinCompleteness != null ? firstTimeMinCompleteness : 50;
            firstTimeMinTransactions = firstTimeMinTransactions != null ? firstTimeMinTransactions : 15;
            estimatedIncomeMultiplier = estimatedIncomeMultiplier != null ? estimatedIncomeMultiplier : new BigDecimal("1.2");
            maxAnalysisTips = maxAnalysisTips != null ? maxAnalysisTips : 5;
            maxStrategyTips = maxStrategyTips != null ? maxStrategyTips : 3;
            if (freshness.isNegative()) {
                throw new IllegalArgumentException("freshness must not be negative");
            }
            if (estimatedIncomeMultiplier.signum() <= 0) {
                throw new IllegalArgumentException("estimatedIncomeMultiplier must be positive");
            }
        }
    }

    public record Categories(Integer historyMonths, Integer inactiveAfterMonths) {
        public Categories {
            historyMonths = historyMonths != null ? historyMonths : 12;
            inactiveAfterMonths = inactiveAfterMonths != null ? inactiveAfterMonths : 6;
            if (historyMonths <= 0 || inactiveAfterMonths <= 0) {
                throw new IllegalArgumentException("category windows must be positive");
            }
        }
    }

    public record Cache(Duration transactionTtl) {
        public Cache {
            transactionTtl = transactionTtl != null ? transactionTtl : Duration.ofHours(1);
        }
    }
}
