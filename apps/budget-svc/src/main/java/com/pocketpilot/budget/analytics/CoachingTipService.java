package com.pocketpilot.budget.analytics;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.BudgetPrescription.BudgetingTip;
import com.pocketpilot.budget.model.BudgetStrategy;
import com.pocketpilot.budget.model.CategoryBudgetAnalysis;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class CoachingTipService {

    static final String ANALYSIS_CATEGORY = "Budget Analysis";
    static final String STRATEGY_CATEGORY = "Strategy";
    static final String PROGRESS_CATEGORY = "Tracking Progress";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ALMOST_THERE = BigDecimal.valueOf(60);
    private static final BigDecimal GREAT_JOB = BigDecimal.valueOf(70);
    private static final BigDecimal EXCELLENT = BigDecimal.valueOf(80);

    private static final Map<BudgetStrategy, List<TipTemplate>> STRATEGY_TIPS = new EnumMap<>(BudgetStrategy.class);
    // family-centric tips by household tier, keyed on the tier's split
    private static final Map<BudgetStrategy.Split, List<TipTemplate>> FAMILY_TIER_TIPS = new HashMap<>();

    static {
        STRATEGY_TIPS.put(BudgetStrategy.DEBT_HEAVY_RECOVERY, List.of(
                new TipTemplate("Attack the Costliest Debt", "Extra payments on the highest-interest balance save the most money.", "List your debts by interest rate and pay extra on the top one.", 1),
                new TipTemplate("Pause New Credit", "Every new charge pushes your debt-free date further away.", "Leave credit cards at home for the rest of the month.", 2),
                new TipTemplate("Keep a Small Cushion", "A modest emergency buffer stops surprises from becoming new debt.", "Set aside a little each payday until you hold one month of essentials.", 3),
                new TipTemplate("Short-Term Sacrifice", "Cutting wants now shortens the time you spend repaying.", "Pick one recurring want to drop until your first debt is cleared.", 4)));
        STRATEGY_TIPS.put(BudgetStrategy.RISK_CONTROL, List.of(
                new TipTemplate("Grow Your Safety Net", "With uneven income, savings carry you through lean months.", "Aim for three to six months of expenses in an emergency fund.", 1),
                new TipTemplate("Budget on a Lean Month", "Plan around your lowest recent income, not your best.", "Use last year's weakest month as your spending baseline.", 2),
                new TipTemplate("Save the Surplus", "Good months should fund the bad ones.", "Move anything above your baseline income into savings right away.", 3),
                new TipTemplate("Add Another Stream", "A second income source softens the swings.", "Explore one side gig or client you could add this quarter.", 4)));
        STRATEGY_TIPS.put(BudgetStrategy.CONSERVATIVE, List.of(
                new TipTemplate("Protect What You Built", "Preserving savings matters more than chasing returns.", "Review where your savings are held and keep them low risk.", 1),
                new TipTemplate("Plan for Health Costs", "Medical expenses tend to grow over time.", "Set a monthly amount aside for health and insurance.", 2),
                new TipTemplate("Spend With Purpose", "A tight wants budget keeps your reserves intact.", "Decide in advance which treats fit in this month.", 3),
                new TipTemplate("Review Fixed Costs", "Small recurring bills add up on a fixed income.", "Cancel one service you no longer use.", 4)));
        STRATEGY_TIPS.put(BudgetStrategy.FAMILY_CENTRIC, List.of(
                new TipTemplate("Family Essentials First", "Food, schooling and health for the household come before anything else.", "Fund the children's needs before discretionary spending.", 1),
                new TipTemplate("Save for School", "Education costs arrive on a schedule you can plan for.", "Start a separate fund for next school year.", 2),
                new TipTemplate("Budget Together", "A shared plan keeps everyone on the same page.", "Hold a short family money talk each month.", 3),
                new TipTemplate("Start Good Habits Early", "Children copy the money habits they see at home.", "Give each child a small savings jar.", 4)));
        FAMILY_TIER_TIPS.put(BudgetStrategy.FAMILY_CENTRIC.split(1), STRATEGY_TIPS.get(BudgetStrategy.FAMILY_CENTRIC));
        FAMILY_TIER_TIPS.put(BudgetStrategy.FAMILY_CENTRIC.split(3), List.of(
                new TipTemplate("Budget as a Team", "A busy household runs smoother when everyone knows the plan.", "Agree on a few money rules the whole family follows.", 1),
                new TipTemplate("Keep a Routine", "Regular habits keep costs predictable as the family grows.", "Review bills and subscriptions on the same day each month.", 2),
                new TipTemplate("Buy in Bulk", "Staples bought in quantity stretch every peso further.", "Plan one bulk grocery run per month.", 3),
                new TipTemplate("Expect Surprises", "More children bring more unplanned costs.", "Keep a small fund for school and health surprises.", 4)));
        FAMILY_TIER_TIPS.put(BudgetStrategy.FAMILY_CENTRIC.split(6), List.of(
                new TipTemplate("Needs Only", "Food, shelter, school and health take nearly all of the budget.", "Choose hand-me-downs and do-it-yourself fixes where you can.", 1),
                new TipTemplate("Emergency Fund First", "A large household feels every crisis many times over.", "Save something every payday, even a small amount.", 2),
                new TipTemplate("Everyone Has a Role", "Older children can help keep the household budget on track.", "Give each child one money responsibility.", 3),
                new TipTemplate("Think Long-Term", "Today's choices shape many futures at once.", "Set one savings goal for the children's education.", 4)));
        STRATEGY_TIPS.put(BudgetStrategy.BUILDER, List.of(
                new TipTemplate("Pay Down the Home", "Your mortgage is your largest lever for long-term wealth.", "Consider one extra principal payment per year.", 1),
                new TipTemplate("Invest Consistently", "Regular contributions grow steadily over time.", "Automate a monthly transfer to an investment account.", 2),
                new TipTemplate("Maintain the Property", "Small repairs now prevent large bills later.", "Keep a home maintenance fund.", 3),
                new TipTemplate("Keep Lifestyle in Check", "Raises should grow savings before spending.", "Save half of every income increase.", 4)));
        STRATEGY_TIPS.put(BudgetStrategy.BALANCED, List.of(
                new TipTemplate("Follow the Split", "Needs, wants and savings each have a place in your budget.", "Check your spending against the split once a week.", 1),
                new TipTemplate("Pay Yourself First", "Savings taken out first are savings you keep.", "Transfer your savings share on payday.", 2),
                new TipTemplate("Enjoy Guilt-Free", "Spending within your wants budget is part of the plan.", "Use your wants budget without second-guessing it.", 3),
                new TipTemplate("Build Long-Term Goals", "A steady plan leaves room to invest for later.", "Pick one goal for your savings this year.", 4)));
    }

    private final int maxAnalysisTips;
    private final int maxStrategyTips;

    @Autowired
    public CoachingTipService(PocketPilotProperties properties) {
        this(properties.prescription().maxAnalysisTips(), properties.prescription().maxStrategyTips());
    }

    CoachingTipService(int maxAnalysisTips, int maxStrategyTips) {
        this.maxAnalysisTips = maxAnalysisTips;
        this.maxStrategyTips = maxStrategyTips;
    }

    /**
     * Analysis tips first, then strategy tips, then at most one progress nudge.
     */
    public List<BudgetingTip> tipsFor(
            CategoryBudgetAnalysis analysis,
            BudgetStrategy strategy,
            BudgetStrategy.Split split,
            BigDecimal dataCompleteness
    ) {
        List<BudgetingTip> tips = new ArrayList<>(analysisTips(analysis, strategy));
        tips.addAll(strategyTips(strategy, split));
        progressNudge(dataCompleteness, strategy).ifPresent(tips::add);
        return tips;
    }

    /**
     * Strategy tips ordered by priority. Family-centric tips follow the household tier of
     * {@code split}.
     */
    public List<BudgetingTip> strategyTips(BudgetStrategy strategy, BudgetStrategy.Split split) {
        List<TipTemplate> templates = strategy == BudgetStrategy.FAMILY_CENTRIC && FAMILY_TIER_TIPS.containsKey(split)
                ? FAMILY_TIER_TIPS.get(split)
                : STRATEGY_TIPS.getOrDefault(strategy, List.of());
        return templates.stream()
                .sorted(Comparator.comparingInt(TipTemplate::priority))
                .limit(maxStrategyTips)
                .map(template -> new BudgetingTip(STRATEGY_CATEGORY, template.title(), template.message(), template.action(), strategy, template.priority()))
                .toList();
    }

    List<BudgetingTip> analysisTips(CategoryBudgetAnalysis analysis, BudgetStrategy strategy) {
        List<BudgetingTip> tips = new ArrayList<>();
        if (!analysis.sustainable()) {
            tips.add(new BudgetingTip(ANALYSIS_CATEGORY, "Budget Alert",
                    "Your needs cost more than your net income this month.",
                    "Look for fixed costs you can renegotiate or reduce.", strategy, 1));
        }
        for (String adjustment : analysis.adjustments()) {
            tips.add(new BudgetingTip(ANALYSIS_CATEGORY, "Budget Adjusted", adjustment,
                    "Review your daily food and transport targets.", strategy, 2));
        }
        BigDecimal fixedTotal = analysis.fixedNeeds().total();
        if (fixedTotal.signum() > 0) {
            tips.add(new BudgetingTip(ANALYSIS_CATEGORY, "Fixed Needs",
                    "Fixed needs total " + fixedTotal.toPlainString() + " (" + percentOf(fixedTotal, analysis.netIncome()) + "% of net income).",
                    "Pay these first when income arrives.", strategy, 3));
        }
        tips.add(new BudgetingTip(ANALYSIS_CATEGORY, "Daily Spending",
                "Food and transport are budgeted at " + analysis.flexibleNeeds().total().toPlainString() + " for the month.",
                "Track food and transport every day to stay on target.", strategy, 3));
        if (analysis.remainingBudget().signum() > 0) {
            tips.add(new BudgetingTip(ANALYSIS_CATEGORY, "Room to Save",
                    analysis.remainingBudget().toPlainString() + " remains after your needs are covered.",
                    "Move part of it to savings before spending on wants.", strategy, 4));
        }
        return tips.stream().limit(maxAnalysisTips).toList();
    }

    Optional<BudgetingTip> progressNudge(BigDecimal completeness, BudgetStrategy strategy) {
        if (completeness == null || completeness.compareTo(ALMOST_THERE) < 0) {
            return Optional.empty();
        }
        if (completeness.compareTo(GREAT_JOB) < 0) {
            return Optional.of(new BudgetingTip(PROGRESS_CATEGORY, "Almost There",
                    "You logged spending on most days last month.",
                    "Log a few more days to make your budget more accurate.", strategy, 5));
        }
        if (completeness.compareTo(EXCELLENT) < 0) {
            return Optional.of(new BudgetingTip(PROGRESS_CATEGORY, "Great Job",
                    "Your tracking habit is giving your budget a solid base.",
                    "Keep logging daily to reach full accuracy.", strategy, 5));
        }
        return Optional.of(new BudgetingTip(PROGRESS_CATEGORY, "Excellent Tracking",
                "Your budget is built on reliable, complete data.",
                "Keep up the daily logging.", strategy, 5));
    }

    private static String percentOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return "0";
        }
        return part.multiply(HUNDRED).divide(whole, 0, RoundingMode.HALF_UP).toPlainString();
    }

    private record TipTemplate(String title, String message, String action, int priority) {
    }
}
