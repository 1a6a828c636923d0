package com.admissionsgenie.admission.scoring;

import com.admissionsgenie.admission.cost.CostBreakdown;
import com.admissionsgenie.admission.revenue.RevenueBreakdown;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;

/**
 * Turns a financial projection into a 0-100 score and an Accept/Defer/Decline recommendation.
 *
 * Scoring never fails: odd inputs give an extreme but consistent score, since the recommendation
 * is advisory.
 */
public class MarginScorer {
    private final ScoringPolicy policy;

    public MarginScorer(ScoringPolicy policy) {
        this.policy = policy;
    }

    public ScoreResult score(RevenueBreakdown revenue, CostBreakdown cost, BusinessWeights weights,
            double censusPriority) {
        int lengthOfStay = Math.max(1, revenue.lengthOfStay());
        CurrencyAmount marginTotal = revenue.total().subtract(cost.total());
        double marginPerDiem = marginTotal.value()
                .divide(BigDecimal.valueOf(lengthOfStay), MathContext.DECIMAL64).doubleValue();
        double census = Double.isFinite(censusPriority)
                ? Math.max(0, Math.min(1, censusPriority)) : 0;
        double denialProbability = cost.denialProbability().doubleValue();

        ImmutableList.Builder<ScoreFactor> factors = ImmutableList.builder();
        double baseScore = policy.curve().baseScore(marginPerDiem, policy);
        factors.add(new ScoreFactor("Margin", baseScore,
                String.format(Locale.US, "Margin of %s/day (%s over %d days)",
                        money(marginPerDiem), money(marginTotal.doubleValue()), lengthOfStay)));

        double censusAdjustment = census * policy.censusMaxPoints() * weights.censusWeight();
        factors.add(new ScoreFactor("Census priority", censusAdjustment,
                String.format(Locale.US, "Census priority %.2f at weight %.2f", census,
                        weights.censusWeight())));

        double denialAdjustment =
                -denialProbability * policy.denialMaxPoints() * weights.riskWeight();
        factors.add(new ScoreFactor("Denial risk", denialAdjustment,
                String.format(Locale.US, "Denial probability %.1f%% at weight %.2f",
                        denialProbability * 100, weights.riskWeight())));

        double complexityAdjustment = -cost.complexityScore() * weights.complexityWeight();
        factors.add(new ScoreFactor("Clinical complexity", complexityAdjustment,
                String.format(Locale.US, "Complexity score %d at weight %.2f",
                        cost.complexityScore(), weights.complexityWeight())));

        double adjusted = baseScore + censusAdjustment + denialAdjustment + complexityAdjustment;
        double rawScore = Double.isNaN(adjusted) ? 0 : Math.max(0, Math.min(100, adjusted));
        if (rawScore != adjusted) {
            factors.add(new ScoreFactor("Score bounds", rawScore - adjusted,
                    "Score limited to the range 0-100"));
        }

        Recommendation recommendation = policy.thresholds().recommend(rawScore);
        return new ScoreResult(rawScore, recommendation, factors.build(),
                summary(recommendation, revenue.total(), marginTotal, marginPerDiem,
                        lengthOfStay));
    }

    private static String summary(Recommendation recommendation, CurrencyAmount revenue,
            CurrencyAmount marginTotal, double marginPerDiem, int lengthOfStay) {
        double marginRate = revenue.value().signum() > 0
                ? marginTotal.doubleValue() / revenue.doubleValue() * 100 : 0;
        String margin = String.format(Locale.US, "%s/day (%.1f%% margin rate)",
                money(marginPerDiem), marginRate);
        switch (recommendation) {
            case ACCEPT:
                return "Strong financial margin of " + margin + ". Projected net profit of "
                        + money(marginTotal.doubleValue()) + " over " + lengthOfStay + " days.";
            case DEFER:
                return "Moderate margin of " + margin + ". Consider negotiating rates or"
                        + " confirming authorization before accepting. Projected net profit of "
                        + money(marginTotal.doubleValue()) + " over " + lengthOfStay + " days.";
            case DECLINE:
            default:
                if (marginTotal.isNegative()) {
                    return "Negative margin of " + margin + ". Projected loss of "
                            + money(-marginTotal.doubleValue()) + " over " + lengthOfStay
                            + " days. Not financially viable without rate renegotiation.";
                }
                return "Low margin of " + margin + ". High complexity or denial risk reduces"
                        + " overall score. Consider only if census priority is critical.";
        }
    }

    private static String money(double amount) {
        return amount < 0 ? String.format(Locale.US, "-$%,.2f", -amount)
                : String.format(Locale.US, "$%,.2f", amount);
    }
}
