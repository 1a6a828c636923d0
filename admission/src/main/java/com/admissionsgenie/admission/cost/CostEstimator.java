package com.admissionsgenie.admission.cost;

import com.admissionsgenie.admission.casemix.CaseMixClassification;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.revenue.RevenueBreakdown;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;

/**
 * Projects the cost of a stay from the acuity-banded cost model.
 *
 * Direct costs (nursing, supplies, pharmacy, transport and special-care surcharges) carry an
 * overhead line on top. The expected loss from claim denial is a cost line of its own, so the
 * revenue breakdown stays the contractual figure.
 */
public class CostEstimator {
    private final DenialRiskModel denialRiskModel;

    public CostEstimator(DenialRiskModel denialRiskModel) {
        this.denialRiskModel = denialRiskModel;
    }

    public CostBreakdown estimateCost(CaseMixClassification classification,
            CostModelRecord costModel, int lengthOfStay, AuthorizationStatus authorizationStatus,
            PayerType payerType, RevenueBreakdown revenue, boolean needsTransport) {
        ImmutableList.Builder<CostLine> direct = ImmutableList.builder();
        BigDecimal days = BigDecimal.valueOf(lengthOfStay);

        direct.add(new CostLine(CostCategory.NURSING,
                "Nursing (" + costModel.nursingHoursPerDay().toPlainString() + " h/day @ "
                        + costModel.hourlyNursingRate() + "/h)",
                costModel.hourlyNursingRate()
                        .multiply(costModel.nursingHoursPerDay().multiply(days))));
        direct.add(new CostLine(CostCategory.SUPPLIES, "Supplies",
                costModel.supplyPerDay().times(lengthOfStay)));
        direct.add(new CostLine(CostCategory.PHARMACY, "Pharmacy",
                costModel.pharmacyPerDay().times(lengthOfStay)));
        for (CostSurcharge surcharge : costModel.surcharges()) {
            if (classification.has(surcharge.trigger())) {
                direct.add(new CostLine(surcharge.category(),
                        surcharge.trigger() + " (" + lengthOfStay + " days @ "
                                + surcharge.perDay() + ")",
                        surcharge.perDay().times(lengthOfStay)));
            }
        }
        if (needsTransport) {
            direct.add(new CostLine(CostCategory.TRANSPORT, "Transport (one-time)",
                    costModel.transportCost()));
        }
        ImmutableList<CostLine> directLines = direct.build();
        CurrencyAmount directTotal = CurrencyAmount.sum(directLines.stream()
                .map(CostLine::amount).collect(ImmutableList.toImmutableList()));

        BigDecimal denialProbability = denialRiskModel.probability(payerType, authorizationStatus,
                classification.complexityScore());
        CurrencyAmount expectedLoss = revenue.total()
                .multiply(denialProbability.multiply(denialRiskModel.revenueAtRiskShare()));

        ImmutableList<CostLine> lines = ImmutableList.<CostLine>builder().addAll(directLines)
                .add(new CostLine(CostCategory.OVERHEAD,
                        "Overhead (" + percent(costModel.overheadRate()) + " of direct costs)",
                        directTotal.multiply(costModel.overheadRate())))
                .add(new CostLine(CostCategory.DENIAL_RISK,
                        "Denial risk (" + percent(denialProbability) + " x revenue at risk, "
                                + authorizationStatus + ")",
                        expectedLoss))
                .build();
        return CostBreakdown.of(costModel.id(), costModel.acuityBand(), lines, denialProbability,
                classification.complexityScore());
    }

    private static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
    }
}
