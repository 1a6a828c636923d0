package com.admissionsgenie.admission.cost;

import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;

/**
 * Itemized projected cost for a stay, including the expected loss from denial risk.
 *
 * @param denialProbability probability in [0, 1] used for the denial-risk line
 * @param complexityScore complexity of the case the cost was estimated for
 */
public record CostBreakdown(String costModelId, AcuityBand acuityBand,
        ImmutableList<CostLine> lines, CurrencyAmount total, BigDecimal denialProbability,
        int complexityScore) {

    public static CostBreakdown of(String costModelId, AcuityBand acuityBand,
            ImmutableList<CostLine> lines, BigDecimal denialProbability, int complexityScore) {
        CurrencyAmount total = CurrencyAmount.sum(
                lines.stream().map(CostLine::amount).collect(ImmutableList.toImmutableList()));
        return new CostBreakdown(costModelId, acuityBand, lines, total, denialProbability,
                complexityScore);
    }

    public CurrencyAmount totalFor(CostCategory category) {
        return CurrencyAmount.sum(lines.stream().filter(line -> line.category() == category)
                .map(CostLine::amount).collect(ImmutableList.toImmutableList()));
    }
}
