package com.admissionsgenie.admission.evaluation;

import com.admissionsgenie.admission.cost.CostBreakdown;
import com.admissionsgenie.admission.revenue.RevenueBreakdown;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;

/**
 * Revenue and cost for one stay. Margins may be negative.
 */
public record FinancialProjection(RevenueBreakdown revenue, CostBreakdown cost,
        CurrencyAmount projectedMarginTotal, CurrencyAmount projectedMarginPerDiem) {

    public static FinancialProjection of(RevenueBreakdown revenue, CostBreakdown cost) {
        CurrencyAmount marginTotal = revenue.total().subtract(cost.total());
        return new FinancialProjection(revenue, cost, marginTotal,
                marginTotal.divide(revenue.lengthOfStay()));
    }
}
