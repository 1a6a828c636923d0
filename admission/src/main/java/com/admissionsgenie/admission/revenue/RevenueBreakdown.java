package com.admissionsgenie.admission.revenue;

import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;

/**
 * Itemized projected revenue for a stay. The total is always the exact sum of the lines.
 */
public record RevenueBreakdown(PayerType payerType, String rateRecordId, int lengthOfStay,
        ImmutableList<RevenueLine> lines, CurrencyAmount total) {

    public RevenueBreakdown {
        CurrencyAmount sum = CurrencyAmount.sum(lines.stream().map(RevenueLine::amount)
                .collect(ImmutableList.toImmutableList()));
        if (!sum.isEqualTo(total)) {
            throw new IllegalArgumentException(
                    "Revenue total " + total + " does not match its lines " + sum);
        }
    }

    public static RevenueBreakdown of(PayerType payerType, String rateRecordId, int lengthOfStay,
            ImmutableList<RevenueLine> lines) {
        return new RevenueBreakdown(payerType, rateRecordId, lengthOfStay, lines,
                CurrencyAmount.sum(lines.stream().map(RevenueLine::amount)
                        .collect(ImmutableList.toImmutableList())));
    }
}
