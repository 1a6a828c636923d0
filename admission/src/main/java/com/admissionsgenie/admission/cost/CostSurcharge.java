package com.admissionsgenie.admission.cost;

import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;

/** Extra per-day cost a special-care need adds to one cost category. */
public record CostSurcharge(SpecialCare trigger, CostCategory category, CurrencyAmount perDay) {
}
