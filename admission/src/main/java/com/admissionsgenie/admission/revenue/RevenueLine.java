package com.admissionsgenie.admission.revenue;

import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;

public record RevenueLine(RevenueCategory category, String label, CurrencyAmount amount) {
}
