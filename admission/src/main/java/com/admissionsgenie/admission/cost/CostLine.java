package com.admissionsgenie.admission.cost;

import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;

public record CostLine(CostCategory category, String label, CurrencyAmount amount) {
}
