package com.admissionsgenie.admission.rates;

import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableMap;

/** State Medicaid per-diem with high-acuity add-ons triggered by special-care needs. */
public record MedicaidSchedule(CurrencyAmount basePerDiem,
        ImmutableMap<SpecialCare, CurrencyAmount> addOns) implements RateSchedule {

    @Override
    public PayerType payerType() {
        return PayerType.MEDICAID;
    }
}
