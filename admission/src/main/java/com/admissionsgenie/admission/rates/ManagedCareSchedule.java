package com.admissionsgenie.admission.rates;

import com.admissionsgenie.admission.casemix.NtaGroup;
import com.admissionsgenie.admission.casemix.NursingGroup;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableTable;

/** Family Care MCO rate matrix: per-diem by nursing group and NTA band. */
public record ManagedCareSchedule(ImmutableTable<NursingGroup, NtaGroup, CurrencyAmount> rates)
        implements RateSchedule {

    @Override
    public PayerType payerType() {
        return PayerType.MANAGED_CARE_ORGANIZATION;
    }
}
