package com.admissionsgenie.admission.rates;

/** Payer-specific rate fields of a {@link RateRecord}. */
public sealed interface RateSchedule permits MedicareFfsSchedule, MedicareAdvantageSchedule,
        MedicaidSchedule, ManagedCareSchedule {

    PayerType payerType();
}
