package com.admissionsgenie.admission.rates;

import com.admissionsgenie.admission.error.ConfigurationError;
import com.google.common.collect.ImmutableList;
import java.time.LocalDate;

/** Finds the rate record contractually in force for a facility and payer on a date. */
public class RateResolver {
    private final ImmutableList<RateRecord> rateRecords;

    public RateResolver(ImmutableList<RateRecord> rateRecords) {
        this.rateRecords = rateRecords;
    }

    /**
     * @throws com.admissionsgenie.admission.error.ConfigurationException with
     *         {@code NO_ACTIVE_RATE} if no record is in force on {@code asOf}, or
     *         {@code AMBIGUOUS_RATE} if more than one is
     */
    public RateRecord resolve(String facilityId, PayerType payerType, LocalDate asOf) {
        ImmutableList<RateRecord> candidates = rateRecords.stream()
                .filter(record -> record.facilityId().equals(facilityId)
                        && record.payerType() == payerType)
                .collect(ImmutableList.toImmutableList());
        return ActiveRecords.selectActive(candidates, asOf,
                payerType + " rate for facility " + facilityId, ConfigurationError.NO_ACTIVE_RATE,
                ConfigurationError.AMBIGUOUS_RATE);
    }
}
