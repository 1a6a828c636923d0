package com.admissionsgenie.admission.rates;

/**
 * A versioned reimbursement contract between a facility and a payer.
 */
public record RateRecord(String id, String facilityId, PayerType payerType,
        EffectiveInterval interval, RateSchedule schedule) implements Versioned {

    public RateRecord {
        if (schedule.payerType() != payerType) {
            throw new IllegalArgumentException("Rate record " + id + " is for " + payerType
                    + " but carries a " + schedule.payerType() + " schedule");
        }
    }
}
