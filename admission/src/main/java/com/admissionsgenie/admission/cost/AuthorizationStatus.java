package com.admissionsgenie.admission.cost;

/** Payer prior-authorization state at the time of evaluation. */
public enum AuthorizationStatus {
    APPROVED,
    PENDING,
    DENIED,
    UNKNOWN
}
