package com.admissionsgenie.admission.error;

/** Administrative data that is missing, contradictory or malformed. */
public enum ConfigurationError {
    NO_ACTIVE_RATE,
    AMBIGUOUS_RATE,
    NO_ACTIVE_COST_MODEL,
    AMBIGUOUS_COST_MODEL,
    OVERLAPPING_INTERVALS,
    INCOMPLETE_RATE_TABLE,
    INVALID_POLICY
}
