package com.admissionsgenie.admission.error;

/** Request problems the caller must fix in their input. */
public enum ValidationError {
    INVALID_LOS,
    MISSING_FACILITY,
    MISSING_PAYER,
    UNKNOWN_FACILITY,
    INVALID_CENSUS_PRIORITY,
    INVALID_AS_OF_DATE,
    INVALID_WEIGHTS
}
