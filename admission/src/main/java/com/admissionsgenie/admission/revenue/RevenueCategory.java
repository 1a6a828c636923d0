package com.admissionsgenie.admission.revenue;

public enum RevenueCategory {
    PHYSICAL_THERAPY,
    OCCUPATIONAL_THERAPY,
    SPEECH_LANGUAGE_PATHOLOGY,
    NURSING,
    NON_THERAPY_ANCILLARY,
    NON_CASE_MIX,
    PER_DIEM,
    BASE_RATE,
    ACUITY_ADD_ON,
    RATE_MATRIX
}
