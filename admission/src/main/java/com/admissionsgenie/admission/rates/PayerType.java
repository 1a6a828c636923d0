package com.admissionsgenie.admission.rates;

public enum PayerType {
    MEDICARE_FFS,
    MEDICARE_ADVANTAGE,
    MEDICAID,
    MANAGED_CARE_ORGANIZATION
}
