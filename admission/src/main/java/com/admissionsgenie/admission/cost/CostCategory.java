package com.admissionsgenie.admission.cost;

public enum CostCategory {
    NURSING,
    SUPPLIES,
    PHARMACY,
    TRANSPORT,
    OVERHEAD,
    DENIAL_RISK
}
