package com.admissionsgenie.admission.cost;

import com.admissionsgenie.admission.casemix.NursingGroup;

/** Coarse clinical-complexity tier used to pick a cost model. */
public enum AcuityBand {
    LOW,
    MEDIUM,
    HIGH,
    COMPLEX;

    public static AcuityBand fromNursingGroup(NursingGroup nursingGroup) {
        switch (nursingGroup.tier()) {
            case EXTENSIVE_SERVICES:
                return COMPLEX;
            case SPECIAL_CARE_HIGH:
                return HIGH;
            case SPECIAL_CARE_LOW:
            case CLINICALLY_COMPLEX:
                return MEDIUM;
            default:
                return LOW;
        }
    }
}
