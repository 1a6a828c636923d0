package com.admissionsgenie.admission.casemix;

/** Special-care needs flagged on the clinical intake. */
public enum SpecialCare {
    IV_MEDICATION,
    IV_ANTIBIOTICS,
    WOUND_CARE,
    WOUND_VAC,
    VENTILATOR,
    TRACHEOSTOMY,
    DIALYSIS,
    ISOLATION,
    BARIATRIC,
    OXYGEN,
    FEEDING_TUBE,
    PARENTERAL_NUTRITION,
    DEMENTIA_CARE
}
