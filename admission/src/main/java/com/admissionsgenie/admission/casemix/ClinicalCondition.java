package com.admissionsgenie.admission.casemix;

/** Comorbid conditions recognised from diagnosis codes. */
public enum ClinicalCondition {
    PNEUMONIA,
    SEPTICEMIA,
    DIABETES,
    COPD,
    URINARY_TRACT_INFECTION,
    HEART_FAILURE,
    HIV,
    MULTIPLE_SCLEROSIS,
    PARKINSONS,
    CEREBRAL_PALSY,
    QUADRIPLEGIA,
    HEMIPLEGIA,
    RESPIRATORY_FAILURE,
    APHASIA,
    MALNUTRITION,
    DEPRESSION,
    BIPOLAR,
    SCHIZOPHRENIA
}
