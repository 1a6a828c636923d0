package com.admissionsgenie.admission.casemix;

/**
 * PDPM clinical categories, derived from the primary diagnosis.
 */
public enum ClinicalCategory {
    MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY(
            TherapyCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY,
            NursingTier.REDUCED_PHYSICAL_FUNCTION, false),
    ORTHOPEDIC_SURGERY(TherapyCategory.OTHER_ORTHOPEDIC, NursingTier.REDUCED_PHYSICAL_FUNCTION,
            false),
    NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL(TherapyCategory.OTHER_ORTHOPEDIC,
            NursingTier.REDUCED_PHYSICAL_FUNCTION, false),
    NON_ORTHOPEDIC_SURGERY(TherapyCategory.NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC,
            NursingTier.REDUCED_PHYSICAL_FUNCTION, false),
    ACUTE_NEUROLOGIC(TherapyCategory.NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC,
            NursingTier.REDUCED_PHYSICAL_FUNCTION, true),
    ACUTE_INFECTIONS(TherapyCategory.MEDICAL_MANAGEMENT, NursingTier.CLINICALLY_COMPLEX, false),
    CANCER(TherapyCategory.MEDICAL_MANAGEMENT, NursingTier.CLINICALLY_COMPLEX, false),
    PULMONARY(TherapyCategory.MEDICAL_MANAGEMENT, NursingTier.CLINICALLY_COMPLEX, false),
    CARDIOVASCULAR_AND_COAGULATIONS(TherapyCategory.MEDICAL_MANAGEMENT,
            NursingTier.CLINICALLY_COMPLEX, false),
    MEDICAL_MANAGEMENT(TherapyCategory.MEDICAL_MANAGEMENT, NursingTier.REDUCED_PHYSICAL_FUNCTION,
            false),
    /** Primary diagnosis missing or not in the mapping table. */
    UNCLASSIFIED(TherapyCategory.MEDICAL_MANAGEMENT, NursingTier.REDUCED_PHYSICAL_FUNCTION, false);

    private final TherapyCategory therapyCategory;
    private final NursingTier nursingTier;
    private final boolean acuteNeurologic;

    ClinicalCategory(TherapyCategory therapyCategory, NursingTier nursingTier,
            boolean acuteNeurologic) {
        this.therapyCategory = therapyCategory;
        this.nursingTier = nursingTier;
        this.acuteNeurologic = acuteNeurologic;
    }

    public TherapyCategory therapyCategory() {
        return therapyCategory;
    }

    /** Nursing tier the category implies before any condition or special-care escalation. */
    public NursingTier nursingTier() {
        return nursingTier;
    }

    public boolean isAcuteNeurologic() {
        return acuteNeurologic;
    }
}
