package com.admissionsgenie.admission.casemix;

/**
 * Nursing classification tiers, declared from highest to lowest resource use. When several
 * tiers apply, the one declared first wins.
 */
public enum NursingTier {
    EXTENSIVE_SERVICES,
    SPECIAL_CARE_HIGH,
    SPECIAL_CARE_LOW,
    CLINICALLY_COMPLEX,
    BEHAVIORAL_SYMPTOMS_AND_COGNITIVE_PERFORMANCE,
    REDUCED_PHYSICAL_FUNCTION;

    public NursingTier higherOf(NursingTier other) {
        return ordinal() <= other.ordinal() ? this : other;
    }
}
