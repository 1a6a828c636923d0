package com.admissionsgenie.admission.casemix;

/**
 * The 25 PDPM nursing case-mix groups. A trailing 2 marks the more dependent function band of
 * a pair; "DE" groups are for residents with depression.
 */
public enum NursingGroup {
    ES3(NursingTier.EXTENSIVE_SERVICES),
    ES2(NursingTier.EXTENSIVE_SERVICES),
    ES1(NursingTier.EXTENSIVE_SERVICES),
    HDE2(NursingTier.SPECIAL_CARE_HIGH),
    HDE1(NursingTier.SPECIAL_CARE_HIGH),
    HBC2(NursingTier.SPECIAL_CARE_HIGH),
    HBC1(NursingTier.SPECIAL_CARE_HIGH),
    LDE2(NursingTier.SPECIAL_CARE_LOW),
    LDE1(NursingTier.SPECIAL_CARE_LOW),
    LBC2(NursingTier.SPECIAL_CARE_LOW),
    LBC1(NursingTier.SPECIAL_CARE_LOW),
    CDE2(NursingTier.CLINICALLY_COMPLEX),
    CDE1(NursingTier.CLINICALLY_COMPLEX),
    CBC2(NursingTier.CLINICALLY_COMPLEX),
    CA2(NursingTier.CLINICALLY_COMPLEX),
    CBC1(NursingTier.CLINICALLY_COMPLEX),
    CA1(NursingTier.CLINICALLY_COMPLEX),
    BAB2(NursingTier.BEHAVIORAL_SYMPTOMS_AND_COGNITIVE_PERFORMANCE),
    BAB1(NursingTier.BEHAVIORAL_SYMPTOMS_AND_COGNITIVE_PERFORMANCE),
    PDE2(NursingTier.REDUCED_PHYSICAL_FUNCTION),
    PDE1(NursingTier.REDUCED_PHYSICAL_FUNCTION),
    PBC2(NursingTier.REDUCED_PHYSICAL_FUNCTION),
    PA2(NursingTier.REDUCED_PHYSICAL_FUNCTION),
    PBC1(NursingTier.REDUCED_PHYSICAL_FUNCTION),
    PA1(NursingTier.REDUCED_PHYSICAL_FUNCTION);

    private final NursingTier tier;

    NursingGroup(NursingTier tier) {
        this.tier = tier;
    }

    public NursingTier tier() {
        return tier;
    }

    public boolean isExtensiveServices() {
        return tier == NursingTier.EXTENSIVE_SERVICES;
    }
}
