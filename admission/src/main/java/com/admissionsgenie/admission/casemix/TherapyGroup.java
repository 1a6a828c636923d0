package com.admissionsgenie.admission.casemix;

/**
 * PDPM physical and occupational therapy case-mix groups. PT and OT share the same group
 * definitions: a therapy category crossed with a function score band.
 */
public enum TherapyGroup {
    TA(TherapyCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY, 0, 5),
    TB(TherapyCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY, 6, 9),
    TC(TherapyCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY, 10, 23),
    TD(TherapyCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY, 24, 24),
    TE(TherapyCategory.OTHER_ORTHOPEDIC, 0, 5),
    TF(TherapyCategory.OTHER_ORTHOPEDIC, 6, 9),
    TG(TherapyCategory.OTHER_ORTHOPEDIC, 10, 23),
    TH(TherapyCategory.OTHER_ORTHOPEDIC, 24, 24),
    TI(TherapyCategory.MEDICAL_MANAGEMENT, 0, 5),
    TJ(TherapyCategory.MEDICAL_MANAGEMENT, 6, 9),
    TK(TherapyCategory.MEDICAL_MANAGEMENT, 10, 23),
    TL(TherapyCategory.MEDICAL_MANAGEMENT, 24, 24),
    TM(TherapyCategory.NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC, 0, 5),
    TN(TherapyCategory.NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC, 6, 9),
    TO(TherapyCategory.NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC, 10, 23),
    TP(TherapyCategory.NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC, 24, 24);

    public static final int MIN_FUNCTION_SCORE = 0;
    public static final int MAX_FUNCTION_SCORE = 24;

    private final TherapyCategory category;
    private final int minFunctionScore;
    private final int maxFunctionScore;

    TherapyGroup(TherapyCategory category, int minFunctionScore, int maxFunctionScore) {
        this.category = category;
        this.minFunctionScore = minFunctionScore;
        this.maxFunctionScore = maxFunctionScore;
    }

    public TherapyCategory category() {
        return category;
    }

    public static TherapyGroup of(TherapyCategory category, int functionScore) {
        if (functionScore < MIN_FUNCTION_SCORE || functionScore > MAX_FUNCTION_SCORE) {
            throw new IllegalArgumentException("Function score out of range: " + functionScore);
        }
        for (TherapyGroup group : values()) {
            if (group.category == category && functionScore >= group.minFunctionScore
                    && functionScore <= group.maxFunctionScore) {
                return group;
            }
        }
        throw new IllegalStateException("No therapy group for " + category + "/" + functionScore);
    }
}
