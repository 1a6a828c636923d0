package com.admissionsgenie.admission.casemix;

import com.google.common.collect.ImmutableMap;

/**
 * Rule-based length-of-stay suggestion. Advisory only, the caller's projected length of stay is
 * what the evaluation uses.
 */
public class LengthOfStayEstimator {
    private static final ImmutableMap<TherapyCategory, Integer> BASE_DAYS = ImmutableMap.of(
            TherapyCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY, 12,
            TherapyCategory.OTHER_ORTHOPEDIC, 14,
            TherapyCategory.MEDICAL_MANAGEMENT, 16,
            TherapyCategory.NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC, 18);

    private static final ImmutableMap<SpecialCare, Integer> EXTRA_DAYS = ImmutableMap.of(
            SpecialCare.DIALYSIS, 5,
            SpecialCare.WOUND_VAC, 3,
            SpecialCare.TRACHEOSTOMY, 7);

    private final int maxLengthOfStay;

    public LengthOfStayEstimator(int maxLengthOfStay) {
        this.maxLengthOfStay = maxLengthOfStay;
    }

    public int estimate(CaseMixClassification classification) {
        int days = BASE_DAYS.get(classification.ptGroup().category());
        for (SpecialCare flag : classification.specialCare()) {
            days += EXTRA_DAYS.getOrDefault(flag, 0);
        }
        return Math.min(days, maxLengthOfStay);
    }
}
