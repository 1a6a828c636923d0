package com.admissionsgenie.admission.scoring;

/**
 * Facility weights for the score adjustments. Zero switches an adjustment off.
 */
public record BusinessWeights(double censusWeight, double riskWeight, double complexityWeight) {

    public static final BusinessWeights DEFAULT = new BusinessWeights(0.2, 0.3, 0.2);

    public BusinessWeights {
        checkWeight("census", censusWeight);
        checkWeight("risk", riskWeight);
        checkWeight("complexity", complexityWeight);
    }

    private static void checkWeight(String name, double weight) {
        if (!Double.isFinite(weight) || weight < 0) {
            throw new IllegalArgumentException(
                    "The " + name + " weight must be a non-negative number: " + weight);
        }
    }
}
