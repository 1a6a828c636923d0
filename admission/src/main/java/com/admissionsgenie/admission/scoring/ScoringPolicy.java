package com.admissionsgenie.admission.scoring;

/**
 * Scoring configuration shared by every facility.
 *
 * @param censusMaxPoints points added at census priority 1 before weighting
 * @param denialMaxPoints points removed at denial probability 1 before weighting
 */
public record ScoringPolicy(NormalizationCurve curve, double saturationMargin,
        double lossFloorMargin, double linearSpan, double censusMaxPoints,
        double denialMaxPoints, RecommendationThresholds thresholds) {

    public static final ScoringPolicy STANDARD = new ScoringPolicy(NormalizationCurve.SATURATING,
            200, 100, 200, 10, 15, RecommendationThresholds.DEFAULT);

    public ScoringPolicy {
        if (!(saturationMargin > 0 && lossFloorMargin > 0 && linearSpan > 0)) {
            throw new IllegalArgumentException("Curve scales must be positive");
        }
        if (!(censusMaxPoints >= 0 && denialMaxPoints >= 0)) {
            throw new IllegalArgumentException("Adjustment points cannot be negative");
        }
    }
}
