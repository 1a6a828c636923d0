package com.admissionsgenie.admission.scoring;

/**
 * Maps margin per diem to a base score in [0, 100]. Both curves put a zero margin at 50 and are
 * non-decreasing in margin.
 */
public enum NormalizationCurve {
    /** 50 plus 50 points per {@code linearSpan} dollars of daily margin, clamped. */
    LINEAR {
        @Override
        public double baseScore(double marginPerDiem, ScoringPolicy policy) {
            return clamp(50 + marginPerDiem / policy.linearSpan() * 50);
        }
    },
    /**
     * Positive margins approach 100 asymptotically ({@code saturationMargin} dollars a day is
     * 75 points); negative margins fall linearly to 0 at minus {@code lossFloorMargin}.
     */
    SATURATING {
        @Override
        public double baseScore(double marginPerDiem, ScoringPolicy policy) {
            if (marginPerDiem >= 0) {
                return clamp(50
                        + marginPerDiem / (marginPerDiem + policy.saturationMargin()) * 50);
            }
            return clamp(50 + marginPerDiem / policy.lossFloorMargin() * 50);
        }
    };

    public abstract double baseScore(double marginPerDiem, ScoringPolicy policy);

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
