package com.admissionsgenie.admission.scoring;

/**
 * Score cut-offs: {@code [accept, 100]} is Accept, {@code [defer, accept)} is Defer and
 * {@code [0, defer)} is Decline.
 */
public record RecommendationThresholds(double accept, double defer) {

    public static final RecommendationThresholds DEFAULT = new RecommendationThresholds(70, 50);

    public RecommendationThresholds {
        if (!(defer >= 0 && defer <= accept && accept <= 100)) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 <= defer <= accept"
                    + " <= 100, got defer=" + defer + " accept=" + accept);
        }
    }

    public Recommendation recommend(double score) {
        if (score >= accept) {
            return Recommendation.ACCEPT;
        }
        if (score >= defer) {
            return Recommendation.DEFER;
        }
        return Recommendation.DECLINE;
    }
}
