package com.admissionsgenie.admission.scoring;

import com.google.common.collect.ImmutableList;

/**
 * @param rawScore final score in [0, 100]
 * @param factors contributions in the order they were applied; they sum to {@code rawScore}
 */
public record ScoreResult(double rawScore, Recommendation recommendation,
        ImmutableList<ScoreFactor> factors, String summary) {
}
