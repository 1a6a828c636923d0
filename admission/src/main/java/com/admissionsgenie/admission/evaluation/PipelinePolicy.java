package com.admissionsgenie.admission.evaluation;

import com.admissionsgenie.admission.casemix.ClassificationTables;
import com.admissionsgenie.admission.casemix.NtaBands;
import com.admissionsgenie.admission.cost.DenialRiskModel;
import com.admissionsgenie.admission.scoring.BusinessWeights;
import com.admissionsgenie.admission.scoring.ScoringPolicy;

/**
 * Service-wide tables and parameters the pipeline components are built from.
 */
public record PipelinePolicy(ClassificationTables classificationTables, NtaBands ntaBands,
        DenialRiskModel denialRiskModel, ScoringPolicy scoringPolicy,
        BusinessWeights defaultWeights, int maxLengthOfStay) {

    public static final int DEFAULT_MAX_LENGTH_OF_STAY = 100;

    public static final PipelinePolicy STANDARD = new PipelinePolicy(
            ClassificationTables.STANDARD, NtaBands.STANDARD, DenialRiskModel.STANDARD,
            ScoringPolicy.STANDARD, BusinessWeights.DEFAULT, DEFAULT_MAX_LENGTH_OF_STAY);

    public PipelinePolicy {
        if (maxLengthOfStay < 1) {
            throw new IllegalArgumentException(
                    "Maximum length of stay must be at least 1: " + maxLengthOfStay);
        }
    }
}
