package com.admissionsgenie.admission.evaluation;

import com.admissionsgenie.admission.casemix.CaseMixClassification;
import com.admissionsgenie.admission.scoring.ScoreResult;
import com.google.common.collect.ImmutableList;

/**
 * Everything an evaluation produced, ready to be persisted with its request for audit.
 *
 * @param warnings classification warnings followed by facility capability warnings
 * @param suggestedLengthOfStay rule-based estimate; advisory only
 */
public record EvaluationResult(EvaluationRequest request,
        CaseMixClassification classification, FinancialProjection projection, ScoreResult score,
        ImmutableList<String> warnings, int suggestedLengthOfStay) {
}
