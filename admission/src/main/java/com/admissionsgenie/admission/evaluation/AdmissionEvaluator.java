package com.admissionsgenie.admission.evaluation;

import com.admissionsgenie.admission.casemix.CaseMixClassification;
import com.admissionsgenie.admission.casemix.CaseMixClassifier;
import com.admissionsgenie.admission.casemix.LengthOfStayEstimator;
import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.config.ConfigurationSnapshot;
import com.admissionsgenie.admission.config.Facility;
import com.admissionsgenie.admission.cost.AcuityBand;
import com.admissionsgenie.admission.cost.CostBreakdown;
import com.admissionsgenie.admission.cost.CostEstimator;
import com.admissionsgenie.admission.cost.CostModelRecord;
import com.admissionsgenie.admission.cost.CostModelResolver;
import com.admissionsgenie.admission.error.ValidationError;
import com.admissionsgenie.admission.error.ValidationException;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.rates.RateRecord;
import com.admissionsgenie.admission.rates.RateResolver;
import com.admissionsgenie.admission.revenue.ReimbursementCalculator;
import com.admissionsgenie.admission.revenue.RevenueBreakdown;
import com.admissionsgenie.admission.scoring.BusinessWeights;
import com.admissionsgenie.admission.scoring.MarginScorer;
import com.admissionsgenie.admission.scoring.ScoreResult;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/**
 * Runs the evaluation pipeline: classify, resolve the rate, project revenue, resolve the cost
 * model, project cost, then score.
 *
 * Validation and configuration failures propagate as {@link ValidationException} and
 * {@link com.admissionsgenie.admission.error.ConfigurationException}; nothing is returned
 * for a failed evaluation. Every call recomputes from scratch against the snapshot it is given.
 */
public class AdmissionEvaluator {
    private final PipelinePolicy policy;
    private final CaseMixClassifier classifier;
    private final ReimbursementCalculator reimbursementCalculator;
    private final CostEstimator costEstimator;
    private final MarginScorer marginScorer;
    private final LengthOfStayEstimator lengthOfStayEstimator;

    public AdmissionEvaluator(PipelinePolicy policy) {
        this.policy = policy;
        this.classifier = new CaseMixClassifier(policy.classificationTables(), policy.ntaBands());
        this.reimbursementCalculator = new ReimbursementCalculator(policy.maxLengthOfStay());
        this.costEstimator = new CostEstimator(policy.denialRiskModel());
        this.marginScorer = new MarginScorer(policy.scoringPolicy());
        this.lengthOfStayEstimator = new LengthOfStayEstimator(policy.maxLengthOfStay());
    }

    public EvaluationResult evaluate(EvaluationRequest request, ConfigurationSnapshot snapshot) {
        Facility facility = validate(request, snapshot);
        PayerType payerType = request.payerType().get();
        int lengthOfStay = request.projectedLengthOfStay();

        CaseMixClassification classification = classifier.classify(request.features());

        RateRecord rateRecord = new RateResolver(snapshot.rateRecords())
                .resolve(facility.id(), payerType, request.asOfDate());
        RevenueBreakdown revenue = reimbursementCalculator.calculateRevenue(classification,
                rateRecord, lengthOfStay, facility.wageIndex(), facility.vbpMultiplier());

        AcuityBand acuityBand = AcuityBand.fromNursingGroup(classification.nursingGroup());
        CostModelRecord costModel = new CostModelResolver(snapshot.costModels())
                .resolve(facility.id(), acuityBand, request.asOfDate());
        CostBreakdown cost = costEstimator.estimateCost(classification, costModel, lengthOfStay,
                request.authorizationStatus(), payerType, revenue,
                request.features().needsTransport());

        BusinessWeights weights = request.weights()
                .orElse(facility.weights().orElse(policy.defaultWeights()));
        ScoreResult score =
                marginScorer.score(revenue, cost, weights, request.censusPriority());

        return new EvaluationResult(request, classification,
                FinancialProjection.of(revenue, cost), score,
                warnings(classification, facility),
                lengthOfStayEstimator.estimate(classification));
    }

    /**
     * Re-runs the evaluation with a different length of stay and/or census priority.
     */
    public EvaluationResult recalculate(EvaluationRequest original,
            Optional<Integer> lengthOfStay, Optional<Double> censusPriority,
            ConfigurationSnapshot snapshot) {
        EvaluationRequest request = original;
        if (lengthOfStay.isPresent()) {
            request = request.withLengthOfStay(lengthOfStay.get());
        }
        if (censusPriority.isPresent()) {
            request = request.withCensusPriority(censusPriority.get());
        }
        return evaluate(request, snapshot);
    }

    private Facility validate(EvaluationRequest request, ConfigurationSnapshot snapshot) {
        if (request.facilityId() == null || request.facilityId().isBlank()) {
            throw new ValidationException(ValidationError.MISSING_FACILITY,
                    "A facility is required");
        }
        if (request.payerType().isEmpty()) {
            throw new ValidationException(ValidationError.MISSING_PAYER, "A payer is required");
        }
        ReimbursementCalculator.checkLengthOfStay(request.projectedLengthOfStay(),
                policy.maxLengthOfStay());
        if (!(request.censusPriority() >= 0 && request.censusPriority() <= 1)) {
            throw new ValidationException(ValidationError.INVALID_CENSUS_PRIORITY,
                    "Census priority must be within [0, 1]: " + request.censusPriority());
        }
        if (request.asOfDate() == null) {
            throw new ValidationException(ValidationError.INVALID_AS_OF_DATE,
                    "An as-of date is required");
        }
        return snapshot.facility(request.facilityId())
                .orElseThrow(() -> new ValidationException(ValidationError.UNKNOWN_FACILITY,
                        "Facility not found: " + request.facilityId()));
    }

    private static ImmutableList<String> warnings(CaseMixClassification classification,
            Facility facility) {
        ImmutableList.Builder<String> warnings = ImmutableList.builder();
        warnings.addAll(classification.warnings());
        for (SpecialCare need : classification.specialCare()) {
            if (!facility.capabilities().contains(need)) {
                warnings.add("Facility " + facility.id() + " does not list " + need
                        + " among its capabilities");
            }
        }
        return warnings.build();
    }
}
