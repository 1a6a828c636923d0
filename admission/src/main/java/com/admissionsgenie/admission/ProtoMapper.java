package com.admissionsgenie.admission;

import com.admissionsgenie.admission.casemix.CaseMixClassification;
import com.admissionsgenie.admission.casemix.ClinicalFeatures;
import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.cost.AuthorizationStatus;
import com.admissionsgenie.admission.cost.CostLine;
import com.admissionsgenie.admission.error.ValidationError;
import com.admissionsgenie.admission.error.ValidationException;
import com.admissionsgenie.admission.evaluation.EvaluationRequest;
import com.admissionsgenie.admission.evaluation.EvaluationResult;
import com.admissionsgenie.admission.evaluation.FinancialProjection;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.revenue.RevenueLine;
import com.admissionsgenie.admission.scoring.BusinessWeights;
import com.admissionsgenie.admission.scoring.ScoreFactor;
import com.admissionsgenie.admission.scoring.ScoreResult;
import com.admissionsgenie.shared.AdmissionDecision;
import com.admissionsgenie.shared.AuthorizationState;
import com.admissionsgenie.shared.CaseMixGroups;
import com.admissionsgenie.shared.ClinicalIntake;
import com.admissionsgenie.shared.EvaluateAdmissionRequest;
import com.admissionsgenie.shared.EvaluateAdmissionResponse;
import com.admissionsgenie.shared.EvaluateAdmissionResult;
import com.admissionsgenie.shared.LineItem;
import com.admissionsgenie.shared.PayerFamily;
import com.admissionsgenie.shared.ProjectionSummary;
import com.admissionsgenie.shared.ScoreFactorLine;
import com.admissionsgenie.shared.ScoreSummary;
import com.admissionsgenie.shared.WeightOverrides;
import com.google.common.base.Enums;
import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Converts between the wire messages and the evaluation types.
 */
final class ProtoMapper {

    private ProtoMapper() {}

    /**
     * @param today used when the request carries no as-of date
     * @param warnings receives a warning for every special-care flag that is not recognized
     */
    static EvaluationRequest toRequest(EvaluateAdmissionRequest proto, LocalDate today,
            ImmutableList.Builder<String> warnings) {
        EvaluationRequest.Builder builder = EvaluationRequest.builder()
                .facilityId(proto.getFacilityId())
                .projectedLengthOfStay(proto.getProjectedLos())
                .authorizationStatus(toAuthorizationStatus(proto.getAuthorizationStatus()))
                .censusPriority(proto.getCensusPriority())
                .asOfDate(toAsOfDate(proto.getAsOfDate(), today))
                .features(toFeatures(proto.getFeatures(), warnings));
        toPayerType(proto.getPayerType()).ifPresent(builder::payerType);
        if (proto.hasWeights()) {
            builder.weights(toWeights(proto.getWeights()));
        }
        return builder.build();
    }

    static Optional<PayerType> toPayerType(PayerFamily payerFamily) {
        switch (payerFamily) {
            case PAYER_FAMILY_MEDICARE_FFS:
                return Optional.of(PayerType.MEDICARE_FFS);
            case PAYER_FAMILY_MEDICARE_ADVANTAGE:
                return Optional.of(PayerType.MEDICARE_ADVANTAGE);
            case PAYER_FAMILY_MEDICAID:
                return Optional.of(PayerType.MEDICAID);
            case PAYER_FAMILY_MANAGED_CARE_ORGANIZATION:
                return Optional.of(PayerType.MANAGED_CARE_ORGANIZATION);
            default:
                return Optional.empty();
        }
    }

    static AuthorizationStatus toAuthorizationStatus(AuthorizationState state) {
        switch (state) {
            case AUTHORIZATION_STATE_APPROVED:
                return AuthorizationStatus.APPROVED;
            case AUTHORIZATION_STATE_PENDING:
                return AuthorizationStatus.PENDING;
            case AUTHORIZATION_STATE_DENIED:
                return AuthorizationStatus.DENIED;
            default:
                return AuthorizationStatus.UNKNOWN;
        }
    }

    private static LocalDate toAsOfDate(String asOfDate, LocalDate today) {
        if (asOfDate.isBlank()) {
            return today;
        }
        try {
            return LocalDate.parse(asOfDate.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(ValidationError.INVALID_AS_OF_DATE,
                    "As-of date is not an ISO-8601 date: " + asOfDate);
        }
    }

    private static BusinessWeights toWeights(WeightOverrides weights) {
        try {
            return new BusinessWeights(weights.getCensusWeight(), weights.getRiskWeight(),
                    weights.getComplexityWeight());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ValidationError.INVALID_WEIGHTS, e.getMessage());
        }
    }

    private static ClinicalFeatures toFeatures(ClinicalIntake intake,
            ImmutableList.Builder<String> warnings) {
        Set<SpecialCare> specialCare = EnumSet.noneOf(SpecialCare.class);
        for (String flag : intake.getSpecialCareList()) {
            Optional<SpecialCare> parsed = Enums.getIfPresent(SpecialCare.class,
                    flag.trim().toUpperCase(Locale.ROOT)).toJavaUtil();
            if (parsed.isPresent()) {
                specialCare.add(parsed.get());
            } else {
                warnings.add("Unrecognized special care flag ignored: " + flag);
            }
        }
        ClinicalFeatures.Builder builder = ClinicalFeatures.builder()
                .primaryDiagnosis(intake.getPrimaryDiagnosis())
                .secondaryDiagnoses(intake.getSecondaryDiagnosesList())
                .medications(intake.getMedicationsList())
                .therapyMinutesPerDay(intake.getTherapyMinutesPerDay())
                .specialCare(specialCare)
                .depression(intake.getDepression())
                .swallowingDisorder(intake.getSwallowingDisorder())
                .mechanicallyAlteredDiet(intake.getMechanicallyAlteredDiet())
                .needsSlpTherapy(intake.getNeedsSlpTherapy())
                .needsTransport(intake.getNeedsTransport());
        if (intake.hasFunctionScore()) {
            builder.functionScore(intake.getFunctionScore());
        }
        if (intake.hasCognitiveScore()) {
            builder.cognitiveScore(intake.getCognitiveScore());
        }
        return builder.build();
    }

    static EvaluateAdmissionResponse toResponse(EvaluationResult result,
            ImmutableList<String> mappingWarnings) {
        return EvaluateAdmissionResponse.newBuilder()
                .setResult(EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_SUCCESS)
                .setClassification(toProto(result.classification()))
                .setProjection(toProto(result.projection()))
                .setScore(toProto(result.score()))
                .addAllWarnings(mappingWarnings)
                .addAllWarnings(result.warnings())
                .setSuggestedLos(result.suggestedLengthOfStay())
                .build();
    }

    static EvaluateAdmissionResponse errorResponse(EvaluateAdmissionResult result,
            String errorCode, String errorMessage) {
        return EvaluateAdmissionResponse.newBuilder().setResult(result).setErrorCode(errorCode)
                .setErrorMessage(errorMessage).build();
    }

    private static CaseMixGroups toProto(CaseMixClassification classification) {
        return CaseMixGroups.newBuilder()
                .setPtGroup(classification.ptGroup().name())
                .setOtGroup(classification.otGroup().name())
                .setSlpGroup(classification.slpGroup().name())
                .setNursingGroup(classification.nursingGroup().name())
                .setNtaScore(classification.ntaScore())
                .setNtaGroup(classification.ntaGroup().name())
                .setClinicalCategory(classification.clinicalCategory().name())
                .setComplexityScore(classification.complexityScore())
                .addAllWarnings(classification.warnings())
                .build();
    }

    private static ProjectionSummary toProto(FinancialProjection projection) {
        ProjectionSummary.Builder builder = ProjectionSummary.newBuilder();
        for (RevenueLine line : projection.revenue().lines()) {
            builder.addRevenueLines(LineItem.newBuilder().setCategory(line.category().name())
                    .setLabel(line.label()).setAmount(line.amount().toProto()));
        }
        for (CostLine line : projection.cost().lines()) {
            builder.addCostLines(LineItem.newBuilder().setCategory(line.category().name())
                    .setLabel(line.label()).setAmount(line.amount().toProto()));
        }
        return builder.setTotalRevenue(projection.revenue().total().toProto())
                .setTotalCost(projection.cost().total().toProto())
                .setProjectedMarginPerDiem(projection.projectedMarginPerDiem().toProto())
                .setProjectedMarginTotal(projection.projectedMarginTotal().toProto())
                .setDenialProbability(projection.cost().denialProbability().doubleValue())
                .setLengthOfStay(projection.revenue().lengthOfStay())
                .build();
    }

    private static ScoreSummary toProto(ScoreResult score) {
        ScoreSummary.Builder builder = ScoreSummary.newBuilder().setRawScore(score.rawScore())
                .setSummary(score.summary());
        switch (score.recommendation()) {
            case ACCEPT:
                builder.setRecommendation(AdmissionDecision.ADMISSION_DECISION_ACCEPT);
                break;
            case DEFER:
                builder.setRecommendation(AdmissionDecision.ADMISSION_DECISION_DEFER);
                break;
            case DECLINE:
                builder.setRecommendation(AdmissionDecision.ADMISSION_DECISION_DECLINE);
                break;
            default:
                throw new IllegalStateException(
                        "Unknown recommendation " + score.recommendation());
        }
        for (ScoreFactor factor : score.factors()) {
            builder.addFactors(ScoreFactorLine.newBuilder().setName(factor.name())
                    .setContribution(factor.contribution()).setRationale(factor.rationale()));
        }
        return builder.build();
    }
}
