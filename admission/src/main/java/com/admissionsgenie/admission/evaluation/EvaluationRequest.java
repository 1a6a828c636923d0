package com.admissionsgenie.admission.evaluation;

import com.admissionsgenie.admission.casemix.ClinicalFeatures;
import com.admissionsgenie.admission.cost.AuthorizationStatus;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.scoring.BusinessWeights;
import java.time.LocalDate;
import java.util.Optional;

/**
 * One admission to evaluate.
 *
 * @param payerType empty when the caller did not name a payer
 * @param censusPriority 0 (census full) to 1 (beds urgently need filling)
 * @param weights overrides the facility's business weights when present
 */
public record EvaluationRequest(String facilityId, Optional<PayerType> payerType,
        int projectedLengthOfStay, AuthorizationStatus authorizationStatus,
        double censusPriority, LocalDate asOfDate, ClinicalFeatures features,
        Optional<BusinessWeights> weights) {

    public EvaluationRequest withLengthOfStay(int lengthOfStay) {
        return new EvaluationRequest(facilityId, payerType, lengthOfStay, authorizationStatus,
                censusPriority, asOfDate, features, weights);
    }

    public EvaluationRequest withCensusPriority(double priority) {
        return new EvaluationRequest(facilityId, payerType, projectedLengthOfStay,
                authorizationStatus, priority, asOfDate, features, weights);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String facilityId;
        private Optional<PayerType> payerType = Optional.empty();
        private int projectedLengthOfStay;
        private AuthorizationStatus authorizationStatus = AuthorizationStatus.UNKNOWN;
        private double censusPriority;
        private LocalDate asOfDate;
        private ClinicalFeatures features = ClinicalFeatures.builder().build();
        private Optional<BusinessWeights> weights = Optional.empty();

        public Builder facilityId(String facilityId) {
            this.facilityId = facilityId;
            return this;
        }

        public Builder payerType(PayerType payerType) {
            this.payerType = Optional.ofNullable(payerType);
            return this;
        }

        public Builder projectedLengthOfStay(int projectedLengthOfStay) {
            this.projectedLengthOfStay = projectedLengthOfStay;
            return this;
        }

        public Builder authorizationStatus(AuthorizationStatus authorizationStatus) {
            this.authorizationStatus = authorizationStatus;
            return this;
        }

        public Builder censusPriority(double censusPriority) {
            this.censusPriority = censusPriority;
            return this;
        }

        public Builder asOfDate(LocalDate asOfDate) {
            this.asOfDate = asOfDate;
            return this;
        }

        public Builder features(ClinicalFeatures features) {
            this.features = features;
            return this;
        }

        public Builder weights(BusinessWeights weights) {
            this.weights = Optional.ofNullable(weights);
            return this;
        }

        public EvaluationRequest build() {
            return new EvaluationRequest(facilityId, payerType, projectedLengthOfStay,
                    authorizationStatus, censusPriority, asOfDate, features, weights);
        }
    }
}
