package com.admissionsgenie.admission.config;

import com.admissionsgenie.admission.casemix.ClassificationTables;
import com.admissionsgenie.admission.casemix.NtaBands;
import com.admissionsgenie.admission.casemix.NtaGroup;
import com.admissionsgenie.admission.cost.AuthorizationStatus;
import com.admissionsgenie.admission.cost.DenialRiskModel;
import com.admissionsgenie.admission.cost.PayerConfig;
import com.admissionsgenie.admission.error.ConfigurationError;
import com.admissionsgenie.admission.error.ConfigurationException;
import com.admissionsgenie.admission.evaluation.PipelinePolicy;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.scoring.BusinessWeights;
import com.admissionsgenie.admission.scoring.NormalizationCurve;
import com.admissionsgenie.admission.scoring.RecommendationThresholds;
import com.admissionsgenie.admission.scoring.ScoringPolicy;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Service-wide evaluation settings, bound from {@code evaluation.*} properties. Anything not set
 * keeps the standard value.
 */
@ConfigurationProperties(prefix = "evaluation")
public class EvaluationProperties {
    private int maxLengthOfStay = PipelinePolicy.DEFAULT_MAX_LENGTH_OF_STAY;
    private final Scoring scoring = new Scoring();
    private final Weights weights = new Weights();
    private final Denial denial = new Denial();
    private Map<NtaGroup, Integer> ntaBands = new EnumMap<>(NtaBands.STANDARD.minimumScores());

    public int getMaxLengthOfStay() {
        return maxLengthOfStay;
    }

    public void setMaxLengthOfStay(int maxLengthOfStay) {
        this.maxLengthOfStay = maxLengthOfStay;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public Weights getWeights() {
        return weights;
    }

    public Denial getDenial() {
        return denial;
    }

    public Map<NtaGroup, Integer> getNtaBands() {
        return ntaBands;
    }

    public void setNtaBands(Map<NtaGroup, Integer> ntaBands) {
        this.ntaBands = ntaBands;
    }

    /**
     * @throws ConfigurationException with {@code INVALID_POLICY} if the settings are inconsistent
     */
    public PipelinePolicy toPipelinePolicy() {
        try {
            ScoringPolicy scoringPolicy = new ScoringPolicy(scoring.curve,
                    scoring.saturationMargin, scoring.lossFloorMargin, scoring.linearSpan,
                    scoring.censusMaxPoints, scoring.denialMaxPoints,
                    new RecommendationThresholds(scoring.acceptThreshold,
                            scoring.deferThreshold));
            return new PipelinePolicy(ClassificationTables.STANDARD,
                    new NtaBands(ImmutableMap.copyOf(ntaBands)), denial.toModel(), scoringPolicy,
                    new BusinessWeights(weights.census, weights.risk, weights.complexity),
                    maxLengthOfStay);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ConfigurationError.INVALID_POLICY,
                    "Invalid evaluation settings: " + e.getMessage());
        }
    }

    public static class Scoring {
        private NormalizationCurve curve = ScoringPolicy.STANDARD.curve();
        private double saturationMargin = ScoringPolicy.STANDARD.saturationMargin();
        private double lossFloorMargin = ScoringPolicy.STANDARD.lossFloorMargin();
        private double linearSpan = ScoringPolicy.STANDARD.linearSpan();
        private double censusMaxPoints = ScoringPolicy.STANDARD.censusMaxPoints();
        private double denialMaxPoints = ScoringPolicy.STANDARD.denialMaxPoints();
        private double acceptThreshold = RecommendationThresholds.DEFAULT.accept();
        private double deferThreshold = RecommendationThresholds.DEFAULT.defer();

        public NormalizationCurve getCurve() {
            return curve;
        }

        public void setCurve(NormalizationCurve curve) {
            this.curve = curve;
        }

        public double getSaturationMargin() {
            return saturationMargin;
        }

        public void setSaturationMargin(double saturationMargin) {
            this.saturationMargin = saturationMargin;
        }

        public double getLossFloorMargin() {
            return lossFloorMargin;
        }

        public void setLossFloorMargin(double lossFloorMargin) {
            this.lossFloorMargin = lossFloorMargin;
        }

        public double getLinearSpan() {
            return linearSpan;
        }

        public void setLinearSpan(double linearSpan) {
            this.linearSpan = linearSpan;
        }

        public double getCensusMaxPoints() {
            return censusMaxPoints;
        }

        public void setCensusMaxPoints(double censusMaxPoints) {
            this.censusMaxPoints = censusMaxPoints;
        }

        public double getDenialMaxPoints() {
            return denialMaxPoints;
        }

        public void setDenialMaxPoints(double denialMaxPoints) {
            this.denialMaxPoints = denialMaxPoints;
        }

        public double getAcceptThreshold() {
            return acceptThreshold;
        }

        public void setAcceptThreshold(double acceptThreshold) {
            this.acceptThreshold = acceptThreshold;
        }

        public double getDeferThreshold() {
            return deferThreshold;
        }

        public void setDeferThreshold(double deferThreshold) {
            this.deferThreshold = deferThreshold;
        }
    }

    public static class Weights {
        private double census = BusinessWeights.DEFAULT.censusWeight();
        private double risk = BusinessWeights.DEFAULT.riskWeight();
        private double complexity = BusinessWeights.DEFAULT.complexityWeight();

        public double getCensus() {
            return census;
        }

        public void setCensus(double census) {
            this.census = census;
        }

        public double getRisk() {
            return risk;
        }

        public void setRisk(double risk) {
            this.risk = risk;
        }

        public double getComplexity() {
            return complexity;
        }

        public void setComplexity(double complexity) {
            this.complexity = complexity;
        }
    }

    public static class Denial {
        private BigDecimal complexityIncrement = DenialRiskModel.STANDARD.complexityIncrement();
        private BigDecimal maxProbability = DenialRiskModel.STANDARD.maxProbability();
        private BigDecimal revenueAtRiskShare = DenialRiskModel.STANDARD.revenueAtRiskShare();
        /** Overrides of the standard base rates, e.g. {@code rates.MEDICAID.PENDING=0.12}. */
        private Map<PayerType, Map<AuthorizationStatus, BigDecimal>> rates =
                new EnumMap<>(PayerType.class);

        public BigDecimal getComplexityIncrement() {
            return complexityIncrement;
        }

        public void setComplexityIncrement(BigDecimal complexityIncrement) {
            this.complexityIncrement = complexityIncrement;
        }

        public BigDecimal getMaxProbability() {
            return maxProbability;
        }

        public void setMaxProbability(BigDecimal maxProbability) {
            this.maxProbability = maxProbability;
        }

        public BigDecimal getRevenueAtRiskShare() {
            return revenueAtRiskShare;
        }

        public void setRevenueAtRiskShare(BigDecimal revenueAtRiskShare) {
            this.revenueAtRiskShare = revenueAtRiskShare;
        }

        public Map<PayerType, Map<AuthorizationStatus, BigDecimal>> getRates() {
            return rates;
        }

        public void setRates(Map<PayerType, Map<AuthorizationStatus, BigDecimal>> rates) {
            this.rates = rates;
        }

        DenialRiskModel toModel() {
            ImmutableMap.Builder<PayerType, PayerConfig> configs = ImmutableMap.builder();
            for (PayerType payerType : PayerType.values()) {
                PayerConfig standard = PayerConfig.PAYER_CONFIGS.get(payerType);
                Map<AuthorizationStatus, BigDecimal> overrides =
                        rates.getOrDefault(payerType, Map.of());
                configs.put(payerType, new PayerConfig(payerType,
                        overrides.getOrDefault(AuthorizationStatus.APPROVED,
                                standard.approvedDenialRate()),
                        overrides.getOrDefault(AuthorizationStatus.PENDING,
                                standard.pendingDenialRate()),
                        overrides.getOrDefault(AuthorizationStatus.UNKNOWN,
                                standard.unknownDenialRate()),
                        overrides.getOrDefault(AuthorizationStatus.DENIED,
                                standard.deniedDenialRate())));
            }
            return new DenialRiskModel(configs.buildOrThrow(), complexityIncrement,
                    maxProbability, revenueAtRiskShare);
        }
    }
}
