package com.admissionsgenie.admission.config;

import static org.junit.jupiter.api.Assertions.*;

import com.admissionsgenie.admission.casemix.NtaGroup;
import com.admissionsgenie.admission.cost.AuthorizationStatus;
import com.admissionsgenie.admission.error.ConfigurationError;
import com.admissionsgenie.admission.error.ConfigurationException;
import com.admissionsgenie.admission.evaluation.PipelinePolicy;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.scoring.NormalizationCurve;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluationPropertiesTest {

    @Test
    void toPipelinePolicy_defaultsMatchStandardPolicy() {
        assertEquals(PipelinePolicy.STANDARD, new EvaluationProperties().toPipelinePolicy());
    }

    @Test
    void toPipelinePolicy_appliesOverrides() {
        EvaluationProperties properties = new EvaluationProperties();
        properties.setMaxLengthOfStay(60);
        properties.getScoring().setCurve(NormalizationCurve.LINEAR);
        properties.getScoring().setAcceptThreshold(80);
        properties.getWeights().setRisk(0.4);
        properties.getDenial().setRates(Map.of(PayerType.MEDICAID,
                Map.of(AuthorizationStatus.PENDING, new BigDecimal("0.12"))));

        PipelinePolicy policy = properties.toPipelinePolicy();

        assertEquals(60, policy.maxLengthOfStay());
        assertEquals(NormalizationCurve.LINEAR, policy.scoringPolicy().curve());
        assertEquals(80, policy.scoringPolicy().thresholds().accept(), 1e-9);
        assertEquals(0.4, policy.defaultWeights().riskWeight(), 1e-9);
        assertEquals(new BigDecimal("0.12"), policy.denialRiskModel().payerConfigs()
                .get(PayerType.MEDICAID).pendingDenialRate());
        assertEquals(new BigDecimal("0.03"), policy.denialRiskModel().payerConfigs()
                .get(PayerType.MEDICAID).approvedDenialRate(), "Unset statuses keep the standard");
    }

    @Test
    void toPipelinePolicy_rejectsInconsistentSettings() {
        EvaluationProperties thresholds = new EvaluationProperties();
        thresholds.getScoring().setDeferThreshold(90);
        assertInvalid(thresholds);

        EvaluationProperties denial = new EvaluationProperties();
        denial.getDenial().setRates(Map.of(PayerType.MEDICARE_FFS,
                Map.of(AuthorizationStatus.APPROVED, new BigDecimal("0.50"))));
        assertInvalid(denial);

        EvaluationProperties bands = new EvaluationProperties();
        Map<NtaGroup, Integer> ntaBands = new EnumMap<>(bands.getNtaBands());
        ntaBands.put(NtaGroup.NA, 0);
        bands.setNtaBands(ntaBands);
        assertInvalid(bands);

        EvaluationProperties weights = new EvaluationProperties();
        weights.getWeights().setCensus(-0.1);
        assertInvalid(weights);
    }

    private static void assertInvalid(EvaluationProperties properties) {
        ConfigurationException e =
                assertThrows(ConfigurationException.class, properties::toPipelinePolicy);
        assertEquals(ConfigurationError.INVALID_POLICY, e.error());
        assertTrue(e.getMessage().startsWith("Invalid evaluation settings: "), e.getMessage());
    }
}
