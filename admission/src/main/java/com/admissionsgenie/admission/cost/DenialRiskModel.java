package com.admissionsgenie.admission.cost;

import com.admissionsgenie.admission.rates.PayerType;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;

/**
 * Heuristic claim-denial probability: the payer's base rate for the authorization status plus a
 * fixed increment per complexity point, capped.
 *
 * @param revenueAtRiskShare fraction of projected revenue lost when a claim is denied
 */
public record DenialRiskModel(ImmutableMap<PayerType, PayerConfig> payerConfigs,
        BigDecimal complexityIncrement, BigDecimal maxProbability,
        BigDecimal revenueAtRiskShare) {

    public static final DenialRiskModel STANDARD = new DenialRiskModel(PayerConfig.PAYER_CONFIGS,
            new BigDecimal("0.005"), new BigDecimal("0.95"), BigDecimal.ONE);

    public DenialRiskModel {
        for (PayerType payerType : PayerType.values()) {
            if (!payerConfigs.containsKey(payerType)) {
                throw new IllegalArgumentException("No denial rates for " + payerType);
            }
        }
        if (complexityIncrement.signum() < 0) {
            throw new IllegalArgumentException("Complexity increment cannot be negative");
        }
        if (maxProbability.signum() < 0 || maxProbability.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Maximum denial probability must be within [0, 1]");
        }
        if (revenueAtRiskShare.signum() < 0 || revenueAtRiskShare.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Revenue at risk share must be within [0, 1]");
        }
    }

    public BigDecimal probability(PayerType payerType, AuthorizationStatus status,
            int complexityScore) {
        BigDecimal probability = payerConfigs.get(payerType).denialRate(status)
                .add(complexityIncrement.multiply(BigDecimal.valueOf(complexityScore)));
        return probability.min(maxProbability);
    }
}
