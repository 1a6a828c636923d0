package com.admissionsgenie.admission.cost;

import com.admissionsgenie.admission.rates.PayerType;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;

/**
 * Base claim-denial probabilities for one payer type, by authorization status.
 */
public record PayerConfig(PayerType payerType, BigDecimal approvedDenialRate,
        BigDecimal pendingDenialRate, BigDecimal unknownDenialRate, BigDecimal deniedDenialRate) {

    public static final ImmutableMap<PayerType, PayerConfig> PAYER_CONFIGS = ImmutableMap.of(
            PayerType.MEDICARE_FFS,
            PayerConfig.builder().payerType(PayerType.MEDICARE_FFS).approvedDenialRate("0.02")
                    .pendingDenialRate("0.15").unknownDenialRate("0.25")
                    .deniedDenialRate("0.90").build(),
            PayerType.MEDICARE_ADVANTAGE,
            PayerConfig.builder().payerType(PayerType.MEDICARE_ADVANTAGE)
                    .approvedDenialRate("0.05").pendingDenialRate("0.20")
                    .unknownDenialRate("0.35").deniedDenialRate("0.90").build(),
            PayerType.MEDICAID,
            PayerConfig.builder().payerType(PayerType.MEDICAID).approvedDenialRate("0.03")
                    .pendingDenialRate("0.10").unknownDenialRate("0.15")
                    .deniedDenialRate("0.90").build(),
            PayerType.MANAGED_CARE_ORGANIZATION,
            PayerConfig.builder().payerType(PayerType.MANAGED_CARE_ORGANIZATION)
                    .approvedDenialRate("0.03").pendingDenialRate("0.12")
                    .unknownDenialRate("0.18").deniedDenialRate("0.90").build());

    public PayerConfig {
        BigDecimal[] ordered =
                {approvedDenialRate, pendingDenialRate, unknownDenialRate, deniedDenialRate};
        for (int i = 0; i < ordered.length; i++) {
            if (ordered[i].signum() < 0 || ordered[i].compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException(
                        "Denial rates must be within [0, 1] for " + payerType);
            }
            if (i > 0 && ordered[i].compareTo(ordered[i - 1]) < 0) {
                throw new IllegalArgumentException("Denial rates for " + payerType
                        + " must not decrease from approved to pending to unknown to denied");
            }
        }
    }

    public BigDecimal denialRate(AuthorizationStatus status) {
        switch (status) {
            case APPROVED:
                return approvedDenialRate;
            case PENDING:
                return pendingDenialRate;
            case DENIED:
                return deniedDenialRate;
            case UNKNOWN:
            default:
                return unknownDenialRate;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PayerType payerType;
        private BigDecimal approvedDenialRate;
        private BigDecimal pendingDenialRate;
        private BigDecimal unknownDenialRate;
        private BigDecimal deniedDenialRate;

        public Builder payerType(PayerType payerType) {
            this.payerType = payerType;
            return this;
        }

        public Builder approvedDenialRate(String approvedDenialRate) {
            this.approvedDenialRate = new BigDecimal(approvedDenialRate);
            return this;
        }

        public Builder pendingDenialRate(String pendingDenialRate) {
            this.pendingDenialRate = new BigDecimal(pendingDenialRate);
            return this;
        }

        public Builder unknownDenialRate(String unknownDenialRate) {
            this.unknownDenialRate = new BigDecimal(unknownDenialRate);
            return this;
        }

        public Builder deniedDenialRate(String deniedDenialRate) {
            this.deniedDenialRate = new BigDecimal(deniedDenialRate);
            return this;
        }

        public PayerConfig build() {
            return new PayerConfig(payerType, approvedDenialRate, pendingDenialRate,
                    unknownDenialRate, deniedDenialRate);
        }
    }
}
