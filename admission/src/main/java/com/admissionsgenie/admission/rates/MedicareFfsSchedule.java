package com.admissionsgenie.admission.rates;

import com.admissionsgenie.admission.casemix.NtaGroup;
import com.admissionsgenie.admission.casemix.NursingGroup;
import com.admissionsgenie.admission.casemix.SlpGroup;
import com.admissionsgenie.admission.casemix.TherapyGroup;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;

/**
 * PDPM component per-diem rates, as published for the facility's payment year.
 *
 * @param laborShare labor-related share of each component, adjusted by the wage index
 * @param therapyVpd variable per-diem schedule applied to the PT and OT components
 * @param ntaVpd variable per-diem schedule applied to the NTA component
 */
public record MedicareFfsSchedule(ImmutableMap<TherapyGroup, CurrencyAmount> ptRates,
        ImmutableMap<TherapyGroup, CurrencyAmount> otRates,
        ImmutableMap<SlpGroup, CurrencyAmount> slpRates,
        ImmutableMap<NursingGroup, CurrencyAmount> nursingRates,
        ImmutableMap<NtaGroup, CurrencyAmount> ntaRates, CurrencyAmount nonCaseMixRate,
        BigDecimal laborShare, VariablePerDiemSchedule therapyVpd,
        VariablePerDiemSchedule ntaVpd) implements RateSchedule {

    public MedicareFfsSchedule {
        if (laborShare.compareTo(BigDecimal.ZERO) < 0 || laborShare.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Labor share must be within [0, 1]: " + laborShare);
        }
    }

    @Override
    public PayerType payerType() {
        return PayerType.MEDICARE_FFS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final ImmutableMap.Builder<TherapyGroup, CurrencyAmount> ptRates =
                ImmutableMap.builder();
        private final ImmutableMap.Builder<TherapyGroup, CurrencyAmount> otRates =
                ImmutableMap.builder();
        private final ImmutableMap.Builder<SlpGroup, CurrencyAmount> slpRates =
                ImmutableMap.builder();
        private final ImmutableMap.Builder<NursingGroup, CurrencyAmount> nursingRates =
                ImmutableMap.builder();
        private final ImmutableMap.Builder<NtaGroup, CurrencyAmount> ntaRates =
                ImmutableMap.builder();
        private CurrencyAmount nonCaseMixRate = CurrencyAmount.ZERO;
        private BigDecimal laborShare = BigDecimal.ONE;
        private VariablePerDiemSchedule therapyVpd = VariablePerDiemSchedule.NONE;
        private VariablePerDiemSchedule ntaVpd = VariablePerDiemSchedule.NONE;

        public Builder ptRate(TherapyGroup group, String rate) {
            ptRates.put(group, CurrencyAmount.from(rate));
            return this;
        }

        public Builder otRate(TherapyGroup group, String rate) {
            otRates.put(group, CurrencyAmount.from(rate));
            return this;
        }

        public Builder slpRate(SlpGroup group, String rate) {
            slpRates.put(group, CurrencyAmount.from(rate));
            return this;
        }

        public Builder nursingRate(NursingGroup group, String rate) {
            nursingRates.put(group, CurrencyAmount.from(rate));
            return this;
        }

        public Builder ntaRate(NtaGroup group, String rate) {
            ntaRates.put(group, CurrencyAmount.from(rate));
            return this;
        }

        public Builder nonCaseMixRate(String rate) {
            this.nonCaseMixRate = CurrencyAmount.from(rate);
            return this;
        }

        public Builder laborShare(String laborShare) {
            this.laborShare = new BigDecimal(laborShare);
            return this;
        }

        public Builder therapyVpd(VariablePerDiemSchedule therapyVpd) {
            this.therapyVpd = therapyVpd;
            return this;
        }

        public Builder ntaVpd(VariablePerDiemSchedule ntaVpd) {
            this.ntaVpd = ntaVpd;
            return this;
        }

        public MedicareFfsSchedule build() {
            return new MedicareFfsSchedule(ptRates.buildOrThrow(), otRates.buildOrThrow(),
                    slpRates.buildOrThrow(), nursingRates.buildOrThrow(), ntaRates.buildOrThrow(),
                    nonCaseMixRate, laborShare, therapyVpd, ntaVpd);
        }
    }
}
