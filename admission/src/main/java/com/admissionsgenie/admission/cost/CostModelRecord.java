package com.admissionsgenie.admission.cost;

import com.admissionsgenie.admission.rates.EffectiveInterval;
import com.admissionsgenie.admission.rates.Versioned;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;

/**
 * Facility cost assumptions for one acuity band.
 *
 * @param overheadRate fraction of direct costs added as overhead, e.g. 0.22
 */
public record CostModelRecord(String id, String facilityId, AcuityBand acuityBand,
        EffectiveInterval interval, BigDecimal nursingHoursPerDay, CurrencyAmount hourlyNursingRate,
        CurrencyAmount supplyPerDay, CurrencyAmount pharmacyPerDay, CurrencyAmount transportCost,
        BigDecimal overheadRate, ImmutableList<CostSurcharge> surcharges) implements Versioned {

    public CostModelRecord {
        if (nursingHoursPerDay.signum() < 0) {
            throw new IllegalArgumentException("Nursing hours cannot be negative");
        }
        if (overheadRate.signum() < 0) {
            throw new IllegalArgumentException("Overhead rate cannot be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String facilityId;
        private AcuityBand acuityBand;
        private EffectiveInterval interval;
        private BigDecimal nursingHoursPerDay = BigDecimal.ZERO;
        private CurrencyAmount hourlyNursingRate = CurrencyAmount.ZERO;
        private CurrencyAmount supplyPerDay = CurrencyAmount.ZERO;
        private CurrencyAmount pharmacyPerDay = CurrencyAmount.ZERO;
        private CurrencyAmount transportCost = CurrencyAmount.ZERO;
        private BigDecimal overheadRate = BigDecimal.ZERO;
        private final ImmutableList.Builder<CostSurcharge> surcharges = ImmutableList.builder();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder facilityId(String facilityId) {
            this.facilityId = facilityId;
            return this;
        }

        public Builder acuityBand(AcuityBand acuityBand) {
            this.acuityBand = acuityBand;
            return this;
        }

        public Builder interval(EffectiveInterval interval) {
            this.interval = interval;
            return this;
        }

        public Builder nursingHoursPerDay(String nursingHoursPerDay) {
            this.nursingHoursPerDay = new BigDecimal(nursingHoursPerDay);
            return this;
        }

        public Builder hourlyNursingRate(String hourlyNursingRate) {
            this.hourlyNursingRate = CurrencyAmount.from(hourlyNursingRate);
            return this;
        }

        public Builder supplyPerDay(String supplyPerDay) {
            this.supplyPerDay = CurrencyAmount.from(supplyPerDay);
            return this;
        }

        public Builder pharmacyPerDay(String pharmacyPerDay) {
            this.pharmacyPerDay = CurrencyAmount.from(pharmacyPerDay);
            return this;
        }

        public Builder transportCost(String transportCost) {
            this.transportCost = CurrencyAmount.from(transportCost);
            return this;
        }

        public Builder overheadRate(String overheadRate) {
            this.overheadRate = new BigDecimal(overheadRate);
            return this;
        }

        public Builder surcharge(CostSurcharge surcharge) {
            this.surcharges.add(surcharge);
            return this;
        }

        public CostModelRecord build() {
            return new CostModelRecord(id, facilityId, acuityBand, interval, nursingHoursPerDay,
                    hourlyNursingRate, supplyPerDay, pharmacyPerDay, transportCost, overheadRate,
                    surcharges.build());
        }
    }
}
