package com.admissionsgenie.admission.rates;

import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Optional;

/**
 * A Medicare Advantage plan contract. Which fields are populated depends on the contract type.
 */
public record MedicareAdvantageSchedule(ContractType contractType,
        Optional<CurrencyAmount> flatRate, ImmutableList<DayTier> tiers,
        Optional<MedicareFfsSchedule> planSchedule, BigDecimal contractMultiplier)
        implements RateSchedule {

    public enum ContractType {
        /** One per-diem rate for the whole stay. */
        FLAT,
        /** Per-diem rate depends on the day-range tier a stay day falls in. */
        TIERED,
        /** PDPM component logic on plan-specific tables, scaled by a contract multiplier. */
        PDPM_MAPPED
    }

    public MedicareAdvantageSchedule {
        switch (contractType) {
            case FLAT:
                if (flatRate.isEmpty()) {
                    throw new IllegalArgumentException("Flat contract needs a per-diem rate");
                }
                break;
            case TIERED:
                if (tiers.isEmpty()) {
                    throw new IllegalArgumentException("Tiered contract needs day tiers");
                }
                tiers = ImmutableList.sortedCopyOf(Comparator.comparingInt(DayTier::firstDay),
                        tiers);
                for (int i = 1; i < tiers.size(); i++) {
                    if (tiers.get(i).firstDay() <= tiers.get(i - 1).lastDay()) {
                        throw new IllegalArgumentException("Day tiers overlap: "
                                + tiers.get(i - 1).label() + " and " + tiers.get(i).label());
                    }
                }
                break;
            case PDPM_MAPPED:
                if (planSchedule.isEmpty()) {
                    throw new IllegalArgumentException("PDPM-mapped contract needs rate tables");
                }
                if (contractMultiplier.signum() <= 0) {
                    throw new IllegalArgumentException(
                            "Contract multiplier must be positive: " + contractMultiplier);
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown contract type: " + contractType);
        }
    }

    @Override
    public PayerType payerType() {
        return PayerType.MEDICARE_ADVANTAGE;
    }

    public static MedicareAdvantageSchedule flat(CurrencyAmount rate) {
        return new MedicareAdvantageSchedule(ContractType.FLAT, Optional.of(rate),
                ImmutableList.of(), Optional.empty(), BigDecimal.ONE);
    }

    public static MedicareAdvantageSchedule tiered(ImmutableList<DayTier> tiers) {
        return new MedicareAdvantageSchedule(ContractType.TIERED, Optional.empty(), tiers,
                Optional.empty(), BigDecimal.ONE);
    }

    public static MedicareAdvantageSchedule pdpmMapped(MedicareFfsSchedule planSchedule,
            BigDecimal contractMultiplier) {
        return new MedicareAdvantageSchedule(ContractType.PDPM_MAPPED, Optional.empty(),
                ImmutableList.of(), Optional.of(planSchedule), contractMultiplier);
    }
}
