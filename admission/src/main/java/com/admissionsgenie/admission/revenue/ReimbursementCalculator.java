package com.admissionsgenie.admission.revenue;

import com.admissionsgenie.admission.casemix.CaseMixClassification;
import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.error.ConfigurationError;
import com.admissionsgenie.admission.error.ConfigurationException;
import com.admissionsgenie.admission.error.ValidationError;
import com.admissionsgenie.admission.error.ValidationException;
import com.admissionsgenie.admission.rates.DayTier;
import com.admissionsgenie.admission.rates.ManagedCareSchedule;
import com.admissionsgenie.admission.rates.MedicaidSchedule;
import com.admissionsgenie.admission.rates.MedicareAdvantageSchedule;
import com.admissionsgenie.admission.rates.MedicareFfsSchedule;
import com.admissionsgenie.admission.rates.RateRecord;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Projects revenue for a stay from its case-mix groups and the rate record in force.
 *
 * One calculation per payer family, selected by the rate record's payer type. All arithmetic is
 * done in {@link BigDecimal}; each line is truncated to cents once, and the total is the sum of
 * the lines.
 */
public class ReimbursementCalculator {
    private final int maxLengthOfStay;

    public ReimbursementCalculator(int maxLengthOfStay) {
        this.maxLengthOfStay = maxLengthOfStay;
    }

    public RevenueBreakdown calculateRevenue(CaseMixClassification classification,
            RateRecord rateRecord, int lengthOfStay, BigDecimal wageIndex,
            BigDecimal vbpMultiplier) {
        checkLengthOfStay(lengthOfStay, maxLengthOfStay);
        ImmutableList<RevenueLine> lines;
        switch (rateRecord.payerType()) {
            case MEDICARE_FFS:
                lines = medicareFfs(classification, (MedicareFfsSchedule) rateRecord.schedule(),
                        lengthOfStay, wageIndex, vbpMultiplier, BigDecimal.ONE, rateRecord.id());
                break;
            case MEDICARE_ADVANTAGE:
                lines = medicareAdvantage(classification,
                        (MedicareAdvantageSchedule) rateRecord.schedule(), lengthOfStay,
                        rateRecord.id());
                break;
            case MEDICAID:
                lines = medicaid(classification, (MedicaidSchedule) rateRecord.schedule(),
                        lengthOfStay);
                break;
            case MANAGED_CARE_ORGANIZATION:
                lines = managedCare(classification, (ManagedCareSchedule) rateRecord.schedule(),
                        lengthOfStay, rateRecord.id());
                break;
            default:
                throw new IllegalArgumentException("Unknown payer type " + rateRecord.payerType());
        }
        return RevenueBreakdown.of(rateRecord.payerType(), rateRecord.id(), lengthOfStay, lines);
    }

    public static void checkLengthOfStay(int lengthOfStay, int maxLengthOfStay) {
        if (lengthOfStay < 1 || lengthOfStay > maxLengthOfStay) {
            throw new ValidationException(ValidationError.INVALID_LOS, "Length of stay "
                    + lengthOfStay + " is outside 1-" + maxLengthOfStay + " days");
        }
    }

    /**
     * PDPM components. Every component is wage-adjusted on its labor share; nursing is also
     * scaled by the VBP multiplier, and every component by {@code contractScale}.
     */
    private static ImmutableList<RevenueLine> medicareFfs(CaseMixClassification classification,
            MedicareFfsSchedule schedule, int lengthOfStay, BigDecimal wageIndex,
            BigDecimal vbpMultiplier, BigDecimal contractScale, String rateRecordId) {
        BigDecimal wageAdjustment = schedule.laborShare().multiply(wageIndex)
                .add(BigDecimal.ONE.subtract(schedule.laborShare()));
        BigDecimal componentScale = wageAdjustment.multiply(contractScale);
        BigDecimal days = BigDecimal.valueOf(lengthOfStay);
        BigDecimal therapyDays = schedule.therapyVpd().cumulativeFactor(lengthOfStay);

        ImmutableList.Builder<RevenueLine> lines = ImmutableList.builder();
        lines.add(component(RevenueCategory.PHYSICAL_THERAPY, "PT " + classification.ptGroup(),
                lookup(schedule.ptRates(), classification.ptGroup(), "PT", rateRecordId),
                therapyDays, componentScale));
        lines.add(component(RevenueCategory.OCCUPATIONAL_THERAPY,
                "OT " + classification.otGroup(),
                lookup(schedule.otRates(), classification.otGroup(), "OT", rateRecordId),
                therapyDays, componentScale));
        if (classification.slpGroup().isBillable()) {
            lines.add(component(RevenueCategory.SPEECH_LANGUAGE_PATHOLOGY,
                    "SLP " + classification.slpGroup(),
                    lookup(schedule.slpRates(), classification.slpGroup(), "SLP", rateRecordId),
                    days, componentScale));
        }
        lines.add(component(RevenueCategory.NURSING, "Nursing " + classification.nursingGroup(),
                lookup(schedule.nursingRates(), classification.nursingGroup(), "nursing",
                        rateRecordId),
                days, componentScale.multiply(vbpMultiplier)));
        lines.add(component(RevenueCategory.NON_THERAPY_ANCILLARY,
                "NTA " + classification.ntaGroup() + " (score " + classification.ntaScore() + ")",
                lookup(schedule.ntaRates(), classification.ntaGroup(), "NTA", rateRecordId),
                schedule.ntaVpd().cumulativeFactor(lengthOfStay), componentScale));
        lines.add(component(RevenueCategory.NON_CASE_MIX, "Non-case-mix",
                schedule.nonCaseMixRate(), days, componentScale));
        return lines.build();
    }

    private static ImmutableList<RevenueLine> medicareAdvantage(
            CaseMixClassification classification, MedicareAdvantageSchedule schedule,
            int lengthOfStay, String rateRecordId) {
        switch (schedule.contractType()) {
            case FLAT:
                CurrencyAmount rate = schedule.flatRate().get();
                return ImmutableList.of(new RevenueLine(RevenueCategory.PER_DIEM,
                        "Flat per diem (" + lengthOfStay + " days @ " + rate + ")",
                        rate.times(lengthOfStay)));
            case TIERED:
                return tiered(schedule.tiers(), lengthOfStay, rateRecordId);
            case PDPM_MAPPED:
                return medicareFfs(classification, schedule.planSchedule().get(), lengthOfStay,
                        BigDecimal.ONE, BigDecimal.ONE, schedule.contractMultiplier(),
                        rateRecordId);
            default:
                throw new IllegalArgumentException(
                        "Unknown contract type " + schedule.contractType());
        }
    }

    private static ImmutableList<RevenueLine> tiered(ImmutableList<DayTier> tiers,
            int lengthOfStay, String rateRecordId) {
        ImmutableList.Builder<RevenueLine> lines = ImmutableList.builder();
        int coveredDays = 0;
        for (DayTier tier : tiers) {
            int days = tier.daysWithin(lengthOfStay);
            if (days == 0) {
                continue;
            }
            if (tier.firstDay() != coveredDays + 1) {
                throw incomplete(rateRecordId, "day " + (coveredDays + 1) + " has no tier");
            }
            lines.add(new RevenueLine(RevenueCategory.PER_DIEM,
                    tier.label() + " (" + days + " days @ " + tier.rate() + ")",
                    tier.rate().times(days)));
            coveredDays += days;
        }
        if (coveredDays < lengthOfStay) {
            throw incomplete(rateRecordId, "day " + (coveredDays + 1) + " has no tier");
        }
        return lines.build();
    }

    private static ImmutableList<RevenueLine> medicaid(CaseMixClassification classification,
            MedicaidSchedule schedule, int lengthOfStay) {
        ImmutableList.Builder<RevenueLine> lines = ImmutableList.builder();
        lines.add(new RevenueLine(RevenueCategory.BASE_RATE,
                "Base per diem (" + lengthOfStay + " days @ " + schedule.basePerDiem() + ")",
                schedule.basePerDiem().times(lengthOfStay)));
        for (Map.Entry<SpecialCare, CurrencyAmount> addOn : schedule.addOns().entrySet()) {
            if (classification.has(addOn.getKey())) {
                lines.add(new RevenueLine(RevenueCategory.ACUITY_ADD_ON,
                        addOn.getKey() + " add-on (" + lengthOfStay + " days @ "
                                + addOn.getValue() + ")",
                        addOn.getValue().times(lengthOfStay)));
            }
        }
        return lines.build();
    }

    private static ImmutableList<RevenueLine> managedCare(CaseMixClassification classification,
            ManagedCareSchedule schedule, int lengthOfStay, String rateRecordId) {
        CurrencyAmount rate =
                schedule.rates().get(classification.nursingGroup(), classification.ntaGroup());
        if (rate == null) {
            throw incomplete(rateRecordId, "no matrix rate for " + classification.nursingGroup()
                    + "/" + classification.ntaGroup());
        }
        return ImmutableList.of(new RevenueLine(RevenueCategory.RATE_MATRIX,
                classification.nursingGroup() + "/" + classification.ntaGroup() + " ("
                        + lengthOfStay + " days @ " + rate + ")",
                rate.times(lengthOfStay)));
    }

    private static RevenueLine component(RevenueCategory category, String label,
            CurrencyAmount perDiem, BigDecimal days, BigDecimal scale) {
        return new RevenueLine(category, label, perDiem.multiply(days.multiply(scale)));
    }

    private static <K> CurrencyAmount lookup(Map<K, CurrencyAmount> table, K group,
            String component, String rateRecordId) {
        CurrencyAmount rate = table.get(group);
        if (rate == null) {
            throw incomplete(rateRecordId, "no " + component + " rate for group " + group);
        }
        return rate;
    }

    private static ConfigurationException incomplete(String rateRecordId, String detail) {
        return new ConfigurationException(ConfigurationError.INCOMPLETE_RATE_TABLE,
                "Rate record " + rateRecordId + " is incomplete: " + detail);
    }
}
