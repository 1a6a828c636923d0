package com.admissionsgenie.admission.config;

import com.admissionsgenie.admission.casemix.NtaGroup;
import com.admissionsgenie.admission.casemix.NursingGroup;
import com.admissionsgenie.admission.casemix.NursingTier;
import com.admissionsgenie.admission.casemix.SlpGroup;
import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.casemix.TherapyGroup;
import com.admissionsgenie.admission.cost.AcuityBand;
import com.admissionsgenie.admission.cost.CostCategory;
import com.admissionsgenie.admission.cost.CostModelRecord;
import com.admissionsgenie.admission.cost.CostSurcharge;
import com.admissionsgenie.admission.rates.DayTier;
import com.admissionsgenie.admission.rates.EffectiveInterval;
import com.admissionsgenie.admission.rates.ManagedCareSchedule;
import com.admissionsgenie.admission.rates.MedicaidSchedule;
import com.admissionsgenie.admission.rates.MedicareAdvantageSchedule;
import com.admissionsgenie.admission.rates.MedicareFfsSchedule;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.rates.RateRecord;
import com.admissionsgenie.admission.rates.VariablePerDiemSchedule;
import com.admissionsgenie.admission.scoring.BusinessWeights;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demo configuration: two facilities with rate records for every payer family and a cost model
 * for every acuity band.
 *
 * Medicare FFS component rates are the unadjusted federal base rate times the group's case-mix
 * index, truncated to cents.
 */
public final class ConfigurationSeeder {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationSeeder.class);

    public static final String SUNRISE = "sunrise-snf";
    public static final String LAKESIDE = "lakeside-care";

    static final LocalDate FY2025_START = LocalDate.of(2024, 10, 1);
    static final LocalDate FY2026_START = LocalDate.of(2025, 10, 1);

    // Case-mix indexes, in enum declaration order.
    private static final String[] PT_CMI = {"1.53", "1.69", "1.88", "1.92", "1.42", "1.61",
            "1.67", "1.16", "1.13", "1.42", "1.52", "1.09", "1.27", "1.48", "1.55", "1.08"};
    private static final String[] OT_CMI = {"1.49", "1.63", "1.68", "1.53", "1.41", "1.59",
            "1.64", "1.15", "1.17", "1.44", "1.54", "1.11", "1.30", "1.49", "1.55", "1.09"};
    private static final String[] SLP_CMI = {"0.68", "1.82", "2.66", "1.46", "2.33", "2.97",
            "2.04", "2.85", "3.51", "2.98", "3.69", "3.98"};
    private static final String[] NURSING_CMI = {"4.06", "3.07", "2.93", "2.40", "1.99", "2.24",
            "1.86", "2.08", "1.73", "1.72", "1.43", "1.87", "1.62", "1.55", "1.09", "1.34",
            "0.94", "1.04", "0.99", "1.57", "1.47", "1.22", "0.71", "1.13", "0.66"};
    private static final String[] NTA_CMI = {"3.25", "2.53", "1.85", "1.34", "0.96", "0.72"};

    /** PT and OT: full rate through day 20, then 2% less every 7 days. */
    static final VariablePerDiemSchedule THERAPY_VPD = therapyVpd();

    /** NTA: triple rate for days 1-3. */
    static final VariablePerDiemSchedule NTA_VPD = new VariablePerDiemSchedule(ImmutableList.of(
            new VariablePerDiemSchedule.Step(1, new BigDecimal("3.0")),
            new VariablePerDiemSchedule.Step(4, BigDecimal.ONE)));

    private ConfigurationSeeder() {}

    public static void seed(ConfigurationStore store) {
        store.addFacility(new Facility(SUNRISE, "Sunrise Skilled Nursing",
                new BigDecimal("1.0234"), new BigDecimal("0.98"),
                ImmutableSet.of(SpecialCare.DIALYSIS, SpecialCare.IV_ANTIBIOTICS,
                        SpecialCare.IV_MEDICATION, SpecialCare.WOUND_VAC, SpecialCare.WOUND_CARE,
                        SpecialCare.TRACHEOSTOMY, SpecialCare.BARIATRIC, SpecialCare.OXYGEN,
                        SpecialCare.FEEDING_TUBE, SpecialCare.ISOLATION),
                Optional.empty()));
        store.addFacility(new Facility(LAKESIDE, "Lakeside Care Center",
                new BigDecimal("0.9876"), new BigDecimal("1.01"),
                ImmutableSet.of(SpecialCare.IV_ANTIBIOTICS, SpecialCare.WOUND_CARE,
                        SpecialCare.WOUND_VAC, SpecialCare.OXYGEN, SpecialCare.DEMENTIA_CARE),
                Optional.of(new BusinessWeights(0.3, 0.3, 0.1))));

        MedicareFfsSchedule fy2025 = ffsSchedule("70.30", "65.44", "26.26", "122.63", "92.52",
                "109.64", "0.713");
        MedicareFfsSchedule fy2026 = ffsSchedule("73.22", "68.16", "27.35", "127.74", "96.37",
                "114.21", "0.716");
        for (String facilityId : ImmutableList.of(SUNRISE, LAKESIDE)) {
            store.addRateRecord(new RateRecord(facilityId + "-ffs-fy2025", facilityId,
                    PayerType.MEDICARE_FFS, EffectiveInterval.between(FY2025_START, FY2026_START),
                    fy2025));
            store.addRateRecord(new RateRecord(facilityId + "-ffs-fy2026", facilityId,
                    PayerType.MEDICARE_FFS, EffectiveInterval.startingOn(FY2026_START), fy2026));
        }

        store.addRateRecord(new RateRecord(SUNRISE + "-ma-gold-plus", SUNRISE,
                PayerType.MEDICARE_ADVANTAGE, EffectiveInterval.startingOn(FY2025_START),
                MedicareAdvantageSchedule.tiered(ImmutableList.of(
                        new DayTier(1, 30, CurrencyAmount.from("450.00")),
                        new DayTier(31, 60, CurrencyAmount.from("400.00")),
                        new DayTier(61, 100, CurrencyAmount.from("375.00"))))));
        store.addRateRecord(new RateRecord(LAKESIDE + "-ma-advantage-plus", LAKESIDE,
                PayerType.MEDICARE_ADVANTAGE, EffectiveInterval.startingOn(FY2026_START),
                MedicareAdvantageSchedule.pdpmMapped(fy2026, new BigDecimal("0.95"))));
        store.addRateRecord(new RateRecord(LAKESIDE + "-ma-flat-2025", LAKESIDE,
                PayerType.MEDICARE_ADVANTAGE,
                EffectiveInterval.between(FY2025_START, FY2026_START),
                MedicareAdvantageSchedule.flat(CurrencyAmount.from("425.00"))));

        store.addRateRecord(new RateRecord(SUNRISE + "-medicaid", SUNRISE, PayerType.MEDICAID,
                EffectiveInterval.startingOn(FY2025_START),
                new MedicaidSchedule(CurrencyAmount.from("325.00"), ImmutableMap.of(
                        SpecialCare.VENTILATOR, CurrencyAmount.from("150.00"),
                        SpecialCare.TRACHEOSTOMY, CurrencyAmount.from("95.00"),
                        SpecialCare.IV_ANTIBIOTICS, CurrencyAmount.from("60.00"),
                        SpecialCare.BARIATRIC, CurrencyAmount.from("45.00")))));
        store.addRateRecord(new RateRecord(LAKESIDE + "-medicaid", LAKESIDE, PayerType.MEDICAID,
                EffectiveInterval.startingOn(FY2025_START),
                new MedicaidSchedule(CurrencyAmount.from("234.00"), ImmutableMap.of(
                        SpecialCare.IV_ANTIBIOTICS, CurrencyAmount.from("55.00")))));

        for (String facilityId : ImmutableList.of(SUNRISE, LAKESIDE)) {
            store.addRateRecord(new RateRecord(facilityId + "-family-care", facilityId,
                    PayerType.MANAGED_CARE_ORGANIZATION, EffectiveInterval.startingOn(FY2025_START),
                    familyCareMatrix()));
            for (AcuityBand band : AcuityBand.values()) {
                store.addCostModel(costModel(facilityId, band));
            }
        }
        logger.info("Seeded configuration store with demo facilities {} and {}", SUNRISE,
                LAKESIDE);
    }

    private static MedicareFfsSchedule ffsSchedule(String ptBase, String otBase, String slpBase,
            String nursingBase, String ntaBase, String nonCaseMix, String laborShare) {
        MedicareFfsSchedule.Builder builder = MedicareFfsSchedule.builder()
                .nonCaseMixRate(nonCaseMix).laborShare(laborShare).therapyVpd(THERAPY_VPD)
                .ntaVpd(NTA_VPD);
        for (TherapyGroup group : TherapyGroup.values()) {
            builder.ptRate(group, rate(ptBase, PT_CMI[group.ordinal()]));
            builder.otRate(group, rate(otBase, OT_CMI[group.ordinal()]));
        }
        for (SlpGroup group : SlpGroup.values()) {
            if (group.isBillable()) {
                builder.slpRate(group, rate(slpBase, SLP_CMI[group.ordinal() - 1]));
            }
        }
        for (NursingGroup group : NursingGroup.values()) {
            builder.nursingRate(group, rate(nursingBase, NURSING_CMI[group.ordinal()]));
        }
        for (NtaGroup group : NtaGroup.values()) {
            builder.ntaRate(group, rate(ntaBase, NTA_CMI[group.ordinal()]));
        }
        return builder.build();
    }

    private static String rate(String base, String caseMixIndex) {
        return CurrencyAmount.from(base).multiply(new BigDecimal(caseMixIndex)).value()
                .toPlainString();
    }

    private static VariablePerDiemSchedule therapyVpd() {
        ImmutableList.Builder<VariablePerDiemSchedule.Step> steps = ImmutableList.builder();
        steps.add(new VariablePerDiemSchedule.Step(1, BigDecimal.ONE));
        BigDecimal factor = BigDecimal.ONE;
        for (int day = 21; day <= 98; day += 7) {
            factor = factor.subtract(new BigDecimal("0.02"));
            steps.add(new VariablePerDiemSchedule.Step(day, factor));
        }
        return new VariablePerDiemSchedule(steps.build());
    }

    /** Nursing tier rate plus an NTA band add-on, for every group pair. */
    private static ManagedCareSchedule familyCareMatrix() {
        ImmutableMap<NursingTier, String> nursing = ImmutableMap.of(
                NursingTier.EXTENSIVE_SERVICES, "320.00",
                NursingTier.SPECIAL_CARE_HIGH, "285.00",
                NursingTier.SPECIAL_CARE_LOW, "265.00",
                NursingTier.CLINICALLY_COMPLEX, "255.00",
                NursingTier.BEHAVIORAL_SYMPTOMS_AND_COGNITIVE_PERFORMANCE, "245.00",
                NursingTier.REDUCED_PHYSICAL_FUNCTION, "240.00");
        ImmutableMap<NtaGroup, String> nta = ImmutableMap.of(NtaGroup.NA, "100.00",
                NtaGroup.NB, "85.00", NtaGroup.NC, "85.00", NtaGroup.ND, "70.00",
                NtaGroup.NE, "70.00", NtaGroup.NF, "70.00");
        ImmutableTable.Builder<NursingGroup, NtaGroup, CurrencyAmount> rates =
                ImmutableTable.builder();
        for (NursingGroup nursingGroup : NursingGroup.values()) {
            for (NtaGroup ntaGroup : NtaGroup.values()) {
                rates.put(nursingGroup, ntaGroup,
                        CurrencyAmount.from(nursing.get(nursingGroup.tier()))
                                .add(CurrencyAmount.from(nta.get(ntaGroup))));
            }
        }
        return new ManagedCareSchedule(rates.build());
    }

    private static CostModelRecord costModel(String facilityId, AcuityBand band) {
        CostModelRecord.Builder builder = CostModelRecord.builder()
                .id(facilityId + "-cost-" + band.name().toLowerCase()).facilityId(facilityId)
                .acuityBand(band).interval(EffectiveInterval.startingOn(FY2025_START))
                .hourlyNursingRate(facilityId.equals(SUNRISE) ? "38.00" : "36.50")
                .transportCost("150.00").overheadRate("0.22")
                .surcharge(new CostSurcharge(SpecialCare.WOUND_VAC, CostCategory.SUPPLIES,
                        CurrencyAmount.from("75.00")))
                .surcharge(new CostSurcharge(SpecialCare.WOUND_CARE, CostCategory.SUPPLIES,
                        CurrencyAmount.from("20.00")))
                .surcharge(new CostSurcharge(SpecialCare.IV_ANTIBIOTICS, CostCategory.PHARMACY,
                        CurrencyAmount.from("150.00")))
                .surcharge(new CostSurcharge(SpecialCare.OXYGEN, CostCategory.SUPPLIES,
                        CurrencyAmount.from("25.00")))
                .surcharge(new CostSurcharge(SpecialCare.FEEDING_TUBE, CostCategory.SUPPLIES,
                        CurrencyAmount.from("40.00")))
                .surcharge(new CostSurcharge(SpecialCare.DIALYSIS, CostCategory.TRANSPORT,
                        CurrencyAmount.from("60.00")));
        switch (band) {
            case LOW:
                return builder.nursingHoursPerDay("3.0").supplyPerDay("40.00")
                        .pharmacyPerDay("25.00").build();
            case MEDIUM:
                return builder.nursingHoursPerDay("4.0").supplyPerDay("50.00")
                        .pharmacyPerDay("30.00").build();
            case HIGH:
                return builder.nursingHoursPerDay("5.5").supplyPerDay("60.00")
                        .pharmacyPerDay("45.00").build();
            case COMPLEX:
            default:
                return builder.nursingHoursPerDay("7.0").supplyPerDay("75.00")
                        .pharmacyPerDay("60.00").build();
        }
    }
}
