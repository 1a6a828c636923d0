package com.admissionsgenie.admission;

import com.admissionsgenie.admission.casemix.CaseMixClassification;
import com.admissionsgenie.admission.casemix.ClinicalCategory;
import com.admissionsgenie.admission.casemix.NtaGroup;
import com.admissionsgenie.admission.casemix.NursingGroup;
import com.admissionsgenie.admission.casemix.SlpGroup;
import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.casemix.TherapyGroup;
import com.admissionsgenie.admission.config.ConfigurationStore;
import com.admissionsgenie.admission.config.Facility;
import com.admissionsgenie.admission.cost.AcuityBand;
import com.admissionsgenie.admission.cost.CostCategory;
import com.admissionsgenie.admission.cost.CostModelRecord;
import com.admissionsgenie.admission.cost.CostSurcharge;
import com.admissionsgenie.admission.rates.EffectiveInterval;
import com.admissionsgenie.admission.rates.MedicaidSchedule;
import com.admissionsgenie.admission.rates.MedicareAdvantageSchedule;
import com.admissionsgenie.admission.rates.MedicareFfsSchedule;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.rates.RateRecord;
import com.admissionsgenie.admission.rates.VariablePerDiemSchedule;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/** Records shared by the admission tests. */
public final class TestData {
    public static final LocalDate AS_OF = LocalDate.of(2025, 11, 1);
    public static final LocalDate EFFECTIVE_FROM = LocalDate.of(2025, 1, 1);
    public static final String FACILITY_ID = "test-snf";

    private TestData() {}

    /** Wage index 1.02, VBP 1.00, every capability except dementia care. */
    public static Facility facility() {
        return new Facility(FACILITY_ID, "Test Skilled Nursing", new BigDecimal("1.02"),
                new BigDecimal("1.00"),
                ImmutableSet.of(SpecialCare.IV_ANTIBIOTICS, SpecialCare.IV_MEDICATION,
                        SpecialCare.WOUND_CARE, SpecialCare.WOUND_VAC, SpecialCare.DIALYSIS,
                        SpecialCare.TRACHEOSTOMY, SpecialCare.VENTILATOR, SpecialCare.OXYGEN),
                Optional.empty());
    }

    /** The same rate for every group of each component. */
    public static MedicareFfsSchedule uniformFfsSchedule(String pt, String ot, String slp,
            String nursing, String nta, String nonCaseMix, String laborShare,
            VariablePerDiemSchedule therapyVpd, VariablePerDiemSchedule ntaVpd) {
        MedicareFfsSchedule.Builder builder = MedicareFfsSchedule.builder()
                .nonCaseMixRate(nonCaseMix).laborShare(laborShare).therapyVpd(therapyVpd)
                .ntaVpd(ntaVpd);
        for (TherapyGroup group : TherapyGroup.values()) {
            builder.ptRate(group, pt).otRate(group, ot);
        }
        for (SlpGroup group : SlpGroup.values()) {
            if (group.isBillable()) {
                builder.slpRate(group, slp);
            }
        }
        for (NursingGroup group : NursingGroup.values()) {
            builder.nursingRate(group, nursing);
        }
        for (NtaGroup group : NtaGroup.values()) {
            builder.ntaRate(group, nta);
        }
        return builder.build();
    }

    /** Generous PDPM rates: a 25-day stay earns low six figures. */
    public static MedicareFfsSchedule highFfsSchedule() {
        return uniformFfsSchedule("1200.00", "1150.00", "300.00", "1600.00", "900.00",
                "500.00", "0.7", VariablePerDiemSchedule.NONE, VariablePerDiemSchedule.NONE);
    }

    public static RateRecord ffsRecord(MedicareFfsSchedule schedule) {
        return new RateRecord("ffs-2025", FACILITY_ID, PayerType.MEDICARE_FFS,
                EffectiveInterval.startingOn(EFFECTIVE_FROM), schedule);
    }

    public static RateRecord medicaidRecord(String basePerDiem) {
        return new RateRecord("medicaid-2025", FACILITY_ID, PayerType.MEDICAID,
                EffectiveInterval.startingOn(EFFECTIVE_FROM),
                new MedicaidSchedule(CurrencyAmount.from(basePerDiem), ImmutableMap.of()));
    }

    public static RateRecord flatAdvantageRecord(String perDiem) {
        return new RateRecord("ma-flat-2025", FACILITY_ID, PayerType.MEDICARE_ADVANTAGE,
                EffectiveInterval.startingOn(EFFECTIVE_FROM),
                MedicareAdvantageSchedule.flat(CurrencyAmount.from(perDiem)));
    }

    /**
     * $38/h nursing, $150 transport, 22% overhead and a $20/day wound-care supply surcharge.
     * Hours, supplies and pharmacy per day rise with the band: LOW 3.0/40/25, MEDIUM 4.0/50/30,
     * HIGH 5.5/60/45, COMPLEX 7.0/75/60.
     */
    public static CostModelRecord costModel(AcuityBand band) {
        CostModelRecord.Builder builder = CostModelRecord.builder()
                .id("cost-" + band.name().toLowerCase()).facilityId(FACILITY_ID)
                .acuityBand(band).interval(EffectiveInterval.startingOn(EFFECTIVE_FROM))
                .hourlyNursingRate("38.00").transportCost("150.00").overheadRate("0.22")
                .surcharge(new CostSurcharge(SpecialCare.WOUND_CARE, CostCategory.SUPPLIES,
                        CurrencyAmount.from("20.00")));
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

    /**
     * The test facility with the high FFS schedule, a $234 Medicaid per diem, a $425 flat
     * Medicare Advantage contract and a cost model for every band. No managed care contract.
     */
    public static ConfigurationStore store() {
        ConfigurationStore store = new ConfigurationStore();
        store.addFacility(facility());
        store.addRateRecord(ffsRecord(highFfsSchedule()));
        store.addRateRecord(medicaidRecord("234.00"));
        store.addRateRecord(flatAdvantageRecord("425.00"));
        for (AcuityBand band : AcuityBand.values()) {
            store.addCostModel(costModel(band));
        }
        return store;
    }

    public static CaseMixClassification classification(NursingGroup nursingGroup,
            SlpGroup slpGroup, int complexityScore, SpecialCare... specialCare) {
        return new CaseMixClassification(TherapyGroup.TC, TherapyGroup.TC, slpGroup,
                nursingGroup, 0, NtaGroup.NF,
                ClinicalCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY, complexityScore,
                ImmutableSet.copyOf(specialCare), ImmutableList.of());
    }
}
