package com.admissionsgenie.admission.config;

import static org.junit.jupiter.api.Assertions.*;

import com.admissionsgenie.admission.casemix.ClinicalFeatures;
import com.admissionsgenie.admission.casemix.NursingGroup;
import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.cost.AuthorizationStatus;
import com.admissionsgenie.admission.evaluation.AdmissionEvaluator;
import com.admissionsgenie.admission.evaluation.EvaluationRequest;
import com.admissionsgenie.admission.evaluation.EvaluationResult;
import com.admissionsgenie.admission.evaluation.PipelinePolicy;
import com.admissionsgenie.admission.rates.MedicareFfsSchedule;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.rates.RateRecord;
import com.admissionsgenie.admission.rates.RateResolver;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ConfigurationSeederTest {

    private final AdmissionEvaluator evaluator = new AdmissionEvaluator(PipelinePolicy.STANDARD);

    @Test
    void seed_supportsEveryPayerAtBothFacilities() {
        ConfigurationStore store = new ConfigurationStore();
        ConfigurationSeeder.seed(store);
        ConfigurationSnapshot snapshot = store.snapshot();

        ClinicalFeatures[] cases = {
                ClinicalFeatures.builder().primaryDiagnosis("Z96.651").functionScore(16)
                        .cognitiveScore(15).build(),
                ClinicalFeatures.builder().primaryDiagnosis("J96.01").functionScore(3)
                        .cognitiveScore(12).specialCare(SpecialCare.VENTILATOR,
                                SpecialCare.TRACHEOSTOMY, SpecialCare.IV_ANTIBIOTICS)
                        .needsTransport(true).build()};
        for (String facilityId : new String[] {ConfigurationSeeder.SUNRISE,
                ConfigurationSeeder.LAKESIDE}) {
            for (PayerType payerType : PayerType.values()) {
                for (ClinicalFeatures features : cases) {
                    for (LocalDate asOf : new LocalDate[] {LocalDate.of(2025, 3, 1),
                            LocalDate.of(2026, 3, 1)}) {
                        EvaluationResult result = evaluator.evaluate(EvaluationRequest.builder()
                                .facilityId(facilityId).payerType(payerType)
                                .projectedLengthOfStay(30)
                                .authorizationStatus(AuthorizationStatus.PENDING)
                                .censusPriority(0.5).asOfDate(asOf).features(features).build(),
                                snapshot);
                        assertTrue(result.projection().revenue().total()
                                .isGreaterThan(CurrencyAmount.ZERO),
                                facilityId + " " + payerType + " " + asOf);
                    }
                }
            }
        }
    }

    @Test
    void seed_ffsRatesAreBaseTimesCaseMixIndex() {
        ConfigurationStore store = new ConfigurationStore();
        ConfigurationSeeder.seed(store);

        RateRecord fy2026 = new RateResolver(store.snapshot().rateRecords())
                .resolve(ConfigurationSeeder.SUNRISE, PayerType.MEDICARE_FFS,
                        LocalDate.of(2025, 10, 1));
        MedicareFfsSchedule schedule = (MedicareFfsSchedule) fy2026.schedule();

        assertEquals("sunrise-snf-ffs-fy2026", fy2026.id());
        assertEquals(CurrencyAmount.from("518.62"), schedule.nursingRates().get(NursingGroup.ES3),
                "127.74 x 4.06");
        assertEquals(0, ConfigurationSeeder.THERAPY_VPD.factorForDay(20)
                .compareTo(BigDecimal.ONE));
        assertEquals(0, ConfigurationSeeder.THERAPY_VPD.factorForDay(21)
                .compareTo(new BigDecimal("0.98")));
    }
}
