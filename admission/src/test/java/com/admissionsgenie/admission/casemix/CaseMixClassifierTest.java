package com.admissionsgenie.admission.casemix;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class CaseMixClassifierTest {

    private final CaseMixClassifier classifier =
            new CaseMixClassifier(ClassificationTables.STANDARD, NtaBands.STANDARD);

    @Test
    void classify_independentJointReplacement() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("Z96.651")
                .functionScore(16).cognitiveScore(15).build();

        CaseMixClassification result = classifier.classify(features);

        assertEquals(ClinicalCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY,
                result.clinicalCategory());
        assertEquals(TherapyGroup.TC, result.ptGroup());
        assertEquals(TherapyGroup.TC, result.otGroup());
        assertEquals(SlpGroup.NONE, result.slpGroup(), "No SLP indicators present");
        assertEquals(NursingGroup.PA1, result.nursingGroup());
        assertEquals(0, result.ntaScore());
        assertEquals(NtaGroup.NF, result.ntaGroup());
        assertEquals(0, result.complexityScore());
        assertTrue(result.warnings().isEmpty(), "Complete intake should not warn");
    }

    @Test
    void classify_missingInputs_fallsBackWithWarnings() {
        CaseMixClassification result = classifier.classify(ClinicalFeatures.builder().build());

        assertEquals(ClinicalCategory.UNCLASSIFIED, result.clinicalCategory());
        assertEquals(TherapyGroup.TL, result.ptGroup(),
                "Missing function score is treated as fully independent");
        assertEquals(NursingGroup.PA1, result.nursingGroup());
        assertEquals(3, result.warnings().size(), result.warnings().toString());
    }

    @Test
    void classify_unmappedDiagnosis_isUnclassified() {
        CaseMixClassification result = classifier.classify(ClinicalFeatures.builder()
                .primaryDiagnosis("Q99.9").functionScore(12).cognitiveScore(15).build());

        assertEquals(ClinicalCategory.UNCLASSIFIED, result.clinicalCategory());
        assertTrue(result.warnings().get(0).contains("Q99.9"));
    }

    @Test
    void classify_longestDiagnosisPrefixWins() {
        ClinicalFeatures jointAftercare = ClinicalFeatures.builder().primaryDiagnosis("Z47.1")
                .functionScore(16).cognitiveScore(15).build();
        ClinicalFeatures orthoAftercare = jointAftercare.toBuilder().primaryDiagnosis("z47.89")
                .build();

        assertEquals(TherapyGroup.TC, classifier.classify(jointAftercare).ptGroup());
        assertEquals(ClinicalCategory.ORTHOPEDIC_SURGERY,
                classifier.classify(orthoAftercare).clinicalCategory());
        assertEquals(TherapyGroup.TG, classifier.classify(orthoAftercare).ptGroup());
    }

    @Test
    void classify_outOfRangeFunctionScore_isClamped() {
        CaseMixClassification result = classifier.classify(ClinicalFeatures.builder()
                .primaryDiagnosis("Z96.651").functionScore(30).cognitiveScore(15).build());

        assertEquals(TherapyGroup.TD, result.ptGroup());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("30"));
    }

    @Test
    void classify_ventilatorDependent_isExtensiveServices() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("J96.01")
                .functionScore(4).cognitiveScore(15)
                .specialCare(SpecialCare.VENTILATOR, SpecialCare.TRACHEOSTOMY).build();

        CaseMixClassification result = classifier.classify(features);

        assertEquals(NursingGroup.ES3, result.nursingGroup());
        assertEquals(17, result.complexityScore(), "5 for ES plus 6 trach plus 6 vent");
        assertEquals(2, result.ntaScore());
        assertEquals(NtaGroup.NE, result.ntaGroup());
    }

    @Test
    void classify_extensiveServicesForIndependentResident_isDowngraded() {
        CaseMixClassification result = classifier.classify(ClinicalFeatures.builder()
                .primaryDiagnosis("J44.1").functionScore(20).cognitiveScore(15)
                .specialCare(SpecialCare.TRACHEOSTOMY).build());

        assertFalse(result.nursingGroup().isExtensiveServices());
        assertEquals(NursingGroup.CA1, result.nursingGroup());
    }

    @Test
    void classify_complexityIsCapped() {
        CaseMixClassification result = classifier.classify(ClinicalFeatures.builder()
                .primaryDiagnosis("J96.01").functionScore(2).cognitiveScore(15)
                .specialCare(SpecialCare.VENTILATOR, SpecialCare.TRACHEOSTOMY,
                        SpecialCare.DIALYSIS, SpecialCare.WOUND_VAC)
                .build());

        assertEquals(20, result.complexityScore());
    }

    @Test
    void classify_strokeWithDysphagia_getsHighestSlpGroup() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("I63.9")
                .secondaryDiagnoses("R13.10").functionScore(8).cognitiveScore(10)
                .swallowingDisorder(true).mechanicallyAlteredDiet(true).build();

        CaseMixClassification result = classifier.classify(features);

        assertEquals(SlpGroup.SL, result.slpGroup());
        assertEquals(TherapyGroup.TN, result.ptGroup());
    }

    @Test
    void classify_slpTherapyWithoutIndicators_isLowestSlpGroup() {
        CaseMixClassification result = classifier.classify(ClinicalFeatures.builder()
                .primaryDiagnosis("Z96.651").functionScore(16).cognitiveScore(15)
                .needsSlpTherapy(true).build());

        assertEquals(SlpGroup.SA, result.slpGroup());
    }

    @Test
    void classify_ntaScoreCountsEachConditionOnce() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("J18.9")
                .secondaryDiagnoses("A41.9", "E11.9", "J18.1").functionScore(10)
                .cognitiveScore(15).specialCare(SpecialCare.DIALYSIS).build();

        CaseMixClassification result = classifier.classify(features);

        assertEquals(22, result.ntaScore(), "pneumonia 5 + sepsis 6 + diabetes 3 + dialysis 8");
        assertEquals(NtaGroup.NA, result.ntaGroup());
    }

    @Test
    void classify_cognitiveImpairment_isBehavioral() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("G30.9")
                .functionScore(14).cognitiveScore(7).build();

        assertEquals(NursingGroup.BAB1, classifier.classify(features).nursingGroup());
        assertEquals(NursingGroup.BAB2,
                classifier.classify(features.toBuilder().depression(true).build())
                        .nursingGroup());
    }

    @Test
    void classify_insulinDependentDiabetes_isSpecialCareHigh() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("E11.65")
                .medications(List.of("Insulin glargine")).functionScore(10)
                .cognitiveScore(15).build();

        assertEquals(NursingGroup.HBC1, classifier.classify(features).nursingGroup());
    }

    @Test
    void classify_woundCareForDependentResident_isSpecialCareLow() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("G30.9")
                .functionScore(8).cognitiveScore(5)
                .specialCare(SpecialCare.DEMENTIA_CARE, SpecialCare.WOUND_CARE).build();

        CaseMixClassification result = classifier.classify(features);

        assertEquals(NursingGroup.LBC1, result.nursingGroup());
        assertEquals(NursingGroup.LBC2, classifier
                .classify(features.toBuilder().functionScore(3).build()).nursingGroup());
    }

    @Test
    void classify_isDeterministic() {
        ClinicalFeatures features = ClinicalFeatures.builder().primaryDiagnosis("I50.9")
                .secondaryDiagnoses("E11.9", "F32.9").functionScore(9).cognitiveScore(11)
                .specialCare(SpecialCare.IV_ANTIBIOTICS, SpecialCare.OXYGEN).build();

        assertEquals(classifier.classify(features), classifier.classify(features));
    }
}
