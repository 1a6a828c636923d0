package com.admissionsgenie.admission.casemix;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned lookup data for {@link CaseMixClassifier}. Diagnosis prefixes are matched against
 * normalised ICD-10 codes (upper case, dots removed) and the longest matching prefix wins.
 */
public record ClassificationTables(String version,
        ImmutableMap<String, ClinicalCategory> categoryByDiagnosisPrefix,
        ImmutableMap<String, ClinicalCondition> conditionByDiagnosisPrefix,
        ImmutableSet<String> slpComorbidityPrefixes,
        ImmutableMap<ClinicalCondition, Integer> ntaPointsByCondition,
        ImmutableMap<SpecialCare, Integer> ntaPointsBySpecialCare,
        ImmutableMap<ClinicalCondition, NursingTier> nursingTierByCondition,
        ImmutableMap<SpecialCare, NursingTier> nursingTierBySpecialCare,
        ImmutableMap<SpecialCare, Integer> complexityPointsBySpecialCare,
        int extensiveServicesComplexityPoints, int maxComplexityScore) {

    public static final ClassificationTables STANDARD = standard();

    public Optional<ClinicalCategory> categoryFor(String diagnosisCode) {
        return longestPrefixMatch(categoryByDiagnosisPrefix, diagnosisCode);
    }

    public Optional<ClinicalCondition> conditionFor(String diagnosisCode) {
        return longestPrefixMatch(conditionByDiagnosisPrefix, diagnosisCode);
    }

    public boolean isSlpComorbidity(String diagnosisCode) {
        String code = normalize(diagnosisCode);
        return !code.isEmpty() && slpComorbidityPrefixes.stream()
                .anyMatch(prefix -> code.startsWith(normalize(prefix)));
    }

    static String normalize(String diagnosisCode) {
        return diagnosisCode == null ? ""
                : diagnosisCode.trim().replace(".", "").toUpperCase(Locale.ROOT);
    }

    private static <T> Optional<T> longestPrefixMatch(Map<String, T> table, String diagnosisCode) {
        String code = normalize(diagnosisCode);
        if (code.isEmpty()) {
            return Optional.empty();
        }
        String best = null;
        for (String prefix : table.keySet()) {
            String normalizedPrefix = normalize(prefix);
            if (code.startsWith(normalizedPrefix)
                    && (best == null || normalizedPrefix.length() > normalize(best).length())) {
                best = prefix;
            }
        }
        return best == null ? Optional.empty() : Optional.of(table.get(best));
    }

    private static ClassificationTables standard() {
        ImmutableMap<String, ClinicalCategory> categories =
                ImmutableMap.<String, ClinicalCategory>builder()
                        .put("Z96.6", ClinicalCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY)
                        .put("Z47.1", ClinicalCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY)
                        .put("Z98.1", ClinicalCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY)
                        .put("T84", ClinicalCategory.MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY)
                        .put("Z47", ClinicalCategory.ORTHOPEDIC_SURGERY)
                        .put("M16", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("M17", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("M19", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("M25", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("M54", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("S32", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("S72", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("S82", ClinicalCategory.NON_SURGICAL_ORTHOPEDIC_MUSCULOSKELETAL)
                        .put("Z48", ClinicalCategory.NON_ORTHOPEDIC_SURGERY)
                        .put("I60", ClinicalCategory.ACUTE_NEUROLOGIC)
                        .put("I61", ClinicalCategory.ACUTE_NEUROLOGIC)
                        .put("I62", ClinicalCategory.ACUTE_NEUROLOGIC)
                        .put("I63", ClinicalCategory.ACUTE_NEUROLOGIC)
                        .put("G81", ClinicalCategory.ACUTE_NEUROLOGIC)
                        .put("G83", ClinicalCategory.ACUTE_NEUROLOGIC)
                        .put("S06", ClinicalCategory.ACUTE_NEUROLOGIC)
                        .put("A40", ClinicalCategory.ACUTE_INFECTIONS)
                        .put("A41", ClinicalCategory.ACUTE_INFECTIONS)
                        .put("J15", ClinicalCategory.ACUTE_INFECTIONS)
                        .put("J18", ClinicalCategory.ACUTE_INFECTIONS)
                        .put("L03", ClinicalCategory.ACUTE_INFECTIONS)
                        .put("N39.0", ClinicalCategory.ACUTE_INFECTIONS)
                        .put("C", ClinicalCategory.CANCER)
                        .put("J44", ClinicalCategory.PULMONARY)
                        .put("J45", ClinicalCategory.PULMONARY)
                        .put("J81", ClinicalCategory.PULMONARY)
                        .put("J96", ClinicalCategory.PULMONARY)
                        .put("I10", ClinicalCategory.CARDIOVASCULAR_AND_COAGULATIONS)
                        .put("I21", ClinicalCategory.CARDIOVASCULAR_AND_COAGULATIONS)
                        .put("I25", ClinicalCategory.CARDIOVASCULAR_AND_COAGULATIONS)
                        .put("I26", ClinicalCategory.CARDIOVASCULAR_AND_COAGULATIONS)
                        .put("I48", ClinicalCategory.CARDIOVASCULAR_AND_COAGULATIONS)
                        .put("I50", ClinicalCategory.CARDIOVASCULAR_AND_COAGULATIONS)
                        .put("D68", ClinicalCategory.CARDIOVASCULAR_AND_COAGULATIONS)
                        .put("E11", ClinicalCategory.MEDICAL_MANAGEMENT)
                        .put("N18", ClinicalCategory.MEDICAL_MANAGEMENT)
                        .put("G20", ClinicalCategory.MEDICAL_MANAGEMENT)
                        .put("G30", ClinicalCategory.MEDICAL_MANAGEMENT)
                        .put("G35", ClinicalCategory.MEDICAL_MANAGEMENT)
                        .put("F03", ClinicalCategory.MEDICAL_MANAGEMENT)
                        .put("R26", ClinicalCategory.MEDICAL_MANAGEMENT)
                        .build();

        ImmutableMap<String, ClinicalCondition> conditions =
                ImmutableMap.<String, ClinicalCondition>builder()
                        .put("J15", ClinicalCondition.PNEUMONIA)
                        .put("J18", ClinicalCondition.PNEUMONIA)
                        .put("A40", ClinicalCondition.SEPTICEMIA)
                        .put("A41", ClinicalCondition.SEPTICEMIA)
                        .put("E10", ClinicalCondition.DIABETES)
                        .put("E11", ClinicalCondition.DIABETES)
                        .put("J44", ClinicalCondition.COPD)
                        .put("N39.0", ClinicalCondition.URINARY_TRACT_INFECTION)
                        .put("I50", ClinicalCondition.HEART_FAILURE)
                        .put("B20", ClinicalCondition.HIV)
                        .put("G35", ClinicalCondition.MULTIPLE_SCLEROSIS)
                        .put("G20", ClinicalCondition.PARKINSONS)
                        .put("G80", ClinicalCondition.CEREBRAL_PALSY)
                        .put("G82.5", ClinicalCondition.QUADRIPLEGIA)
                        .put("G81", ClinicalCondition.HEMIPLEGIA)
                        .put("J96", ClinicalCondition.RESPIRATORY_FAILURE)
                        .put("R47.01", ClinicalCondition.APHASIA)
                        .put("E43", ClinicalCondition.MALNUTRITION)
                        .put("E44", ClinicalCondition.MALNUTRITION)
                        .put("E46", ClinicalCondition.MALNUTRITION)
                        .put("F32", ClinicalCondition.DEPRESSION)
                        .put("F33", ClinicalCondition.DEPRESSION)
                        .put("F31", ClinicalCondition.BIPOLAR)
                        .put("F20", ClinicalCondition.SCHIZOPHRENIA)
                        .build();

        ImmutableMap<ClinicalCondition, Integer> ntaPoints =
                ImmutableMap.<ClinicalCondition, Integer>builder()
                        .put(ClinicalCondition.PNEUMONIA, 5)
                        .put(ClinicalCondition.SEPTICEMIA, 6)
                        .put(ClinicalCondition.DIABETES, 3)
                        .put(ClinicalCondition.COPD, 4)
                        .put(ClinicalCondition.URINARY_TRACT_INFECTION, 4)
                        .put(ClinicalCondition.HEART_FAILURE, 5)
                        .put(ClinicalCondition.HIV, 6)
                        .put(ClinicalCondition.MULTIPLE_SCLEROSIS, 6)
                        .put(ClinicalCondition.PARKINSONS, 5)
                        .put(ClinicalCondition.HEMIPLEGIA, 6)
                        .put(ClinicalCondition.APHASIA, 5)
                        .put(ClinicalCondition.MALNUTRITION, 4)
                        .put(ClinicalCondition.DEPRESSION, 3)
                        .put(ClinicalCondition.BIPOLAR, 4)
                        .put(ClinicalCondition.SCHIZOPHRENIA, 4)
                        .build();

        ImmutableMap<SpecialCare, Integer> ntaSpecialCarePoints =
                ImmutableMap.<SpecialCare, Integer>builder()
                        .put(SpecialCare.DIALYSIS, 8)
                        .put(SpecialCare.PARENTERAL_NUTRITION, 7)
                        .put(SpecialCare.IV_MEDICATION, 5)
                        .put(SpecialCare.TRACHEOSTOMY, 1)
                        .put(SpecialCare.VENTILATOR, 1)
                        .put(SpecialCare.ISOLATION, 1)
                        .build();

        ImmutableMap<ClinicalCondition, NursingTier> conditionTiers =
                ImmutableMap.<ClinicalCondition, NursingTier>builder()
                        .put(ClinicalCondition.SEPTICEMIA, NursingTier.SPECIAL_CARE_HIGH)
                        .put(ClinicalCondition.QUADRIPLEGIA, NursingTier.SPECIAL_CARE_HIGH)
                        .put(ClinicalCondition.MULTIPLE_SCLEROSIS, NursingTier.SPECIAL_CARE_LOW)
                        .put(ClinicalCondition.PARKINSONS, NursingTier.SPECIAL_CARE_LOW)
                        .put(ClinicalCondition.CEREBRAL_PALSY, NursingTier.SPECIAL_CARE_LOW)
                        .put(ClinicalCondition.RESPIRATORY_FAILURE, NursingTier.SPECIAL_CARE_LOW)
                        .put(ClinicalCondition.PNEUMONIA, NursingTier.CLINICALLY_COMPLEX)
                        .put(ClinicalCondition.HEMIPLEGIA, NursingTier.CLINICALLY_COMPLEX)
                        .build();

        ImmutableMap<SpecialCare, NursingTier> specialCareTiers =
                ImmutableMap.<SpecialCare, NursingTier>builder()
                        .put(SpecialCare.VENTILATOR, NursingTier.EXTENSIVE_SERVICES)
                        .put(SpecialCare.TRACHEOSTOMY, NursingTier.EXTENSIVE_SERVICES)
                        .put(SpecialCare.ISOLATION, NursingTier.EXTENSIVE_SERVICES)
                        .put(SpecialCare.PARENTERAL_NUTRITION, NursingTier.SPECIAL_CARE_HIGH)
                        .put(SpecialCare.FEEDING_TUBE, NursingTier.SPECIAL_CARE_LOW)
                        .put(SpecialCare.WOUND_CARE, NursingTier.SPECIAL_CARE_LOW)
                        .put(SpecialCare.WOUND_VAC, NursingTier.SPECIAL_CARE_LOW)
                        .put(SpecialCare.DIALYSIS, NursingTier.SPECIAL_CARE_LOW)
                        .put(SpecialCare.IV_MEDICATION, NursingTier.CLINICALLY_COMPLEX)
                        .put(SpecialCare.IV_ANTIBIOTICS, NursingTier.CLINICALLY_COMPLEX)
                        .build();

        ImmutableMap<SpecialCare, Integer> complexityPoints =
                ImmutableMap.<SpecialCare, Integer>builder()
                        .put(SpecialCare.DIALYSIS, 8)
                        .put(SpecialCare.TRACHEOSTOMY, 6)
                        .put(SpecialCare.VENTILATOR, 6)
                        .put(SpecialCare.WOUND_VAC, 4)
                        .put(SpecialCare.IV_ANTIBIOTICS, 3)
                        .build();

        return new ClassificationTables("standard-2025.1", categories, conditions,
                ImmutableSet.of("R13", "R47", "R48", "F80", "I69"), ntaPoints,
                ntaSpecialCarePoints, conditionTiers, specialCareTiers, complexityPoints, 5, 20);
    }
}
