package com.admissionsgenie.admission.casemix;

import com.google.common.collect.ImmutableList;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps clinical features to PDPM case-mix groups.
 *
 * Classification never fails. Unmapped diagnoses and missing assessments fall back to the lowest
 * acuity reading and are reported through {@link CaseMixClassification#warnings()}.
 */
public class CaseMixClassifier {
    private static final int COGNITIVE_IMPAIRMENT_THRESHOLD = 12;
    private static final int BEHAVIORAL_COGNITIVE_THRESHOLD = 9;
    private static final int MAX_COGNITIVE_SCORE = 15;
    private static final int MOST_DEPENDENT_BAND_MAX = 5;
    private static final int DEPENDENT_BAND_MAX = 14;
    private static final int BEHAVIORAL_MIN_FUNCTION_SCORE = 11;

    private final ClassificationTables tables;
    private final NtaBands ntaBands;

    public CaseMixClassifier(ClassificationTables tables, NtaBands ntaBands) {
        this.tables = tables;
        this.ntaBands = ntaBands;
    }

    public CaseMixClassification classify(ClinicalFeatures features) {
        ImmutableList.Builder<String> warnings = ImmutableList.builder();

        ClinicalCategory category = classifyCategory(features.primaryDiagnosis(), warnings);
        int functionScore = resolveFunctionScore(features.functionScore(), warnings);
        int cognitiveScore = resolveCognitiveScore(features.cognitiveScore(), warnings);
        if (features.therapyMinutesPerDay() < 0) {
            warnings.add("Negative therapy minutes (" + features.therapyMinutesPerDay()
                    + ") ignored");
        }
        Set<ClinicalCondition> conditions = conditions(features);

        TherapyGroup therapyGroup = TherapyGroup.of(category.therapyCategory(), functionScore);
        SlpGroup slpGroup = classifySlp(features, category, cognitiveScore);
        NursingGroup nursingGroup =
                classifyNursing(features, category, conditions, functionScore, cognitiveScore);
        int ntaScore = ntaScore(features, conditions);

        return new CaseMixClassification(therapyGroup, therapyGroup, slpGroup, nursingGroup,
                ntaScore, ntaBands.groupFor(ntaScore), category,
                complexityScore(features, nursingGroup), features.specialCare(),
                warnings.build());
    }

    private ClinicalCategory classifyCategory(String primaryDiagnosis,
            ImmutableList.Builder<String> warnings) {
        if (ClassificationTables.normalize(primaryDiagnosis).isEmpty()) {
            warnings.add("No primary diagnosis provided, clinical category is UNCLASSIFIED");
            return ClinicalCategory.UNCLASSIFIED;
        }
        Optional<ClinicalCategory> category = tables.categoryFor(primaryDiagnosis);
        if (category.isEmpty()) {
            warnings.add("Primary diagnosis " + primaryDiagnosis
                    + " does not map to a clinical category, clinical category is UNCLASSIFIED");
            return ClinicalCategory.UNCLASSIFIED;
        }
        return category.get();
    }

    private static int resolveFunctionScore(Optional<Integer> functionScore,
            ImmutableList.Builder<String> warnings) {
        if (functionScore.isEmpty()) {
            warnings.add("Function score missing, assuming fully independent ("
                    + TherapyGroup.MAX_FUNCTION_SCORE + ")");
            return TherapyGroup.MAX_FUNCTION_SCORE;
        }
        int score = functionScore.get();
        if (score < TherapyGroup.MIN_FUNCTION_SCORE || score > TherapyGroup.MAX_FUNCTION_SCORE) {
            int clamped = Math.max(TherapyGroup.MIN_FUNCTION_SCORE,
                    Math.min(TherapyGroup.MAX_FUNCTION_SCORE, score));
            warnings.add("Function score " + score + " out of range, using " + clamped);
            return clamped;
        }
        return score;
    }

    private static int resolveCognitiveScore(Optional<Integer> cognitiveScore,
            ImmutableList.Builder<String> warnings) {
        if (cognitiveScore.isEmpty()) {
            warnings.add("Cognitive score missing, assuming cognitively intact ("
                    + MAX_COGNITIVE_SCORE + ")");
            return MAX_COGNITIVE_SCORE;
        }
        int score = cognitiveScore.get();
        if (score < 0 || score > MAX_COGNITIVE_SCORE) {
            int clamped = Math.max(0, Math.min(MAX_COGNITIVE_SCORE, score));
            warnings.add("Cognitive score " + score + " out of range, using " + clamped);
            return clamped;
        }
        return score;
    }

    private Set<ClinicalCondition> conditions(ClinicalFeatures features) {
        Set<ClinicalCondition> conditions = EnumSet.noneOf(ClinicalCondition.class);
        for (String diagnosis : features.allDiagnoses()) {
            tables.conditionFor(diagnosis).ifPresent(conditions::add);
        }
        return conditions;
    }

    private SlpGroup classifySlp(ClinicalFeatures features, ClinicalCategory category,
            int cognitiveScore) {
        boolean slpComorbidity =
                features.allDiagnoses().stream().anyMatch(tables::isSlpComorbidity);
        int indicators = (category.isAcuteNeurologic() ? 1 : 0) + (slpComorbidity ? 1 : 0)
                + (cognitiveScore <= COGNITIVE_IMPAIRMENT_THRESHOLD ? 1 : 0);
        int swallowingIndicators = (features.swallowingDisorder() ? 1 : 0)
                + (features.mechanicallyAlteredDiet() ? 1 : 0);
        if (indicators == 0 && swallowingIndicators == 0 && !features.needsSlpTherapy()) {
            return SlpGroup.NONE;
        }
        return SlpGroup.of(indicators, swallowingIndicators);
    }

    private NursingGroup classifyNursing(ClinicalFeatures features, ClinicalCategory category,
            Set<ClinicalCondition> conditions, int functionScore, int cognitiveScore) {
        NursingTier tier = category.nursingTier();
        for (ClinicalCondition condition : conditions) {
            NursingTier conditionTier = tables.nursingTierByCondition().get(condition);
            if (conditionTier != null) {
                tier = tier.higherOf(conditionTier);
            }
        }
        if (conditions.contains(ClinicalCondition.DIABETES) && takesInsulin(features)) {
            tier = tier.higherOf(NursingTier.SPECIAL_CARE_HIGH);
        }
        if (conditions.contains(ClinicalCondition.COPD) && features.has(SpecialCare.OXYGEN)) {
            tier = tier.higherOf(NursingTier.SPECIAL_CARE_HIGH);
        }
        for (SpecialCare flag : features.specialCare()) {
            NursingTier flagTier = tables.nursingTierBySpecialCare().get(flag);
            if (flagTier != null) {
                tier = tier.higherOf(flagTier);
            }
        }

        // Service-based tiers only hold for residents who are dependent enough to need them.
        if (tier == NursingTier.EXTENSIVE_SERVICES && functionScore > DEPENDENT_BAND_MAX) {
            tier = NursingTier.SPECIAL_CARE_HIGH;
        }
        if ((tier == NursingTier.SPECIAL_CARE_HIGH || tier == NursingTier.SPECIAL_CARE_LOW)
                && functionScore > DEPENDENT_BAND_MAX) {
            tier = NursingTier.CLINICALLY_COMPLEX;
        }
        if (tier == NursingTier.REDUCED_PHYSICAL_FUNCTION
                && functionScore >= BEHAVIORAL_MIN_FUNCTION_SCORE
                && (cognitiveScore <= BEHAVIORAL_COGNITIVE_THRESHOLD
                        || features.has(SpecialCare.DEMENTIA_CARE))) {
            tier = NursingTier.BEHAVIORAL_SYMPTOMS_AND_COGNITIVE_PERFORMANCE;
        }

        boolean depressed =
                features.depression() || conditions.contains(ClinicalCondition.DEPRESSION);
        boolean mostDependent = functionScore <= MOST_DEPENDENT_BAND_MAX;
        switch (tier) {
            case EXTENSIVE_SERVICES:
                if (features.has(SpecialCare.VENTILATOR)) {
                    return NursingGroup.ES3;
                }
                return features.has(SpecialCare.TRACHEOSTOMY) ? NursingGroup.ES2
                        : NursingGroup.ES1;
            case SPECIAL_CARE_HIGH:
                if (depressed) {
                    return mostDependent ? NursingGroup.HDE2 : NursingGroup.HDE1;
                }
                return mostDependent ? NursingGroup.HBC2 : NursingGroup.HBC1;
            case SPECIAL_CARE_LOW:
                if (depressed) {
                    return mostDependent ? NursingGroup.LDE2 : NursingGroup.LDE1;
                }
                return mostDependent ? NursingGroup.LBC2 : NursingGroup.LBC1;
            case CLINICALLY_COMPLEX:
                if (functionScore > DEPENDENT_BAND_MAX) {
                    return depressed ? NursingGroup.CA2 : NursingGroup.CA1;
                }
                if (depressed) {
                    return mostDependent ? NursingGroup.CDE2 : NursingGroup.CDE1;
                }
                return mostDependent ? NursingGroup.CBC2 : NursingGroup.CBC1;
            case BEHAVIORAL_SYMPTOMS_AND_COGNITIVE_PERFORMANCE:
                return depressed ? NursingGroup.BAB2 : NursingGroup.BAB1;
            case REDUCED_PHYSICAL_FUNCTION:
            default:
                if (functionScore > DEPENDENT_BAND_MAX) {
                    return depressed ? NursingGroup.PA2 : NursingGroup.PA1;
                }
                if (depressed) {
                    return mostDependent ? NursingGroup.PDE2 : NursingGroup.PDE1;
                }
                return mostDependent ? NursingGroup.PBC2 : NursingGroup.PBC1;
        }
    }

    private static boolean takesInsulin(ClinicalFeatures features) {
        return features.medications().stream()
                .anyMatch(medication -> medication.toLowerCase(Locale.ROOT).contains("insulin"));
    }

    private int ntaScore(ClinicalFeatures features, Set<ClinicalCondition> conditions) {
        int score = 0;
        for (ClinicalCondition condition : conditions) {
            score += tables.ntaPointsByCondition().getOrDefault(condition, 0);
        }
        for (SpecialCare flag : features.specialCare()) {
            score += tables.ntaPointsBySpecialCare().getOrDefault(flag, 0);
        }
        return score;
    }

    private int complexityScore(ClinicalFeatures features, NursingGroup nursingGroup) {
        int score = nursingGroup.isExtensiveServices()
                ? tables.extensiveServicesComplexityPoints() : 0;
        for (SpecialCare flag : features.specialCare()) {
            score += tables.complexityPointsBySpecialCare().getOrDefault(flag, 0);
        }
        return Math.min(tables.maxComplexityScore(), score);
    }
}
