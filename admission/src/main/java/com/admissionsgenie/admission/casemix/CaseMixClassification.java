package com.admissionsgenie.admission.casemix;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Result of classifying one admission. Every group is a member of its enumeration, never null.
 *
 * @param ntaScore sum of comorbidity points, unbounded above
 * @param ntaGroup the band {@code ntaScore} falls into
 * @param complexityScore 0 to 20, higher means more resource-intensive care
 */
public record CaseMixClassification(TherapyGroup ptGroup, TherapyGroup otGroup,
        SlpGroup slpGroup, NursingGroup nursingGroup, int ntaScore, NtaGroup ntaGroup,
        ClinicalCategory clinicalCategory, int complexityScore,
        ImmutableSet<SpecialCare> specialCare, ImmutableList<String> warnings) {

    public boolean has(SpecialCare flag) {
        return specialCare.contains(flag);
    }
}
