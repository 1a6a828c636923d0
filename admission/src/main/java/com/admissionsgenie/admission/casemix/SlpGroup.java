package com.admissionsgenie.admission.casemix;

/**
 * PDPM speech-language pathology groups. Rows are the number of SLP indicators present (acute
 * neurologic condition, SLP-related comorbidity, cognitive impairment); columns are swallowing
 * disorder and mechanically altered diet (neither, either, both).
 */
public enum SlpGroup {
    NONE,
    SA, SB, SC,
    SD, SE, SF,
    SG, SH, SI,
    SJ, SK, SL;

    private static final SlpGroup[][] GRID = {
            {SA, SB, SC},
            {SD, SE, SF},
            {SG, SH, SI},
            {SJ, SK, SL}};

    public static SlpGroup of(int indicatorCount, int swallowingIndicatorCount) {
        if (indicatorCount < 0 || indicatorCount > 3) {
            throw new IllegalArgumentException("Indicator count out of range: " + indicatorCount);
        }
        if (swallowingIndicatorCount < 0 || swallowingIndicatorCount > 2) {
            throw new IllegalArgumentException(
                    "Swallowing indicator count out of range: " + swallowingIndicatorCount);
        }
        return GRID[indicatorCount][swallowingIndicatorCount];
    }

    public boolean isBillable() {
        return this != NONE;
    }
}
