package com.admissionsgenie.admission.scoring;

/** One signed contribution to the final score, with the reason for it. */
public record ScoreFactor(String name, double contribution, String rationale) {
}
