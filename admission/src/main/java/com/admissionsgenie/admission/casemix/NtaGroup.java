package com.admissionsgenie.admission.casemix;

/** Non-therapy ancillary bands, NA being the highest comorbidity score. */
public enum NtaGroup {
    NA, NB, NC, ND, NE, NF
}
