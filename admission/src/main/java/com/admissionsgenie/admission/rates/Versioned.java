package com.admissionsgenie.admission.rates;

/** A configuration record that is only in force during its effective interval. */
public interface Versioned {
    String id();

    EffectiveInterval interval();
}
