package com.admissionsgenie.admission.scoring;

public enum Recommendation {
    ACCEPT("Accept"),
    DEFER("Defer"),
    DECLINE("Decline");

    private final String displayName;

    Recommendation(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
