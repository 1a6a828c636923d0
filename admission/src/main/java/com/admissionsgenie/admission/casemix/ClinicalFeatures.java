package com.admissionsgenie.admission.casemix;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Optional;

/**
 * Structured clinical intake for one prospective admission.
 *
 * @param functionScore section GG style independence index, 0 (dependent) to 24 (independent)
 * @param cognitiveScore BIMS score, 0 (severely impaired) to 15 (intact)
 */
public record ClinicalFeatures(String primaryDiagnosis, ImmutableList<String> secondaryDiagnoses,
        ImmutableList<String> medications, Optional<Integer> functionScore,
        Optional<Integer> cognitiveScore, int therapyMinutesPerDay,
        ImmutableSet<SpecialCare> specialCare, boolean depression, boolean swallowingDisorder,
        boolean mechanicallyAlteredDiet, boolean needsSlpTherapy, boolean needsTransport) {

    public ImmutableList<String> allDiagnoses() {
        return ImmutableList.<String>builder().add(primaryDiagnosis).addAll(secondaryDiagnoses)
                .build();
    }

    public boolean has(SpecialCare flag) {
        return specialCare.contains(flag);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().primaryDiagnosis(primaryDiagnosis)
                .secondaryDiagnoses(secondaryDiagnoses).medications(medications)
                .functionScore(functionScore).cognitiveScore(cognitiveScore)
                .therapyMinutesPerDay(therapyMinutesPerDay).specialCare(specialCare)
                .depression(depression).swallowingDisorder(swallowingDisorder)
                .mechanicallyAlteredDiet(mechanicallyAlteredDiet).needsSlpTherapy(needsSlpTherapy)
                .needsTransport(needsTransport);
    }

    public static class Builder {
        private String primaryDiagnosis = "";
        private ImmutableList<String> secondaryDiagnoses = ImmutableList.of();
        private ImmutableList<String> medications = ImmutableList.of();
        private Optional<Integer> functionScore = Optional.empty();
        private Optional<Integer> cognitiveScore = Optional.empty();
        private int therapyMinutesPerDay;
        private ImmutableSet<SpecialCare> specialCare = ImmutableSet.of();
        private boolean depression;
        private boolean swallowingDisorder;
        private boolean mechanicallyAlteredDiet;
        private boolean needsSlpTherapy;
        private boolean needsTransport;

        public Builder primaryDiagnosis(String primaryDiagnosis) {
            this.primaryDiagnosis = primaryDiagnosis;
            return this;
        }

        public Builder secondaryDiagnoses(Collection<String> secondaryDiagnoses) {
            this.secondaryDiagnoses = ImmutableList.copyOf(secondaryDiagnoses);
            return this;
        }

        public Builder secondaryDiagnoses(String... secondaryDiagnoses) {
            this.secondaryDiagnoses = ImmutableList.copyOf(secondaryDiagnoses);
            return this;
        }

        public Builder medications(Collection<String> medications) {
            this.medications = ImmutableList.copyOf(medications);
            return this;
        }

        public Builder functionScore(int functionScore) {
            this.functionScore = Optional.of(functionScore);
            return this;
        }

        public Builder functionScore(Optional<Integer> functionScore) {
            this.functionScore = functionScore;
            return this;
        }

        public Builder cognitiveScore(int cognitiveScore) {
            this.cognitiveScore = Optional.of(cognitiveScore);
            return this;
        }

        public Builder cognitiveScore(Optional<Integer> cognitiveScore) {
            this.cognitiveScore = cognitiveScore;
            return this;
        }

        public Builder therapyMinutesPerDay(int therapyMinutesPerDay) {
            this.therapyMinutesPerDay = therapyMinutesPerDay;
            return this;
        }

        public Builder specialCare(Collection<SpecialCare> specialCare) {
            this.specialCare = ImmutableSet.copyOf(specialCare);
            return this;
        }

        public Builder specialCare(SpecialCare... specialCare) {
            this.specialCare = ImmutableSet.copyOf(specialCare);
            return this;
        }

        public Builder depression(boolean depression) {
            this.depression = depression;
            return this;
        }

        public Builder swallowingDisorder(boolean swallowingDisorder) {
            this.swallowingDisorder = swallowingDisorder;
            return this;
        }

        public Builder mechanicallyAlteredDiet(boolean mechanicallyAlteredDiet) {
            this.mechanicallyAlteredDiet = mechanicallyAlteredDiet;
            return this;
        }

        public Builder needsSlpTherapy(boolean needsSlpTherapy) {
            this.needsSlpTherapy = needsSlpTherapy;
            return this;
        }

        public Builder needsTransport(boolean needsTransport) {
            this.needsTransport = needsTransport;
            return this;
        }

        public ClinicalFeatures build() {
            return new ClinicalFeatures(primaryDiagnosis == null ? "" : primaryDiagnosis,
                    secondaryDiagnoses, medications, functionScore, cognitiveScore,
                    therapyMinutesPerDay, specialCare, depression, swallowingDisorder,
                    mechanicallyAlteredDiet, needsSlpTherapy, needsTransport);
        }
    }
}
