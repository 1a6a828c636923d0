package com.admissionsgenie.admission.casemix;

import com.google.common.collect.ImmutableMap;

/**
 * Cut-points bucketing an NTA score into {@link NtaGroup}s. Each group holds the minimum score
 * that reaches it; NF must start at zero and the minimums must strictly decrease from NA to NF.
 */
public record NtaBands(ImmutableMap<NtaGroup, Integer> minimumScores) {

    public static final NtaBands STANDARD = new NtaBands(ImmutableMap.of(NtaGroup.NA, 12,
            NtaGroup.NB, 9, NtaGroup.NC, 6, NtaGroup.ND, 3, NtaGroup.NE, 1, NtaGroup.NF, 0));

    public NtaBands {
        Integer previous = null;
        for (NtaGroup group : NtaGroup.values()) {
            Integer minimum = minimumScores.get(group);
            if (minimum == null) {
                throw new IllegalArgumentException("Missing NTA cut-point for " + group);
            }
            if (previous != null && minimum >= previous) {
                throw new IllegalArgumentException(
                        "NTA cut-points must strictly decrease, " + group + " starts at "
                                + minimum + " but the band above starts at " + previous);
            }
            previous = minimum;
        }
        if (minimumScores.get(NtaGroup.NF) != 0) {
            throw new IllegalArgumentException("The lowest NTA band must start at zero");
        }
    }

    public NtaGroup groupFor(int score) {
        if (score < 0) {
            throw new IllegalArgumentException("NTA score cannot be negative: " + score);
        }
        for (NtaGroup group : NtaGroup.values()) {
            if (score >= minimumScores.get(group)) {
                return group;
            }
        }
        return NtaGroup.NF;
    }
}
