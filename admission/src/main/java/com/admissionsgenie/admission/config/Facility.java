package com.admissionsgenie.admission.config;

import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.scoring.BusinessWeights;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * A skilled nursing facility and the facility-level factors an evaluation needs.
 *
 * @param capabilities special-care needs the facility can provide
 * @param weights facility-specific business weights, service defaults when empty
 */
public record Facility(String id, String name, BigDecimal wageIndex, BigDecimal vbpMultiplier,
        ImmutableSet<SpecialCare> capabilities, Optional<BusinessWeights> weights) {

    public Facility {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Facility needs an id");
        }
        if (wageIndex.signum() <= 0 || vbpMultiplier.signum() <= 0) {
            throw new IllegalArgumentException(
                    "Wage index and VBP multiplier must be positive for facility " + id);
        }
    }
}
