package com.admissionsgenie.admission.rates;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;

/**
 * Variable per-diem adjustment: the factor applied to a component's per-diem rate on each day
 * of the stay. Each step holds from its first day until the next step begins; the last step
 * holds for the rest of the stay.
 */
public record VariablePerDiemSchedule(ImmutableList<Step> steps) {

    public static final VariablePerDiemSchedule NONE =
            new VariablePerDiemSchedule(ImmutableList.of(new Step(1, BigDecimal.ONE)));

    public record Step(int fromDay, BigDecimal factor) {
        public Step {
            if (fromDay < 1) {
                throw new IllegalArgumentException("VPD steps start on day 1 or later");
            }
            if (factor.signum() < 0) {
                throw new IllegalArgumentException("VPD factor cannot be negative: " + factor);
            }
        }
    }

    public VariablePerDiemSchedule {
        if (steps.isEmpty() || steps.get(0).fromDay() != 1) {
            throw new IllegalArgumentException("VPD schedule must start on day 1");
        }
        for (int i = 1; i < steps.size(); i++) {
            if (steps.get(i).fromDay() <= steps.get(i - 1).fromDay()) {
                throw new IllegalArgumentException("VPD steps must be in increasing day order");
            }
        }
    }

    public BigDecimal factorForDay(int day) {
        BigDecimal factor = steps.get(0).factor();
        for (Step step : steps) {
            if (step.fromDay() > day) {
                break;
            }
            factor = step.factor();
        }
        return factor;
    }

    /** Sum of the daily factors over days 1 to {@code lengthOfStay}. */
    public BigDecimal cumulativeFactor(int lengthOfStay) {
        BigDecimal total = BigDecimal.ZERO;
        for (int day = 1; day <= lengthOfStay; day++) {
            total = total.add(factorForDay(day));
        }
        return total;
    }
}
