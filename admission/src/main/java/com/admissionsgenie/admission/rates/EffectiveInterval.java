package com.admissionsgenie.admission.rates;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Half-open date interval {@code [from, to)}. An empty {@code to} means open-ended.
 */
public record EffectiveInterval(LocalDate from, Optional<LocalDate> to) {

    public EffectiveInterval {
        if (from == null) {
            throw new IllegalArgumentException("Effective interval needs a start date");
        }
        if (to.isPresent() && !to.get().isAfter(from)) {
            throw new IllegalArgumentException(
                    "Effective interval ends on or before it starts: " + from + " to " + to.get());
        }
    }

    public static EffectiveInterval between(LocalDate from, LocalDate to) {
        return new EffectiveInterval(from, Optional.of(to));
    }

    public static EffectiveInterval startingOn(LocalDate from) {
        return new EffectiveInterval(from, Optional.empty());
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && to.map(date::isBefore).orElse(true);
    }

    public boolean overlaps(EffectiveInterval other) {
        boolean startsBeforeOtherEnds = other.to.map(from::isBefore).orElse(true);
        boolean otherStartsBeforeThisEnds = to.map(other.from::isBefore).orElse(true);
        return startsBeforeOtherEnds && otherStartsBeforeThisEnds;
    }

    @Override
    public String toString() {
        return "[" + from + ", " + to.map(LocalDate::toString).orElse("open") + ")";
    }
}
