package com.admissionsgenie.admission.rates;

import com.admissionsgenie.admission.error.ConfigurationError;
import com.admissionsgenie.admission.error.ConfigurationException;
import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Selects the single record in force on a date. Selection is by interval containment only:
 * there is never a fallback to the most recent record.
 */
public final class ActiveRecords {

    private ActiveRecords() {}

    public static <T extends Versioned> T selectActive(Collection<T> candidates, LocalDate asOf,
            String description, ConfigurationError noneError,
            ConfigurationError ambiguousError) {
        ImmutableList<T> active = candidates.stream()
                .filter(record -> record.interval().contains(asOf))
                .collect(ImmutableList.toImmutableList());
        if (active.isEmpty()) {
            throw new ConfigurationException(noneError,
                    "No " + description + " is in force on " + asOf);
        }
        if (active.size() > 1) {
            throw new ConfigurationException(ambiguousError,
                    active.size() + " records for " + description + " are in force on " + asOf
                            + ": " + active.stream().map(Versioned::id)
                                    .collect(Collectors.joining(", ")));
        }
        return active.get(0);
    }
}
