package com.admissionsgenie.admission.config;

import com.admissionsgenie.admission.cost.CostModelRecord;
import com.admissionsgenie.admission.rates.RateRecord;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/**
 * Immutable view of the configuration records one evaluation runs against.
 */
public record ConfigurationSnapshot(ImmutableMap<String, Facility> facilities,
        ImmutableList<RateRecord> rateRecords, ImmutableList<CostModelRecord> costModels) {

    public static final ConfigurationSnapshot EMPTY =
            new ConfigurationSnapshot(ImmutableMap.of(), ImmutableList.of(), ImmutableList.of());

    public Optional<Facility> facility(String facilityId) {
        return Optional.ofNullable(facilities.get(facilityId));
    }
}
