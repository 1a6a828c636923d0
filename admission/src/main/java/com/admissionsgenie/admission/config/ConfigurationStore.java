package com.admissionsgenie.admission.config;

import com.admissionsgenie.admission.cost.CostModelRecord;
import com.admissionsgenie.admission.error.ConfigurationError;
import com.admissionsgenie.admission.error.ConfigurationException;
import com.admissionsgenie.admission.rates.RateRecord;
import com.admissionsgenie.admission.rates.Versioned;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores (in memory) facilities, rate records and cost models.
 *
 * Records with the same key (facility and payer, or facility and acuity band) must not have
 * overlapping effective intervals; such a record is rejected when added. Evaluations read an
 * immutable {@link #snapshot()} and never lock the store.
 */
public class ConfigurationStore {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationStore.class);

    private final Map<String, Facility> facilities;
    private final List<RateRecord> rateRecords;
    private final List<CostModelRecord> costModels;

    public ConfigurationStore() {
        this.facilities = new LinkedHashMap<>();
        this.rateRecords = new ArrayList<>();
        this.costModels = new ArrayList<>();
    }

    public synchronized void addFacility(Facility facility) {
        if (facilities.containsKey(facility.id())) {
            throw new IllegalArgumentException("Facility already exists: " + facility.id());
        }
        facilities.put(facility.id(), facility);
        logger.info("Added facility {} ({})", facility.id(), facility.name());
    }

    public synchronized void addRateRecord(RateRecord rateRecord) {
        checkFacilityExists(rateRecord.facilityId());
        checkIdUnique(rateRecord.id(), rateRecords);
        checkNoOverlap(rateRecord, rateRecords,
                existing -> existing.facilityId().equals(rateRecord.facilityId())
                        && existing.payerType() == rateRecord.payerType());
        rateRecords.add(rateRecord);
        logger.info("Added {} rate record {} for facility {} effective {}",
                rateRecord.payerType(), rateRecord.id(), rateRecord.facilityId(),
                rateRecord.interval());
    }

    public synchronized void addCostModel(CostModelRecord costModel) {
        checkFacilityExists(costModel.facilityId());
        checkIdUnique(costModel.id(), costModels);
        checkNoOverlap(costModel, costModels,
                existing -> existing.facilityId().equals(costModel.facilityId())
                        && existing.acuityBand() == costModel.acuityBand());
        costModels.add(costModel);
        logger.info("Added {} cost model {} for facility {} effective {}",
                costModel.acuityBand(), costModel.id(), costModel.facilityId(),
                costModel.interval());
    }

    public synchronized ConfigurationSnapshot snapshot() {
        return new ConfigurationSnapshot(ImmutableMap.copyOf(facilities),
                ImmutableList.copyOf(rateRecords), ImmutableList.copyOf(costModels));
    }

    private void checkFacilityExists(String facilityId) {
        if (!facilities.containsKey(facilityId)) {
            throw new IllegalArgumentException("Facility not found: " + facilityId);
        }
    }

    private static void checkIdUnique(String id, List<? extends Versioned> existing) {
        if (existing.stream().anyMatch(record -> record.id().equals(id))) {
            throw new IllegalArgumentException("Record already exists: " + id);
        }
    }

    private static <T extends Versioned> void checkNoOverlap(T candidate, List<T> existing,
            Predicate<T> sameKey) {
        for (T record : existing) {
            if (sameKey.test(record) && record.interval().overlaps(candidate.interval())) {
                throw new ConfigurationException(ConfigurationError.OVERLAPPING_INTERVALS,
                        "Record " + candidate.id() + " effective " + candidate.interval()
                                + " overlaps " + record.id() + " effective "
                                + record.interval());
            }
        }
    }
}
