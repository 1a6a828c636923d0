package com.admissionsgenie.admission.cost;

import com.admissionsgenie.admission.error.ConfigurationError;
import com.admissionsgenie.admission.rates.ActiveRecords;
import com.google.common.collect.ImmutableList;
import java.time.LocalDate;

/** Finds the cost model in force for a facility's acuity band on a date. */
public class CostModelResolver {
    private final ImmutableList<CostModelRecord> costModels;

    public CostModelResolver(ImmutableList<CostModelRecord> costModels) {
        this.costModels = costModels;
    }

    public CostModelRecord resolve(String facilityId, AcuityBand acuityBand, LocalDate asOf) {
        ImmutableList<CostModelRecord> candidates = costModels.stream()
                .filter(model -> model.facilityId().equals(facilityId)
                        && model.acuityBand() == acuityBand)
                .collect(ImmutableList.toImmutableList());
        return ActiveRecords.selectActive(candidates, asOf,
                acuityBand + " cost model for facility " + facilityId,
                ConfigurationError.NO_ACTIVE_COST_MODEL, ConfigurationError.AMBIGUOUS_COST_MODEL);
    }
}
