package com.admissionsgenie.admission.cost;

import static org.junit.jupiter.api.Assertions.*;

import com.admissionsgenie.admission.TestData;
import com.admissionsgenie.admission.casemix.CaseMixClassification;
import com.admissionsgenie.admission.casemix.NursingGroup;
import com.admissionsgenie.admission.casemix.SlpGroup;
import com.admissionsgenie.admission.casemix.SpecialCare;
import com.admissionsgenie.admission.error.ConfigurationError;
import com.admissionsgenie.admission.error.ConfigurationException;
import com.admissionsgenie.admission.rates.PayerType;
import com.admissionsgenie.admission.revenue.RevenueBreakdown;
import com.admissionsgenie.admission.revenue.RevenueCategory;
import com.admissionsgenie.admission.revenue.RevenueLine;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class CostEstimatorTest {

    private final CostEstimator estimator = new CostEstimator(DenialRiskModel.STANDARD);
    private final CaseMixClassification woundCare =
            TestData.classification(NursingGroup.LBC1, SlpGroup.NONE, 0, SpecialCare.WOUND_CARE);
    private final RevenueBreakdown medicaidRevenue = RevenueBreakdown.of(PayerType.MEDICAID,
            "medicaid-2025", 10, ImmutableList.of(new RevenueLine(RevenueCategory.BASE_RATE,
                    "Base per diem", CurrencyAmount.from("2340.00"))));

    @Test
    void estimateCost_itemizesDirectCostsOverheadAndDenialRisk() {
        CostBreakdown cost = estimator.estimateCost(woundCare,
                TestData.costModel(AcuityBand.MEDIUM), 10, AuthorizationStatus.UNKNOWN,
                PayerType.MEDICAID, medicaidRevenue, false);

        assertEquals(CurrencyAmount.from("1520.00"), cost.totalFor(CostCategory.NURSING),
                "4 h/day x $38 x 10 days");
        assertEquals(CurrencyAmount.from("700.00"), cost.totalFor(CostCategory.SUPPLIES),
                "$50/day plus $20/day wound care surcharge");
        assertEquals(CurrencyAmount.from("300.00"), cost.totalFor(CostCategory.PHARMACY));
        assertEquals(CurrencyAmount.ZERO, cost.totalFor(CostCategory.TRANSPORT));
        assertEquals(CurrencyAmount.from("554.40"), cost.totalFor(CostCategory.OVERHEAD),
                "22% of $2,520 direct costs");
        assertEquals(CurrencyAmount.from("351.00"), cost.totalFor(CostCategory.DENIAL_RISK),
                "15% of $2,340 revenue");
        assertEquals(CurrencyAmount.from("3425.40"), cost.total());
        assertEquals(0, new BigDecimal("0.15").compareTo(cost.denialProbability()));
        assertEquals("cost-medium", cost.costModelId());
        assertEquals(AcuityBand.MEDIUM, cost.acuityBand());
    }

    @Test
    void estimateCost_skipsSurchargesForAbsentNeeds() {
        CostBreakdown cost = estimator.estimateCost(
                TestData.classification(NursingGroup.LBC1, SlpGroup.NONE, 0),
                TestData.costModel(AcuityBand.MEDIUM), 10, AuthorizationStatus.UNKNOWN,
                PayerType.MEDICAID, medicaidRevenue, false);

        assertEquals(CurrencyAmount.from("500.00"), cost.totalFor(CostCategory.SUPPLIES));
    }

    @Test
    void estimateCost_transportIsOneTimeAndCarriesOverhead() {
        CostBreakdown cost = estimator.estimateCost(woundCare,
                TestData.costModel(AcuityBand.MEDIUM), 10, AuthorizationStatus.UNKNOWN,
                PayerType.MEDICAID, medicaidRevenue, true);

        assertEquals(CurrencyAmount.from("150.00"), cost.totalFor(CostCategory.TRANSPORT));
        assertEquals(CurrencyAmount.from("587.40"), cost.totalFor(CostCategory.OVERHEAD));
    }

    @Test
    void estimateCost_totalIsSumOfLines() {
        CostBreakdown cost = estimator.estimateCost(woundCare,
                TestData.costModel(AcuityBand.COMPLEX), 37, AuthorizationStatus.PENDING,
                PayerType.MEDICARE_ADVANTAGE, medicaidRevenue, true);

        CurrencyAmount sum = CurrencyAmount.sum(cost.lines().stream().map(CostLine::amount)
                .collect(ImmutableList.toImmutableList()));
        assertEquals(sum, cost.total());
    }

    @Test
    void probability_risesWithComplexity() {
        assertEquals(0, new BigDecimal("0.02").compareTo(DenialRiskModel.STANDARD
                .probability(PayerType.MEDICARE_FFS, AuthorizationStatus.APPROVED, 0)));
        assertEquals(0, new BigDecimal("0.07").compareTo(DenialRiskModel.STANDARD
                .probability(PayerType.MEDICARE_FFS, AuthorizationStatus.APPROVED, 10)));
    }

    @Test
    void probability_isCapped() {
        assertEquals(0, new BigDecimal("0.95").compareTo(DenialRiskModel.STANDARD
                .probability(PayerType.MEDICAID, AuthorizationStatus.DENIED, 20)));
    }

    @Test
    void probability_neverDecreasesTowardsDenial() {
        AuthorizationStatus[] ordered = {AuthorizationStatus.APPROVED,
                AuthorizationStatus.PENDING, AuthorizationStatus.UNKNOWN,
                AuthorizationStatus.DENIED};
        for (PayerType payerType : PayerType.values()) {
            for (int i = 1; i < ordered.length; i++) {
                BigDecimal lower =
                        DenialRiskModel.STANDARD.probability(payerType, ordered[i - 1], 4);
                BigDecimal higher = DenialRiskModel.STANDARD.probability(payerType, ordered[i], 4);
                assertTrue(higher.compareTo(lower) >= 0,
                        payerType + " " + ordered[i] + " should not be below " + ordered[i - 1]);
            }
        }
    }

    @Test
    void payerConfig_rejectsDecreasingRates() {
        assertThrows(IllegalArgumentException.class,
                () -> PayerConfig.builder().payerType(PayerType.MEDICAID)
                        .approvedDenialRate("0.20").pendingDenialRate("0.10")
                        .unknownDenialRate("0.15").deniedDenialRate("0.90").build());
        assertThrows(IllegalArgumentException.class,
                () -> PayerConfig.builder().payerType(PayerType.MEDICAID)
                        .approvedDenialRate("0.02").pendingDenialRate("0.10")
                        .unknownDenialRate("0.15").deniedDenialRate("1.20").build());
    }

    @Test
    void acuityBand_followsNursingTier() {
        assertEquals(AcuityBand.COMPLEX, AcuityBand.fromNursingGroup(NursingGroup.ES2));
        assertEquals(AcuityBand.HIGH, AcuityBand.fromNursingGroup(NursingGroup.HDE1));
        assertEquals(AcuityBand.MEDIUM, AcuityBand.fromNursingGroup(NursingGroup.LBC1));
        assertEquals(AcuityBand.MEDIUM, AcuityBand.fromNursingGroup(NursingGroup.CA1));
        assertEquals(AcuityBand.LOW, AcuityBand.fromNursingGroup(NursingGroup.BAB2));
        assertEquals(AcuityBand.LOW, AcuityBand.fromNursingGroup(NursingGroup.PA1));
    }

    @Test
    void costModelResolver_picksBandAndDate() {
        CostModelResolver resolver = new CostModelResolver(ImmutableList.of(
                TestData.costModel(AcuityBand.LOW), TestData.costModel(AcuityBand.HIGH)));

        assertEquals("cost-high",
                resolver.resolve(TestData.FACILITY_ID, AcuityBand.HIGH, TestData.AS_OF).id());
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> resolver.resolve(TestData.FACILITY_ID, AcuityBand.MEDIUM, TestData.AS_OF));
        assertEquals(ConfigurationError.NO_ACTIVE_COST_MODEL, e.error());
    }
}
