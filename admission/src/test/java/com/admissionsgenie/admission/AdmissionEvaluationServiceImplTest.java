package com.admissionsgenie.admission;

import static org.junit.jupiter.api.Assertions.*;

import com.admissionsgenie.admission.evaluation.AdmissionEvaluator;
import com.admissionsgenie.admission.evaluation.PipelinePolicy;
import com.admissionsgenie.shared.AdmissionDecision;
import com.admissionsgenie.shared.AuthorizationState;
import com.admissionsgenie.shared.ClinicalIntake;
import com.admissionsgenie.shared.CurrencyUtil.CurrencyAmount;
import com.admissionsgenie.shared.EvaluateAdmissionRequest;
import com.admissionsgenie.shared.EvaluateAdmissionResponse;
import com.admissionsgenie.shared.EvaluateAdmissionResult;
import com.admissionsgenie.shared.PayerFamily;
import com.admissionsgenie.shared.RecalculateAdmissionRequest;
import io.grpc.stub.StreamObserver;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AdmissionEvaluationServiceImplTest {

    private final AdmissionEvaluationServiceImpl service = new AdmissionEvaluationServiceImpl(
            TestData.store(), new AdmissionEvaluator(PipelinePolicy.STANDARD));

    @Test
    void evaluateAdmission_success() throws Exception {
        EvaluateAdmissionResponse response = evaluate(requestBuilder()
                .setPayerType(PayerFamily.PAYER_FAMILY_MEDICARE_FFS).setProjectedLos(25)
                .setCensusPriority(0.8).build());

        assertEquals(EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_SUCCESS,
                response.getResult());
        assertEquals("PA1", response.getClassification().getNursingGroup());
        assertEquals(CurrencyAmount.from("135622.50"),
                CurrencyAmount.fromProto(response.getProjection().getTotalRevenue()));
        assertEquals(CurrencyAmount.from("127450.55"),
                CurrencyAmount.fromProto(response.getProjection().getProjectedMarginTotal()));
        assertEquals(25, response.getProjection().getLengthOfStay());
        assertEquals(AdmissionDecision.ADMISSION_DECISION_ACCEPT,
                response.getScore().getRecommendation());
        assertFalse(response.getScore().getFactorsList().isEmpty(), "Factors are explained");
        assertEquals(12, response.getSuggestedLos());
        assertEquals("", response.getErrorCode());
    }

    @Test
    void evaluateAdmission_invalidLengthOfStay() throws Exception {
        EvaluateAdmissionResponse response = evaluate(requestBuilder()
                .setPayerType(PayerFamily.PAYER_FAMILY_MEDICAID).setProjectedLos(0).build());

        assertEquals(EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_INVALID_REQUEST,
                response.getResult());
        assertEquals("INVALID_LOS", response.getErrorCode());
        assertFalse(response.hasProjection(), "No partial projection on failure");
    }

    @Test
    void evaluateAdmission_missingPayer() throws Exception {
        EvaluateAdmissionResponse response = evaluate(requestBuilder().setProjectedLos(20)
                .build());

        assertEquals(EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_INVALID_REQUEST,
                response.getResult());
        assertEquals("MISSING_PAYER", response.getErrorCode());
    }

    @Test
    void evaluateAdmission_malformedAsOfDate() throws Exception {
        EvaluateAdmissionResponse response = evaluate(requestBuilder()
                .setPayerType(PayerFamily.PAYER_FAMILY_MEDICAID).setProjectedLos(20)
                .setAsOfDate("11/01/2025").build());

        assertEquals(EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_INVALID_REQUEST,
                response.getResult());
        assertEquals("INVALID_AS_OF_DATE", response.getErrorCode());
    }

    @Test
    void evaluateAdmission_noManagedCareContract() throws Exception {
        EvaluateAdmissionResponse response = evaluate(requestBuilder()
                .setPayerType(PayerFamily.PAYER_FAMILY_MANAGED_CARE_ORGANIZATION)
                .setProjectedLos(20).build());

        assertEquals(EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_CONFIGURATION_ERROR,
                response.getResult());
        assertEquals("NO_ACTIVE_RATE", response.getErrorCode());
        assertFalse(response.getErrorMessage().isEmpty());
    }

    @Test
    void evaluateAdmission_unknownSpecialCareFlagIsWarned() throws Exception {
        EvaluateAdmissionResponse response = evaluate(requestBuilder()
                .setPayerType(PayerFamily.PAYER_FAMILY_MEDICAID).setProjectedLos(20)
                .setFeatures(intake().addSpecialCare("wound_care").addSpecialCare("JETPACK"))
                .build());

        assertEquals(EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_SUCCESS,
                response.getResult());
        assertEquals("Unrecognized special care flag ignored: JETPACK", response.getWarnings(0));
        assertTrue(response.getProjection().getCostLinesList().stream()
                .anyMatch(line -> line.getLabel().contains("WOUND_CARE")),
                "Lower-case flags are still recognized");
    }

    @Test
    void recalculateAdmission_overridesLengthOfStay() throws Exception {
        EvaluateAdmissionRequest original = requestBuilder()
                .setPayerType(PayerFamily.PAYER_FAMILY_MEDICAID).setProjectedLos(20).build();

        EvaluateAdmissionResponse before = evaluate(original);
        EvaluateAdmissionResponse after = recalculate(RecalculateAdmissionRequest.newBuilder()
                .setOriginal(original).setProjectedLos(30).build());

        assertEquals(CurrencyAmount.from("4680.00"),
                CurrencyAmount.fromProto(before.getProjection().getTotalRevenue()));
        assertEquals(CurrencyAmount.from("7020.00"),
                CurrencyAmount.fromProto(after.getProjection().getTotalRevenue()));
        assertEquals(30, after.getProjection().getLengthOfStay());
        assertEquals(before.getClassification(), after.getClassification(),
                "Classification does not depend on length of stay");
    }

    private static EvaluateAdmissionRequest.Builder requestBuilder() {
        return EvaluateAdmissionRequest.newBuilder().setFacilityId(TestData.FACILITY_ID)
                .setAuthorizationStatus(AuthorizationState.AUTHORIZATION_STATE_APPROVED)
                .setAsOfDate(TestData.AS_OF.toString()).setFeatures(intake());
    }

    private static ClinicalIntake.Builder intake() {
        return ClinicalIntake.newBuilder().setPrimaryDiagnosis("Z96.651").setFunctionScore(16)
                .setCognitiveScore(15);
    }

    private EvaluateAdmissionResponse evaluate(EvaluateAdmissionRequest request)
            throws Exception {
        ResponseCollector collector = new ResponseCollector();
        service.evaluateAdmission(request, collector);
        return collector.await();
    }

    private EvaluateAdmissionResponse recalculate(RecalculateAdmissionRequest request)
            throws Exception {
        ResponseCollector collector = new ResponseCollector();
        service.recalculateAdmission(request, collector);
        return collector.await();
    }

    private static class ResponseCollector implements StreamObserver<EvaluateAdmissionResponse> {
        private final CountDownLatch latch = new CountDownLatch(1);
        private final EvaluateAdmissionResponse[] responseHolder = new EvaluateAdmissionResponse[1];

        @Override
        public void onNext(EvaluateAdmissionResponse response) {
            responseHolder[0] = response;
        }

        @Override
        public void onError(Throwable t) {
            fail("RPC failed: " + t.getMessage());
        }

        @Override
        public void onCompleted() {
            latch.countDown();
        }

        EvaluateAdmissionResponse await() throws InterruptedException {
            assertTrue(latch.await(5, TimeUnit.SECONDS), "Request timed out");
            return responseHolder[0];
        }
    }
}
