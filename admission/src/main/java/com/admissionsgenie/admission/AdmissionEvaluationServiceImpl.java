package com.admissionsgenie.admission;

import com.admissionsgenie.admission.config.ConfigurationStore;
import com.admissionsgenie.admission.error.ConfigurationException;
import com.admissionsgenie.admission.error.ValidationException;
import com.admissionsgenie.admission.evaluation.AdmissionEvaluator;
import com.admissionsgenie.admission.evaluation.EvaluationRequest;
import com.admissionsgenie.admission.evaluation.EvaluationResult;
import com.admissionsgenie.shared.AdmissionEvaluationServiceGrpc;
import com.admissionsgenie.shared.EvaluateAdmissionRequest;
import com.admissionsgenie.shared.EvaluateAdmissionResponse;
import com.admissionsgenie.shared.EvaluateAdmissionResult;
import com.admissionsgenie.shared.RecalculateAdmissionRequest;
import com.google.common.collect.ImmutableList;
import io.grpc.stub.StreamObserver;
import java.time.LocalDate;
import java.util.Optional;
import net.devh.boot.grpc.server.service.GrpcService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;

@GrpcService
public class AdmissionEvaluationServiceImpl
        extends AdmissionEvaluationServiceGrpc.AdmissionEvaluationServiceImplBase {
    private static final Logger logger =
            LoggerFactory.getLogger(AdmissionEvaluationServiceImpl.class);
    private final ConfigurationStore configurationStore;
    private final AdmissionEvaluator evaluator;

    @Autowired
    public AdmissionEvaluationServiceImpl(ConfigurationStore configurationStore,
            AdmissionEvaluator evaluator) {
        this.configurationStore = configurationStore;
        this.evaluator = evaluator;
    }

    @Override
    public void evaluateAdmission(EvaluateAdmissionRequest request,
            StreamObserver<EvaluateAdmissionResponse> responseObserver) {
        try {
            logger.info("Received admission evaluation for facility {} ({}, {} days)",
                    request.getFacilityId(), request.getPayerType(), request.getProjectedLos());
            responseObserver.onNext(respond(request, Optional.empty(), Optional.empty()));
            responseObserver.onCompleted();
        } catch (Exception e) {
            logger.error("Error evaluating admission", e);
            responseObserver.onError(e);
        }
    }

    @Override
    public void recalculateAdmission(RecalculateAdmissionRequest request,
            StreamObserver<EvaluateAdmissionResponse> responseObserver) {
        try {
            logger.info("Received admission recalculation for facility {}",
                    request.getOriginal().getFacilityId());
            Optional<Integer> lengthOfStay = request.hasProjectedLos()
                    ? Optional.of(request.getProjectedLos()) : Optional.empty();
            Optional<Double> censusPriority = request.hasCensusPriority()
                    ? Optional.of(request.getCensusPriority()) : Optional.empty();
            responseObserver.onNext(respond(request.getOriginal(), lengthOfStay, censusPriority));
            responseObserver.onCompleted();
        } catch (Exception e) {
            logger.error("Error recalculating admission", e);
            responseObserver.onError(e);
        }
    }

    private EvaluateAdmissionResponse respond(EvaluateAdmissionRequest proto,
            Optional<Integer> lengthOfStay, Optional<Double> censusPriority) {
        try {
            ImmutableList.Builder<String> mappingWarnings = ImmutableList.builder();
            EvaluationRequest request =
                    ProtoMapper.toRequest(proto, LocalDate.now(), mappingWarnings);
            EvaluationResult result = evaluator.recalculate(request, lengthOfStay,
                    censusPriority, configurationStore.snapshot());
            logger.info("Facility {} admission scored {} ({})", request.facilityId(),
                    String.format("%.1f", result.score().rawScore()),
                    result.score().recommendation());
            return ProtoMapper.toResponse(result, mappingWarnings.build());
        } catch (ValidationException e) {
            logger.warn("Rejected admission request: {} {}", e.error(), e.getMessage());
            return ProtoMapper.errorResponse(
                    EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_INVALID_REQUEST,
                    e.error().name(), e.getMessage());
        } catch (ConfigurationException e) {
            logger.error("Configuration problem evaluating admission: {} {}", e.error(),
                    e.getMessage());
            return ProtoMapper.errorResponse(
                    EvaluateAdmissionResult.EVALUATE_ADMISSION_RESULT_CONFIGURATION_ERROR,
                    e.error().name(), e.getMessage());
        }
    }
}
