package com.admissionsgenie.admission.config;

import com.admissionsgenie.admission.evaluation.AdmissionEvaluator;
import com.admissionsgenie.admission.evaluation.PipelinePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the evaluation pipeline from the {@code evaluation.*} properties. A policy that fails
 * validation stops the service from starting.
 */
@Configuration
@EnableConfigurationProperties(EvaluationProperties.class)
public class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public PipelinePolicy pipelinePolicy(EvaluationProperties properties) {
        PipelinePolicy policy = properties.toPipelinePolicy();
        logger.info("Evaluation policy: {} curve, thresholds {}, default weights {}, max LOS {}",
                policy.scoringPolicy().curve(), policy.scoringPolicy().thresholds(),
                policy.defaultWeights(), policy.maxLengthOfStay());
        return policy;
    }

    @Bean
    public AdmissionEvaluator admissionEvaluator(PipelinePolicy pipelinePolicy) {
        return new AdmissionEvaluator(pipelinePolicy);
    }
}
