package com.example.studydesign.config;

import com.example.studydesign.calculator.DesignPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Design policy constants.
 *
 * Defaults follow EMA/EAEU guidance. Bump {@code design.policy.version} whenever a value changes,
 * since every stored design records the version it was computed with.
 */
@Configuration
@Slf4j
public class DesignPolicyConfig {

    @Bean
    public DesignPolicy designPolicy(
            @Value("${design.policy.version:" + DesignPolicy.DEFAULT_VERSION + "}") String version,
            @Value("${design.policy.alpha:0.05}") double alpha,
            @Value("${design.policy.power:80}") double power,
            @Value("${design.policy.delta:20}") double delta,
            @Value("${design.policy.expected-ratio:0.95}") double expectedRatio,
            @Value("${design.policy.high-variability-threshold:30}") double highVariabilityThreshold,
            @Value("${design.policy.standard-min-subjects:12}") int standardMinSubjects,
            @Value("${design.policy.replicate-min-subjects:24}") int replicateMinSubjects,
            @Value("${design.policy.washout-half-lives:5}") int washoutHalfLives,
            @Value("${design.policy.min-washout-hours:24}") int minWashoutHours,
            @Value("${design.policy.fallback-half-life-hours:24}") double fallbackHalfLifeHours,
            @Value("${design.policy.max-sample-size:10000}") int maxSampleSize) {

        DesignPolicy policy = DesignPolicy.builder()
                .version(version)
                .alpha(alpha)
                .power(power)
                .delta(delta)
                .expectedRatio(expectedRatio)
                .highVariabilityThreshold(highVariabilityThreshold)
                .standardMinSubjects(standardMinSubjects)
                .replicateMinSubjects(replicateMinSubjects)
                .washoutHalfLives(washoutHalfLives)
                .minWashoutHours(minWashoutHours)
                .fallbackHalfLifeHours(fallbackHalfLifeHours)
                .maxSampleSize(maxSampleSize)
                .build();

        log.info("Design policy {}: alpha={}, power={}%, delta={}%, ratio={}, HVD threshold={}%, floors={}/{}",
                version, alpha, power, delta, expectedRatio, highVariabilityThreshold,
                standardMinSubjects, replicateMinSubjects);
        return policy;
    }
}
