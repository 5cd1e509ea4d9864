package com.example.studydesign.entity;

import com.example.studydesign.domain.DesignType;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

/**
 * Persisted {@link com.example.studydesign.domain.DesignResult}. All columns are null until the
 * design stage commits.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DesignRecord {

    @Column(name = "design_sample_size")
    private Integer sampleSize;

    @Column(name = "design_subjects_per_sequence")
    private Integer subjectsPerSequence;

    @Column(name = "design_enrollment_dropout")
    private Integer enrollmentWithDropout;

    @Column(name = "design_enrollment_screen_fail")
    private Integer enrollmentWithScreenFail;

    @Column(name = "design_washout_days")
    private Integer washoutDays;

    @Column(name = "design_washout_estimated")
    private Boolean washoutEstimated;

    @Column(name = "design_cv_intra")
    private Double cvIntraUsed;

    @Column(name = "design_half_life_hours")
    private Double halfLifeHoursUsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "design_type", length = 40)
    private DesignType designType;

    @Column(name = "design_power")
    private Double power;

    @Column(name = "design_alpha")
    private Double alpha;

    @Column(name = "design_delta")
    private Double delta;

    @Column(name = "design_dropout_rate")
    private Double dropoutRate;

    @Column(name = "design_screen_fail_rate")
    private Double screenFailRate;

    @Column(name = "design_policy_version", length = 50)
    private String policyVersion;

    @Column(name = "design_explanation", columnDefinition = "TEXT")
    private String explanation;
}
