package com.example.studydesign.entity;

import com.example.studydesign.domain.ProjectStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entity representing a study design project.
 *
 * Mutated only through {@link com.example.studydesign.store.ProjectDataService}, one stage commit
 * per transaction. Concurrent writers are detected through the optimistic lock version.
 */
@Entity
@Table(name = "study_projects", indexes = {
        @Index(name = "idx_study_projects_status_updated", columnList = "status,updated_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudyProject {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    // Drug
    @Column(name = "inn_en", nullable = false, length = 255)
    private String innEn;

    @Column(name = "inn_ru", length = 255)
    private String innRu;

    @Column(name = "dosage", length = 100)
    private String dosage;

    @Column(name = "dosage_form", length = 255)
    private String dosageForm;

    @ElementCollection
    @CollectionTable(name = "project_additional_substances", joinColumns = @JoinColumn(name = "project_id"))
    @OrderColumn(name = "position")
    @Column(name = "substance", nullable = false, length = 255)
    @Builder.Default
    private List<String> additionalSubstances = new ArrayList<>();

    // Study assumptions (null = policy default)
    @Column(name = "assumed_power")
    private Double assumedPower;

    @Column(name = "assumed_alpha")
    private Double assumedAlpha;

    @Column(name = "assumed_delta")
    private Double assumedDelta;

    @Column(name = "assumed_dropout_rate")
    private Double assumedDropoutRate;

    @Column(name = "assumed_screen_fail_rate")
    private Double assumedScreenFailRate;

    // State machine
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 40)
    private ProjectStatus status;

    @Column(name = "status_message", columnDefinition = "TEXT")
    private String statusMessage;

    @Column(name = "attempt", nullable = false)
    private int attempt;

    // Search summary (null until the search stage commits)
    @Column(name = "documents_found")
    private Integer documentsFound;

    @Column(name = "documents_processed")
    private Integer documentsProcessed;

    @Column(name = "parameters_accepted")
    private Integer parametersAccepted;

    @Column(name = "candidates_rejected")
    private Integer candidatesRejected;

    @OneToMany(mappedBy = "project", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<DrugParameter> parameters = new ArrayList<>();

    @Embedded
    private DesignRecord design;

    // Regulatory verdict
    @Column(name = "verdict_compliant")
    private Boolean verdictCompliant;

    @Column(name = "verdict_rule_set_version", length = 50)
    private String verdictRuleSetVersion;

    @ElementCollection
    @CollectionTable(name = "project_rule_outcomes", joinColumns = @JoinColumn(name = "project_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<RuleOutcomeRecord> ruleOutcomes = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "project_verdict_warnings", joinColumns = @JoinColumn(name = "project_id"))
    @OrderColumn(name = "position")
    @Column(name = "warning", nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private List<String> verdictWarnings = new ArrayList<>();

    // Report reference
    @Column(name = "report_artifact_ref", length = 512)
    private String reportArtifactRef;

    @Column(name = "report_media_type", length = 100)
    private String reportMediaType;

    @Column(name = "report_generated_at")
    private Instant reportGeneratedAt;

    // Audit timestamps
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Replace the parameter set. Existing rows are removed (orphan removal).
     */
    public void replaceParameters(List<DrugParameter> replacement) {
        parameters.clear();
        for (DrugParameter parameter : replacement) {
            parameter.setProject(this);
            parameters.add(parameter);
        }
    }

    public void replaceVerdict(boolean compliant, String ruleSetVersion,
                               List<RuleOutcomeRecord> outcomes, List<String> warnings) {
        this.verdictCompliant = compliant;
        this.verdictRuleSetVersion = ruleSetVersion;
        this.ruleOutcomes.clear();
        this.ruleOutcomes.addAll(outcomes);
        this.verdictWarnings.clear();
        this.verdictWarnings.addAll(warnings);
    }

    public void clearVerdict() {
        this.verdictCompliant = null;
        this.verdictRuleSetVersion = null;
        this.ruleOutcomes.clear();
        this.verdictWarnings.clear();
    }

    public void clearReport() {
        this.reportArtifactRef = null;
        this.reportMediaType = null;
        this.reportGeneratedAt = null;
    }

    public void clearSearchSummary() {
        this.documentsFound = null;
        this.documentsProcessed = null;
        this.parametersAccepted = null;
        this.candidatesRejected = null;
    }
}
