package com.example.studydesign.entity;

import com.example.studydesign.domain.ParameterKind;
import jakarta.persistence.*;
import lombok.*;

/**
 * Entity representing one pharmacokinetic observation attached to a project.
 */
@Entity
@Table(name = "drug_parameters", indexes = {
        @Index(name = "idx_drug_parameters_project_kind", columnList = "project_id,kind")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DrugParameter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private StudyProject project;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private ParameterKind kind;

    @Column(name = "param_value", nullable = false)
    private double value;

    @Column(name = "unit", length = 50)
    private String unit;

    @Column(name = "source_ref", nullable = false, length = 100)
    private String sourceRef;

    @Column(name = "source_title", columnDefinition = "TEXT")
    private String sourceTitle;

    @Column(name = "reliable", nullable = false)
    private boolean reliable;
}
