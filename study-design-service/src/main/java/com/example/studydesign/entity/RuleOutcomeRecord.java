package com.example.studydesign.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RuleOutcomeRecord {

    @Column(name = "rule_id", nullable = false, length = 50)
    private String ruleId;

    @Column(name = "passed", nullable = false)
    private boolean passed;

    @Column(name = "message", columnDefinition = "TEXT")
    private String message;
}
