package com.example.studydesign.store;

import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.RegulatoryVerdict;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.domain.RuleOutcome;
import com.example.studydesign.domain.SearchSummary;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.entity.DesignRecord;
import com.example.studydesign.entity.DrugParameter;
import com.example.studydesign.entity.RuleOutcomeRecord;
import com.example.studydesign.entity.StudyProject;

/**
 * Converts between JPA entities and immutable domain values.
 * Must be called inside the transaction that loaded the entity (lazy collections).
 */
final class ProjectSnapshotMapper {

    private ProjectSnapshotMapper() {
    }

    static ProjectSnapshot toSnapshot(StudyProject project) {
        return ProjectSnapshot.builder()
                .id(project.getId())
                .drug(new DrugIdentifier(project.getInnEn(), project.getInnRu(), project.getDosage(),
                        project.getDosageForm(), project.getAdditionalSubstances()))
                .assumptions(new StudyAssumptions(project.getAssumedPower(), project.getAssumedAlpha(),
                        project.getAssumedDelta(), project.getAssumedDropoutRate(), project.getAssumedScreenFailRate()))
                .status(project.getStatus())
                .statusMessage(project.getStatusMessage())
                .attempt(project.getAttempt())
                .parameters(project.getParameters().stream().map(ProjectSnapshotMapper::toParameter).toList())
                .searchSummary(toSearchSummary(project))
                .design(toDesign(project.getDesign()))
                .verdict(toVerdict(project))
                .report(toReport(project))
                .createdAt(project.getCreatedAt())
                .updatedAt(project.getUpdatedAt())
                .build();
    }

    static DrugParameter toEntity(ExtractedParameter parameter) {
        return DrugParameter.builder()
                .kind(parameter.kind())
                .value(parameter.value())
                .unit(parameter.unit())
                .sourceRef(parameter.sourceRef())
                .sourceTitle(parameter.sourceTitle())
                .reliable(parameter.reliable())
                .build();
    }

    static DesignRecord toRecord(DesignResult design) {
        return DesignRecord.builder()
                .sampleSize(design.sampleSize())
                .subjectsPerSequence(design.subjectsPerSequence())
                .enrollmentWithDropout(design.enrollmentWithDropout())
                .enrollmentWithScreenFail(design.enrollmentWithScreenFail())
                .washoutDays(design.washoutDays())
                .washoutEstimated(design.washoutEstimated())
                .cvIntraUsed(design.cvIntraUsed())
                .halfLifeHoursUsed(design.halfLifeHoursUsed())
                .designType(design.designType())
                .power(design.power())
                .alpha(design.alpha())
                .delta(design.delta())
                .dropoutRate(design.dropoutRate())
                .screenFailRate(design.screenFailRate())
                .policyVersion(design.policyVersion())
                .explanation(design.explanation())
                .build();
    }

    static RuleOutcomeRecord toRecord(RuleOutcome outcome) {
        return new RuleOutcomeRecord(outcome.ruleId(), outcome.passed(), outcome.message());
    }

    private static ExtractedParameter toParameter(DrugParameter parameter) {
        return ExtractedParameter.builder()
                .kind(parameter.getKind())
                .value(parameter.getValue())
                .unit(parameter.getUnit())
                .sourceRef(parameter.getSourceRef())
                .sourceTitle(parameter.getSourceTitle())
                .reliable(parameter.isReliable())
                .build();
    }

    private static SearchSummary toSearchSummary(StudyProject project) {
        if (project.getDocumentsProcessed() == null) {
            return null;
        }
        return new SearchSummary(
                valueOrZero(project.getDocumentsFound()),
                valueOrZero(project.getDocumentsProcessed()),
                valueOrZero(project.getParametersAccepted()),
                valueOrZero(project.getCandidatesRejected()));
    }

    private static DesignResult toDesign(DesignRecord record) {
        if (record == null || record.getSampleSize() == null) {
            return null;
        }
        return DesignResult.builder()
                .sampleSize(record.getSampleSize())
                .subjectsPerSequence(valueOrZero(record.getSubjectsPerSequence()))
                .enrollmentWithDropout(valueOrZero(record.getEnrollmentWithDropout()))
                .enrollmentWithScreenFail(valueOrZero(record.getEnrollmentWithScreenFail()))
                .washoutDays(valueOrZero(record.getWashoutDays()))
                .washoutEstimated(Boolean.TRUE.equals(record.getWashoutEstimated()))
                .cvIntraUsed(record.getCvIntraUsed() == null ? 0.0 : record.getCvIntraUsed())
                .halfLifeHoursUsed(record.getHalfLifeHoursUsed())
                .designType(record.getDesignType())
                .power(record.getPower() == null ? 0.0 : record.getPower())
                .alpha(record.getAlpha() == null ? 0.0 : record.getAlpha())
                .delta(record.getDelta() == null ? 0.0 : record.getDelta())
                .dropoutRate(record.getDropoutRate() == null ? 0.0 : record.getDropoutRate())
                .screenFailRate(record.getScreenFailRate() == null ? 0.0 : record.getScreenFailRate())
                .policyVersion(record.getPolicyVersion())
                .explanation(record.getExplanation())
                .build();
    }

    private static RegulatoryVerdict toVerdict(StudyProject project) {
        if (project.getVerdictCompliant() == null) {
            return null;
        }
        return new RegulatoryVerdict(
                project.getVerdictCompliant(),
                project.getRuleOutcomes().stream()
                        .map(r -> new RuleOutcome(r.getRuleId(), r.isPassed(), r.getMessage()))
                        .toList(),
                project.getVerdictWarnings(),
                project.getVerdictRuleSetVersion());
    }

    private static ReportArtifact toReport(StudyProject project) {
        if (project.getReportArtifactRef() == null) {
            return null;
        }
        return new ReportArtifact(project.getReportArtifactRef(), project.getReportMediaType(), project.getReportGeneratedAt());
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }
}
