package com.example.studydesign.dto.mapper;

import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;
import com.example.studydesign.domain.ParameterKind;
import com.example.studydesign.domain.ProjectSnapshot;
import com.example.studydesign.domain.RegulatoryVerdict;
import com.example.studydesign.domain.ReportArtifact;
import com.example.studydesign.domain.StudyAssumptions;
import com.example.studydesign.dto.request.CreateProjectRequest;
import com.example.studydesign.dto.request.ManualParameterRequest;
import com.example.studydesign.dto.response.DesignResponse;
import com.example.studydesign.dto.response.ParameterResponse;
import com.example.studydesign.dto.response.ProjectResponse;
import com.example.studydesign.dto.response.ReportResponse;
import com.example.studydesign.dto.response.StartProjectResponse;
import com.example.studydesign.dto.response.VerdictResponse;
import com.example.studydesign.exception.InvalidDesignInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between HTTP DTOs and domain records.
 */
public final class ProjectResponseMapper {

    private static final String PERCENT = "%";
    private static final String HOURS = "h";

    private ProjectResponseMapper() {
    }

    public static DrugIdentifier toDrug(CreateProjectRequest request) {
        return new DrugIdentifier(
            request.innEn().trim(),
            request.innRu(),
            request.dosage().trim(),
            request.dosageForm().trim(),
            request.additionalSubstances());
    }

    public static StudyAssumptions toAssumptions(CreateProjectRequest request) {
        return request.assumptions() == null
            ? StudyAssumptions.defaults()
            : request.assumptions().toDomain();
    }

    /**
     * Manual observations are marked reliable; unknown kinds are rejected with the offending index.
     */
    public static List<ExtractedParameter> toManualParameters(List<ManualParameterRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        List<ExtractedParameter> parameters = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ManualParameterRequest request = requests.get(i);
            String field = "manualParameters[" + i + "].kind";
            ParameterKind kind = ParameterKind.fromName(request.kind())
                .orElseThrow(() -> new InvalidDesignInputException(field,
                    "Unknown parameter kind '" + request.kind() + "'"));
            parameters.add(ExtractedParameter.builder()
                .kind(kind)
                .value(request.value())
                .unit(request.unit() == null || request.unit().isBlank() ? defaultUnit(kind) : request.unit().trim())
                .sourceRef(ExtractedParameter.MANUAL_SOURCE)
                .sourceTitle(request.sourceTitle())
                .reliable(true)
                .build());
        }
        return parameters;
    }

    public static StartProjectResponse toStartResponse(ProjectSnapshot snapshot, String message) {
        return StartProjectResponse.builder()
            .projectId(snapshot.id())
            .status(snapshot.status())
            .attempt(snapshot.attempt())
            .message(message)
            .build();
    }

    public static ProjectResponse toResponse(ProjectSnapshot snapshot) {
        DrugIdentifier drug = snapshot.drug();
        StudyAssumptions assumptions = snapshot.assumptions();
        return ProjectResponse.builder()
            .id(snapshot.id())
            .status(snapshot.status())
            .statusMessage(snapshot.statusMessage())
            .attempt(snapshot.attempt())
            .drug(new ProjectResponse.Drug(drug.innEn(), drug.innRu(), drug.dosage(), drug.dosageForm(),
                drug.additionalSubstances()))
            .assumptions(new ProjectResponse.Assumptions(assumptions.power(), assumptions.alpha(),
                assumptions.delta(), assumptions.dropoutRate(), assumptions.screenFailRate()))
            .parameters(snapshot.parameters().stream().map(ProjectResponseMapper::toResponse).toList())
            .searchSummary(snapshot.searchSummary())
            .design(snapshot.design() == null ? null : toResponse(snapshot.design()))
            .verdict(snapshot.verdict() == null ? null : toResponse(snapshot.verdict()))
            .report(snapshot.report() == null ? null : toResponse(snapshot.report()))
            .createdAt(snapshot.createdAt())
            .updatedAt(snapshot.updatedAt())
            .build();
    }

    public static ParameterResponse toResponse(ExtractedParameter parameter) {
        return ParameterResponse.builder()
            .kind(parameter.kind().label())
            .value(parameter.value())
            .unit(parameter.unit())
            .sourceRef(parameter.sourceRef())
            .sourceTitle(parameter.sourceTitle())
            .reliable(parameter.reliable())
            .build();
    }

    public static DesignResponse toResponse(DesignResult design) {
        return DesignResponse.builder()
            .designType(design.designType().name())
            .designLabel(design.designType().label())
            .periods(design.designType().periods())
            .randomizationScheme(design.randomizationScheme())
            .sampleSize(design.sampleSize())
            .subjectsPerSequence(design.subjectsPerSequence())
            .enrollmentWithDropout(design.enrollmentWithDropout())
            .enrollmentWithScreenFail(design.enrollmentWithScreenFail())
            .washoutDays(design.washoutDays())
            .washoutEstimated(design.washoutEstimated())
            .cvIntraUsed(design.cvIntraUsed())
            .halfLifeHoursUsed(design.halfLifeHoursUsed())
            .power(design.power())
            .alpha(design.alpha())
            .delta(design.delta())
            .dropoutRate(design.dropoutRate())
            .screenFailRate(design.screenFailRate())
            .policyVersion(design.policyVersion())
            .explanation(design.explanation())
            .build();
    }

    public static VerdictResponse toResponse(RegulatoryVerdict verdict) {
        return VerdictResponse.builder()
            .compliant(verdict.compliant())
            .rules(verdict.outcomes().stream()
                .map(outcome -> new VerdictResponse.RuleResult(outcome.ruleId(), outcome.passed(), outcome.message()))
                .toList())
            .warnings(verdict.warnings())
            .ruleSetVersion(verdict.ruleSetVersion())
            .build();
    }

    public static ReportResponse toResponse(ReportArtifact report) {
        return ReportResponse.builder()
            .artifactRef(report.artifactRef())
            .mediaType(report.mediaType())
            .generatedAt(report.generatedAt())
            .build();
    }

    private static String defaultUnit(ParameterKind kind) {
        return switch (kind) {
            case CV_INTRA -> PERCENT;
            case HALF_LIFE, TMAX -> HOURS;
            case CMAX -> "ng/mL";
            case AUC -> "ng*h/mL";
        };
    }
}
