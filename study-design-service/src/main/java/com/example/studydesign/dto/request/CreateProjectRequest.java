package com.example.studydesign.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for starting a study design project.
 * Drug identification is required; assumptions and manual parameters are optional.
 */
public record CreateProjectRequest(

    @NotBlank(message = "International nonproprietary name is required")
    @Size(max = 200, message = "INN must not exceed 200 characters")
    String innEn,

    @Size(max = 200, message = "Localized INN must not exceed 200 characters")
    String innRu,

    @NotBlank(message = "Dosage is required")
    @Size(max = 100, message = "Dosage must not exceed 100 characters")
    String dosage,

    @NotBlank(message = "Dosage form is required")
    @Size(max = 200, message = "Dosage form must not exceed 200 characters")
    String dosageForm,

    @Size(max = 10, message = "At most 10 additional substances are allowed")
    List<@NotBlank(message = "Additional substance must not be blank") String> additionalSubstances,

    StudyAssumptionsRequest assumptions,

    @Size(max = 50, message = "At most 50 manual parameters are allowed")
    List<@Valid ManualParameterRequest> manualParameters
) {}
