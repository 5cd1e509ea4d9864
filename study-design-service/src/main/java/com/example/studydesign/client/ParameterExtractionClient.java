package com.example.studydesign.client;

import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.ExtractedParameter;

import java.util.List;

/**
 * Extracts pharmacokinetic parameter candidates from free text.
 *
 * Candidates carry no provenance and are not validated; the caller attaches the source and
 * filters implausible values.
 */
public interface ParameterExtractionClient {

    String NAME = "parameterExtraction";

    List<ExtractedParameter> extract(String documentText, DrugIdentifier drug);
}
