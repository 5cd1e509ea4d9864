package com.example.studydesign.client;

import com.example.studydesign.domain.DesignResult;
import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.RegulatoryVerdict;
import com.example.studydesign.domain.ReportArtifact;

/**
 * Renders a study synopsis document.
 */
public interface ReportRenderer {

    String NAME = "reportRendering";

    /**
     * @throws com.example.studydesign.exception.CollaboratorUnavailableException when rendering fails
     */
    ReportArtifact render(DesignResult design, RegulatoryVerdict verdict, DrugIdentifier drug);
}
