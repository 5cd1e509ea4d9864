package com.example.studydesign.client;

import com.example.studydesign.domain.DrugIdentifier;
import com.example.studydesign.domain.LiteratureReference;

import java.util.List;

/**
 * Bibliographic search collaborator.
 *
 * Implementations signal unavailability through {@link com.example.studydesign.service.FallbackSignal}
 * and return an empty result; an empty result without the signal means nothing was found.
 */
public interface LiteratureSearchClient {

    String NAME = "literatureSearch";

    List<LiteratureReference> search(DrugIdentifier drug, int maxResults);

    /**
     * Abstract or full text of one document; empty when the document has no text.
     */
    String fetchDocumentText(LiteratureReference reference);
}
