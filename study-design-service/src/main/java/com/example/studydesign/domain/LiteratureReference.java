package com.example.studydesign.domain;

/**
 * Document returned by the literature search collaborator.
 *
 * @param sourceRef citation identifier, e.g. {@code PMID:31234567}
 * @param title     document title, may be empty
 */
public record LiteratureReference(String sourceRef, String title) {
}
