package com.example.studydesign.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Pharmacokinetic parameter kinds tracked per project.
 */
public enum ParameterKind {

    CMAX("Cmax"),
    AUC("AUC"),
    HALF_LIFE("T1/2"),
    CV_INTRA("CV_intra"),
    TMAX("Tmax");

    private static final Map<String, ParameterKind> ALIASES = Map.ofEntries(
            Map.entry("cmax", CMAX),
            Map.entry("c_max", CMAX),
            Map.entry("peak_concentration", CMAX),
            Map.entry("auc", AUC),
            Map.entry("auc0-t", AUC),
            Map.entry("auc0-inf", AUC),
            Map.entry("t1/2", HALF_LIFE),
            Map.entry("t1_2", HALF_LIFE),
            Map.entry("t_half", HALF_LIFE),
            Map.entry("half_life", HALF_LIFE),
            Map.entry("half-life", HALF_LIFE),
            Map.entry("cv_intra", CV_INTRA),
            Map.entry("cvintra", CV_INTRA),
            Map.entry("intra_subject_cv", CV_INTRA),
            Map.entry("intrasubject_cv", CV_INTRA),
            Map.entry("within_subject_cv", CV_INTRA),
            Map.entry("withinsubject_cv", CV_INTRA),
            Map.entry("tmax", TMAX),
            Map.entry("t_max", TMAX));

    private final String label;

    ParameterKind(String label) {
        this.label = label;
    }

    /**
     * Label used in extraction prompts and reports.
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a free-form parameter name ("T1/2", "within subject CV", "CV_INTRA") to a kind.
     */
    public static Optional<ParameterKind> fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        ParameterKind alias = ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        for (ParameterKind kind : values()) {
            if (kind.name().equalsIgnoreCase(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
