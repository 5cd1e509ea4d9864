package com.example.studydesign.domain;

import java.util.List;

/**
 * Crossover scheme of the planned study.
 */
public enum DesignType {

    /** Two-period, two-sequence crossover (TR/RT). */
    STANDARD_2X2_CROSSOVER("2x2 crossover", 2, List.of("TR", "RT")),

    /** Two-sequence, four-period full replicate (TRTR/RTRT) for highly variable drugs. */
    REPLICATE("2x2x4 replicate", 4, List.of("TRTR", "RTRT"));

    private final String label;
    private final int periods;
    private final List<String> sequences;

    DesignType(String label, int periods, List<String> sequences) {
        this.label = label;
        this.periods = periods;
        this.sequences = sequences;
    }

    public String label() {
        return label;
    }

    public int periods() {
        return periods;
    }

    public List<String> sequences() {
        return sequences;
    }

    public String randomizationScheme() {
        return String.join("/", sequences);
    }
}
