package com.gillianbc.finhealth.model;

/**
 * Seven-band classification of a metric against its benchmark, plus the two markers
 * used when a metric could not be classified.
 * <p>
 * GOOD covers both the band just below and the band just above the ideal range.
 */
public enum Verdict {

    EXTREMELY_LOW("extremely_low"),
    LOW("low"),
    GOOD("good"),
    EXCELLENT("excellent"),
    HIGH("high"),
    EXTREMELY_HIGH("extremely_high"),
    ERROR_COMPUTING_METRIC("error_computing_metric"),
    NO_BENCHMARK_PROVIDED("no_benchmark_provided");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String displayName() {
        return Labels.titleCase(label);
    }

    public boolean isCommendable() {
        return this == GOOD || this == EXCELLENT;
    }

    public boolean needsImprovement() {
        return this == EXTREMELY_LOW || this == LOW || this == HIGH || this == EXTREMELY_HIGH;
    }

    public boolean needsReview() {
        return this == HIGH || this == EXTREMELY_HIGH;
    }

    public boolean isBelowRange() {
        return this == EXTREMELY_LOW || this == LOW;
    }
}
