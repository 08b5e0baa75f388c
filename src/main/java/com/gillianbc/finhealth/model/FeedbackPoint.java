package com.gillianbc.finhealth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * A single piece of structured feedback about one metric.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class FeedbackPoint {

    private final String metricName;
    private final String header;
    private final String currentScenario;

    protected FeedbackPoint(String metricName, String header, String currentScenario) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.header = Objects.requireNonNull(header, "header must not be null");
        this.currentScenario = Objects.requireNonNull(currentScenario, "currentScenario must not be null");
    }
}
