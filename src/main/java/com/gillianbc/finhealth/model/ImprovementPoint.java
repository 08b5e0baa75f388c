package com.gillianbc.finhealth.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ImprovementPoint extends FeedbackPoint {

    private final String actionable;

    public ImprovementPoint(String metricName, String header, String currentScenario, String actionable) {
        super(metricName, header, currentScenario);
        this.actionable = Objects.requireNonNull(actionable, "actionable must not be null");
    }
}
