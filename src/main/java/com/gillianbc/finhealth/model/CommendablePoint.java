package com.gillianbc.finhealth.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommendablePoint extends FeedbackPoint {

    public CommendablePoint(String metricName, String header, String currentScenario) {
        super(metricName, header, currentScenario);
    }
}
