package com.gillianbc.finhealth.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * A metric well above its range that may be intentional, so the user is asked to review it
 * rather than told to change it.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ReviewPoint extends FeedbackPoint {

    public ReviewPoint(String metricName, String header, String currentScenario) {
        super(metricName, header, currentScenario);
    }
}
