package com.gillianbc.finhealth.model;

import lombok.Value;

/**
 * Why a metric could not be computed, e.g. a zero denominator.
 */
@Value
public class MetricError {

    String metric;
    String erringParameter;

    public String getMessage() {
        return "Cannot compute '" + metric + "' due to invalid (possibly zero) value of '" + erringParameter + "'.";
    }
}
