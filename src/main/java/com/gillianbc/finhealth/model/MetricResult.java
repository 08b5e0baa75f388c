package com.gillianbc.finhealth.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Outcome of one metric calculation: either a value or the error that prevented it.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MetricResult {

    private final BigDecimal value;
    private final MetricError error;

    public static MetricResult ok(BigDecimal value) {
        return new MetricResult(Objects.requireNonNull(value, "value must not be null"), null);
    }

    public static MetricResult failed(MetricError error) {
        return new MetricResult(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isOk() {
        return error == null;
    }
}
