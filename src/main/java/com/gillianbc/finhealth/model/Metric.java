package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.math.BigDecimal;

/**
 * One assessable metric as it moves through the pipeline. Each stage returns a copy with
 * its own field filled in: benchmark, then verdict, then weight and assigned score.
 * <p>
 * A metric that failed to compute has a null value and a non-null error; it is always
 * classified as {@link Verdict#ERROR_COMPUTING_METRIC} and scores 0.
 */
@Value
@With
@Builder(toBuilder = true)
public class Metric {

    MetricName name;
    BigDecimal value;
    MetricError error;
    Benchmark benchmark;
    Verdict verdict;
    int weight;
    BigDecimal assignedScore;

    public static Metric of(MetricName name, MetricResult result) {
        return Metric.builder()
                .name(name)
                .value(result.getValue())
                .error(result.getError())
                .build();
    }

    public boolean hasError() {
        return error != null || value == null;
    }

    public boolean hasBenchmark() {
        return benchmark != null;
    }
}
