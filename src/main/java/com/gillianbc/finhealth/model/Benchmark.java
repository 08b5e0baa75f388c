package com.gillianbc.finhealth.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Ideal (min, max) range for a metric.
 */
@Value
public class Benchmark {

    BigDecimal min;
    BigDecimal max;

    public Benchmark(BigDecimal min, BigDecimal max) {
        this.min = Objects.requireNonNull(min, "min must not be null");
        this.max = Objects.requireNonNull(max, "max must not be null");
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("benchmark min " + min + " must be <= max " + max);
        }
    }

    public static Benchmark of(String min, String max) {
        return new Benchmark(new BigDecimal(min), new BigDecimal(max));
    }

    public boolean contains(BigDecimal value) {
        return min.compareTo(value) <= 0 && value.compareTo(max) <= 0;
    }

    /**
     * @return "min - max", or "< max" for ranges that start at zero
     */
    public String describe() {
        if (min.signum() == 0) {
            return "< " + max.stripTrailingZeros().toPlainString();
        }
        return min.stripTrailingZeros().toPlainString() + " - " + max.stripTrailingZeros().toPlainString();
    }
}
