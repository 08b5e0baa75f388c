package com.gillianbc.finhealth.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers shared by the profile value types.
 */
public final class Amounts {

    private Amounts() {
    }

    /**
     * Absent amounts count as zero; negative amounts are rejected.
     */
    public static BigDecimal nonNegativeOrZero(BigDecimal value, String name) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return value;
    }

    public static BigDecimal sum(BigDecimal... values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal v : values) {
            total = total.add(v);
        }
        return total;
    }

    public static BigDecimal round2(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
