package com.gillianbc.finhealth.model;

import java.math.BigDecimal;

/**
 * Seven contiguous half-open monthly income bands in INR: [0, 80k), [80k, 150k) ... [800k, inf).
 */
public enum IncomeBracket {

    IG1(new BigDecimal("80000")),
    IG2(new BigDecimal("150000")),
    IG3(new BigDecimal("250000")),
    IG4(new BigDecimal("350000")),
    IG5(new BigDecimal("500000")),
    IG6(new BigDecimal("800000")),
    IG7(null);

    private final BigDecimal upperBoundExclusive;

    IncomeBracket(BigDecimal upperBoundExclusive) {
        this.upperBoundExclusive = upperBoundExclusive;
    }

    /**
     * @return exclusive upper bound, or null for the open-ended top bracket
     */
    public BigDecimal upperBoundExclusive() {
        return upperBoundExclusive;
    }
}
