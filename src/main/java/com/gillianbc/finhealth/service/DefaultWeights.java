package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.model.MetricName;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Weights used when the caller supplies none. They sum to 100.
 */
public final class DefaultWeights {

    private static final Map<MetricName, Integer> WEIGHTS;

    static {
        Map<MetricName, Integer> w = new EnumMap<>(MetricName.class);
        w.put(MetricName.SAVINGS_INCOME_RATIO, 12);
        w.put(MetricName.INVESTMENT_INCOME_RATIO, 10);
        w.put(MetricName.EXPENSE_INCOME_RATIO, 8);
        w.put(MetricName.DEBT_INCOME_RATIO, 10);
        w.put(MetricName.EMERGENCY_FUND_RATIO, 10);
        w.put(MetricName.LIQUIDITY_RATIO, 5);
        w.put(MetricName.ASSET_LIABILITY_RATIO, 5);
        w.put(MetricName.HOUSING_INCOME_RATIO, 5);
        w.put(MetricName.HEALTH_INSURANCE_ADEQUACY, 10);
        w.put(MetricName.TERM_INSURANCE_ADEQUACY, 10);
        w.put(MetricName.NET_WORTH_ADEQUACY, 5);
        w.put(MetricName.RETIREMENT_ADEQUACY, 10);
        WEIGHTS = Collections.unmodifiableMap(w);
    }

    private DefaultWeights() {
    }

    public static Map<MetricName, Integer> weights() {
        return WEIGHTS;
    }
}
