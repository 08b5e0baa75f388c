package com.gillianbc.finhealth.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The twelve assessable metrics, in the order they are calculated and reported.
 */
public enum MetricName {

    SAVINGS_INCOME_RATIO("savings_income_ratio"),
    INVESTMENT_INCOME_RATIO("investment_income_ratio"),
    EXPENSE_INCOME_RATIO("expense_income_ratio"),
    DEBT_INCOME_RATIO("debt_income_ratio"),
    EMERGENCY_FUND_RATIO("emergency_fund_ratio"),
    LIQUIDITY_RATIO("liquidity_ratio"),
    ASSET_LIABILITY_RATIO("asset_liability_ratio"),
    HOUSING_INCOME_RATIO("housing_income_ratio"),
    HEALTH_INSURANCE_ADEQUACY("health_insurance_adequacy"),
    TERM_INSURANCE_ADEQUACY("term_insurance_adequacy"),
    NET_WORTH_ADEQUACY("net_worth_adequacy"),
    RETIREMENT_ADEQUACY("retirement_adequacy");

    private final String key;

    MetricName(String key) {
        this.key = key;
    }

    /**
     * @return snake_case identifier used in weight maps, benchmark data and feedback points
     */
    public String key() {
        return key;
    }

    public boolean isRatio() {
        return key.endsWith("ratio");
    }

    public boolean isAdequacy() {
        return key.endsWith("adequacy");
    }

    /**
     * @return e.g. "Savings Income Ratio"
     */
    public String displayName() {
        return Labels.titleCase(key);
    }

    /**
     * Lenient lookup: accepts "savings_income_ratio", "Savings Income Ratio" or "savings-income-ratio".
     */
    public static Optional<MetricName> fromKey(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase().replace('-', '_').replace(' ', '_');
        return Arrays.stream(values()).filter(m -> m.key.equals(normalized)).findFirst();
    }
}
