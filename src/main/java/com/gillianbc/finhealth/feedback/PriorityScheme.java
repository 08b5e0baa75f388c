package com.gillianbc.finhealth.feedback;

import com.gillianbc.finhealth.model.FeedbackPoint;
import com.gillianbc.finhealth.model.MetricName;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.gillianbc.finhealth.model.MetricName.ASSET_LIABILITY_RATIO;
import static com.gillianbc.finhealth.model.MetricName.DEBT_INCOME_RATIO;
import static com.gillianbc.finhealth.model.MetricName.EMERGENCY_FUND_RATIO;
import static com.gillianbc.finhealth.model.MetricName.EXPENSE_INCOME_RATIO;
import static com.gillianbc.finhealth.model.MetricName.HEALTH_INSURANCE_ADEQUACY;
import static com.gillianbc.finhealth.model.MetricName.INVESTMENT_INCOME_RATIO;
import static com.gillianbc.finhealth.model.MetricName.LIQUIDITY_RATIO;
import static com.gillianbc.finhealth.model.MetricName.NET_WORTH_ADEQUACY;
import static com.gillianbc.finhealth.model.MetricName.RETIREMENT_ADEQUACY;
import static com.gillianbc.finhealth.model.MetricName.SAVINGS_INCOME_RATIO;
import static com.gillianbc.finhealth.model.MetricName.TERM_INSURANCE_ADEQUACY;

/**
 * Which metrics matter most at each life stage. Feedback is listed in this order; metrics
 * the stage does not name follow, in their original order.
 */
public final class PriorityScheme {

    private static final List<MetricName> UNDER_30 = List.of(EMERGENCY_FUND_RATIO, EXPENSE_INCOME_RATIO,
            SAVINGS_INCOME_RATIO, DEBT_INCOME_RATIO, LIQUIDITY_RATIO, INVESTMENT_INCOME_RATIO);
    private static final List<MetricName> UNDER_45 = List.of(EMERGENCY_FUND_RATIO, HEALTH_INSURANCE_ADEQUACY,
            TERM_INSURANCE_ADEQUACY, SAVINGS_INCOME_RATIO, RETIREMENT_ADEQUACY);
    private static final List<MetricName> UNDER_60 = List.of(RETIREMENT_ADEQUACY, NET_WORTH_ADEQUACY,
            ASSET_LIABILITY_RATIO, LIQUIDITY_RATIO);
    private static final List<MetricName> FROM_60 = List.of(LIQUIDITY_RATIO, ASSET_LIABILITY_RATIO,
            EMERGENCY_FUND_RATIO);

    private PriorityScheme() {
    }

    public static List<MetricName> priorities(int age) {
        if (age < 30) {
            return UNDER_30;
        } else if (age < 45) {
            return UNDER_45;
        } else if (age < 60) {
            return UNDER_60;
        }
        return FROM_60;
    }

    /**
     * Stable sort of {@code points} by the priorities for {@code age}.
     */
    public static <T extends FeedbackPoint> List<T> sort(List<T> points, int age) {
        List<MetricName> order = priorities(age);
        List<T> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingInt(p -> rank(order, p.getMetricName())));
        return sorted;
    }

    private static int rank(List<MetricName> order, String metricName) {
        int index = MetricName.fromKey(metricName).map(order::indexOf).orElse(-1);
        return index < 0 ? order.size() : index;
    }
}
