package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.model.Benchmark;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a classified metric and its weight into points, {@code 0 <= points <= weight}.
 * <p>
 * Inside the benchmark the full weight is awarded. Above it, a fixed share of the weight is
 * awarded when over-performance is rewarded. Otherwise the score follows a cubic decay
 * {@code weight * (base + (1 - base) * ratio)^3} where {@code ratio} is {@code value / lo}
 * below the range and {@code hi / value} above it, clamped to [0, 1].
 * <p>
 * Weights are used as given; see {@link WeightNormalizer} for making them sum to 100.
 */
@Slf4j
@Service
public class Scorer {

    private static final MathContext MATH_CONTEXT = new MathContext(12, RoundingMode.HALF_UP);

    private final BigDecimal base;
    private final boolean rewardOverPerformance;
    private final BigDecimal overPerformanceFactor;

    public Scorer(FinanceHealthProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.base = properties.getScoringBaseValue();
        this.rewardOverPerformance = properties.isRewardOverPerformance();
        this.overPerformanceFactor = properties.getOverPerformanceFactor();
        if (base.signum() < 0 || base.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("scoringBaseValue must be within [0, 1]");
        }
        if (overPerformanceFactor.signum() < 0 || overPerformanceFactor.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("overPerformanceFactor must be within [0, 1]");
        }
    }

    /**
     * @return points for {@code metric} out of {@code weight}, rounded to 2 decimal places
     */
    public BigDecimal score(Metric metric, int weight) {
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
        Benchmark benchmark = metric.getBenchmark();
        if (weight == 0 || metric.hasError() || benchmark == null) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal maxScore = BigDecimal.valueOf(weight);
        BigDecimal value = metric.getValue();
        if (benchmark.contains(value)) {
            return maxScore.setScale(2, RoundingMode.HALF_UP);
        }
        boolean above = value.compareTo(benchmark.getMax()) > 0;
        if (above && rewardOverPerformance) {
            return maxScore.multiply(overPerformanceFactor).setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal ratio = above
                ? safeRatio(benchmark.getMax(), value)
                : safeRatio(value, benchmark.getMin());
        BigDecimal factor = base.add(BigDecimal.ONE.subtract(base).multiply(ratio)).pow(3, MATH_CONTEXT);
        return maxScore.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Sets weight and assigned score on every metric. Metrics missing from {@code weights} get weight 0.
     */
    public PersonalFinanceMetrics scoreAll(PersonalFinanceMetrics pfm, Map<MetricName, Integer> weights) {
        Objects.requireNonNull(weights, "weights must not be null");
        Map<MetricName, Metric> updated = new EnumMap<>(MetricName.class);
        for (Metric metric : pfm.assessableMetrics()) {
            int weight = weights.getOrDefault(metric.getName(), 0);
            BigDecimal points = score(metric, weight);
            log.debug("{} scored {} of {}", metric.getName().key(), points, weight);
            updated.put(metric.getName(), metric.withWeight(weight).withAssignedScore(points));
        }
        return pfm.withMetrics(updated);
    }

    // numerator / denominator clamped to [0, 1]; 0 when the denominator is not positive
    private static BigDecimal safeRatio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal ratio = numerator.divide(denominator, MATH_CONTEXT);
        if (ratio.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return ratio.min(BigDecimal.ONE);
    }
}
