package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything derived from one {@link UserProfile}: the monthly and balance-sheet aggregates
 * that are reported as-is, and the twelve assessable {@link Metric}s.
 * <p>
 * Instances are immutable; pipeline stages use {@link #withMetrics(Map)} to produce the
 * next version.
 */
@Getter
@ToString
@EqualsAndHashCode
public class PersonalFinanceMetrics {

    private final CityTier cityTier;
    private final IncomeBracket incomeBracket;
    private final BigDecimal totalMonthlyIncome;
    private final BigDecimal totalMonthlyExpense;
    private final BigDecimal totalMonthlyInvestments;
    private final BigDecimal totalMonthlyEmi;
    private final BigDecimal totalAssets;
    private final BigDecimal totalLiabilities;
    private final BigDecimal targetRetirementCorpus;
    private final Map<String, BigDecimal> assetClassDistribution;
    private final Map<MetricName, Metric> metrics;

    @Builder(toBuilder = true)
    public PersonalFinanceMetrics(CityTier cityTier,
                                  IncomeBracket incomeBracket,
                                  BigDecimal totalMonthlyIncome,
                                  BigDecimal totalMonthlyExpense,
                                  BigDecimal totalMonthlyInvestments,
                                  BigDecimal totalMonthlyEmi,
                                  BigDecimal totalAssets,
                                  BigDecimal totalLiabilities,
                                  BigDecimal targetRetirementCorpus,
                                  Map<String, BigDecimal> assetClassDistribution,
                                  Map<MetricName, Metric> metrics) {
        this.cityTier = Objects.requireNonNull(cityTier, "cityTier must not be null");
        this.incomeBracket = Objects.requireNonNull(incomeBracket, "incomeBracket must not be null");
        this.totalMonthlyIncome = Objects.requireNonNull(totalMonthlyIncome, "totalMonthlyIncome must not be null");
        this.totalMonthlyExpense = Objects.requireNonNull(totalMonthlyExpense, "totalMonthlyExpense must not be null");
        this.totalMonthlyInvestments = Objects.requireNonNull(totalMonthlyInvestments, "totalMonthlyInvestments must not be null");
        this.totalMonthlyEmi = Objects.requireNonNull(totalMonthlyEmi, "totalMonthlyEmi must not be null");
        this.totalAssets = Objects.requireNonNull(totalAssets, "totalAssets must not be null");
        this.totalLiabilities = Objects.requireNonNull(totalLiabilities, "totalLiabilities must not be null");
        this.targetRetirementCorpus = Objects.requireNonNull(targetRetirementCorpus, "targetRetirementCorpus must not be null");
        this.assetClassDistribution = assetClassDistribution == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(assetClassDistribution));
        Map<MetricName, Metric> copy = new EnumMap<>(MetricName.class);
        if (metrics != null) {
            copy.putAll(metrics);
        }
        this.metrics = Collections.unmodifiableMap(copy);
    }

    public Metric metric(MetricName name) {
        return metrics.get(name);
    }

    /**
     * @return the assessable metrics in calculation order
     */
    public List<Metric> assessableMetrics() {
        return new ArrayList<>(metrics.values());
    }

    /**
     * @return total monthly expense plus EMI, the base for the reserve ratios
     */
    public BigDecimal totalMonthlyOutflow() {
        return totalMonthlyExpense.add(totalMonthlyEmi);
    }

    public PersonalFinanceMetrics withMetrics(Map<MetricName, Metric> replacements) {
        Map<MetricName, Metric> merged = new EnumMap<>(MetricName.class);
        merged.putAll(metrics);
        merged.putAll(replacements);
        return toBuilder().metrics(merged).build();
    }
}
