package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.config.BenchmarkTable;
import com.gillianbc.finhealth.model.Benchmark;
import com.gillianbc.finhealth.model.CityTier;
import com.gillianbc.finhealth.model.IncomeBracket;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
public class BenchmarkResolver {

    private final BenchmarkTable table;

    public BenchmarkResolver(BenchmarkTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /**
     * Never throws. An empty result means the metric has no benchmark for this segment,
     * which downstream becomes {@code no_benchmark_provided}.
     */
    public Optional<Benchmark> resolve(String metricName, CityTier tier, IncomeBracket bracket) {
        if (metricName == null) {
            return Optional.empty();
        }
        return table.lookup(metricName, tier, bracket);
    }

    public Optional<Benchmark> resolve(MetricName metric, CityTier tier, IncomeBracket bracket) {
        return resolve(metric.key(), tier, bracket);
    }

    /**
     * @return a copy of {@code pfm} with each metric's benchmark set (or left null when none applies)
     */
    public PersonalFinanceMetrics attachBenchmarks(PersonalFinanceMetrics pfm) {
        Map<MetricName, Metric> updated = new EnumMap<>(MetricName.class);
        for (Metric metric : pfm.assessableMetrics()) {
            Benchmark benchmark = resolve(metric.getName(), pfm.getCityTier(), pfm.getIncomeBracket()).orElse(null);
            if (benchmark == null) {
                log.warn("No benchmark for {} in {} / {}", metric.getName().key(), pfm.getCityTier().key(), pfm.getIncomeBracket());
            }
            updated.put(metric.getName(), metric.withBenchmark(benchmark));
        }
        return pfm.withMetrics(updated);
    }
}
