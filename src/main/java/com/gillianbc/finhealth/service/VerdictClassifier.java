package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.model.Benchmark;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Seven-band classification of a metric value against its benchmark {@code [lo, hi]}.
 * <pre>
 *   value &lt; lo * lowStage2           extremely_low
 *   value &lt; lo * lowStage1           low
 *   value &lt; lo                       good
 *   lo &lt;= value &lt; hi                 excellent
 *   value &lt; hi * highStage1          good
 *   value &lt; hi * highStage2          high
 *   otherwise                         extremely_high
 * </pre>
 * A value equal to {@code hi} is therefore GOOD, not EXCELLENT.
 */
@Slf4j
@Service
public class VerdictClassifier {

    private final FinanceHealthProperties.Relaxation relaxation;

    public VerdictClassifier(FinanceHealthProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.relaxation = Objects.requireNonNull(properties.getRelaxation(), "relaxation must not be null");
    }

    public Verdict classify(BigDecimal value, Benchmark benchmark) {
        if (value == null) {
            return Verdict.ERROR_COMPUTING_METRIC;
        }
        if (benchmark == null) {
            return Verdict.NO_BENCHMARK_PROVIDED;
        }
        BigDecimal lo = benchmark.getMin();
        BigDecimal hi = benchmark.getMax();
        if (value.compareTo(lo.multiply(relaxation.getLowStage2())) < 0) {
            return Verdict.EXTREMELY_LOW;
        } else if (value.compareTo(lo.multiply(relaxation.getLowStage1())) < 0) {
            return Verdict.LOW;
        } else if (value.compareTo(lo) < 0) {
            return Verdict.GOOD;
        } else if (value.compareTo(hi) < 0) {
            return Verdict.EXCELLENT;
        } else if (value.compareTo(hi.multiply(relaxation.getHighStage1())) < 0) {
            return Verdict.GOOD;
        } else if (value.compareTo(hi.multiply(relaxation.getHighStage2())) < 0) {
            return Verdict.HIGH;
        }
        return Verdict.EXTREMELY_HIGH;
    }

    public Metric classify(Metric metric) {
        Verdict verdict = metric.hasError()
                ? Verdict.ERROR_COMPUTING_METRIC
                : classify(metric.getValue(), metric.getBenchmark());
        log.debug("{} = {} against {} -> {}", metric.getName().key(), metric.getValue(), metric.getBenchmark(), verdict.label());
        return metric.withVerdict(verdict);
    }

    public PersonalFinanceMetrics classifyAll(PersonalFinanceMetrics pfm) {
        Map<MetricName, Metric> updated = new EnumMap<>(MetricName.class);
        pfm.assessableMetrics().forEach(m -> updated.put(m.getName(), classify(m)));
        return pfm.withMetrics(updated);
    }
}
