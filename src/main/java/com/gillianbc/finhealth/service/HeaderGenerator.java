package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.feedback.HeaderTemplates;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.Verdict;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Picks a header phrase for a feedback point. The random source is injected so tests can
 * seed it; {@link Random} is safe to share between threads.
 */
public class HeaderGenerator {

    private final Random random;

    public HeaderGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public String header(Metric metric) {
        return header(metric.getName(), metric.getVerdict());
    }

    public String header(MetricName metric, Verdict verdict) {
        Objects.requireNonNull(verdict, "verdict must not be null");
        return String.format(pick(pool(metric, verdict)), metric.displayName());
    }

    static List<String> pool(MetricName metric, Verdict verdict) {
        boolean good = verdict.isCommendable();
        if (metric.isRatio()) {
            if (good) {
                return HeaderTemplates.RATIO_GOOD;
            }
            return verdict.isBelowRange() ? HeaderTemplates.RATIO_LOW : HeaderTemplates.RATIO_HIGH;
        }
        return good ? HeaderTemplates.ADEQUACY_GOOD : HeaderTemplates.ADEQUACY_BAD;
    }

    private String pick(List<String> pool) {
        return pool.get(random.nextInt(pool.size()));
    }
}
