package com.gillianbc.finhealth.config;

import com.gillianbc.finhealth.model.Benchmark;
import com.gillianbc.finhealth.model.CityTier;
import com.gillianbc.finhealth.model.IncomeBracket;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only ideal ranges per metric. A metric either has one flat range or a range per
 * city tier and income bracket. Built once at startup and shared between analyses.
 */
public final class BenchmarkTable {

    private final Map<String, Benchmark> flat;
    private final Map<String, Map<CityTier, Map<IncomeBracket, Benchmark>>> tiered;

    private BenchmarkTable(Map<String, Benchmark> flat,
                           Map<String, Map<CityTier, Map<IncomeBracket, Benchmark>>> tiered) {
        this.flat = flat;
        this.tiered = tiered;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the range for this segment, or empty when the metric (or its segment) is not in the table
     */
    public Optional<Benchmark> lookup(String metric, CityTier tier, IncomeBracket bracket) {
        Benchmark flatRange = flat.get(metric);
        if (flatRange != null) {
            return Optional.of(flatRange);
        }
        Map<CityTier, Map<IncomeBracket, Benchmark>> byTier = tiered.get(metric);
        if (byTier == null || tier == null || bracket == null) {
            return Optional.empty();
        }
        Map<IncomeBracket, Benchmark> byBracket = byTier.get(tier);
        return byBracket == null ? Optional.empty() : Optional.ofNullable(byBracket.get(bracket));
    }

    public boolean isTiered(String metric) {
        return tiered.containsKey(metric);
    }

    public Set<String> metrics() {
        Set<String> names = new LinkedHashSet<>(flat.keySet());
        names.addAll(tiered.keySet());
        return Collections.unmodifiableSet(names);
    }

    public static final class Builder {
        private final Map<String, Benchmark> flat = new LinkedHashMap<>();
        private final Map<String, Map<CityTier, Map<IncomeBracket, Benchmark>>> tiered = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder flat(String metric, Benchmark range) {
            flat.put(metric, range);
            return this;
        }

        public Builder tiered(String metric, CityTier tier, IncomeBracket bracket, Benchmark range) {
            tiered.computeIfAbsent(metric, k -> new EnumMap<>(CityTier.class))
                    .computeIfAbsent(tier, k -> new EnumMap<>(IncomeBracket.class))
                    .put(bracket, range);
            return this;
        }

        public BenchmarkTable build() {
            Map<String, Map<CityTier, Map<IncomeBracket, Benchmark>>> frozen = new LinkedHashMap<>();
            tiered.forEach((metric, byTier) -> {
                Map<CityTier, Map<IncomeBracket, Benchmark>> tiers = new EnumMap<>(CityTier.class);
                byTier.forEach((tier, byBracket) ->
                        tiers.put(tier, Collections.unmodifiableMap(new EnumMap<>(byBracket))));
                frozen.put(metric, Collections.unmodifiableMap(tiers));
            });
            return new BenchmarkTable(Collections.unmodifiableMap(new LinkedHashMap<>(flat)),
                    Collections.unmodifiableMap(frozen));
        }
    }
}
