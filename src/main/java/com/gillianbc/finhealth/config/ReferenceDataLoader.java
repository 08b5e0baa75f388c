package com.gillianbc.finhealth.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.finhealth.exception.InvalidConfigurationException;
import com.gillianbc.finhealth.model.Benchmark;
import com.gillianbc.finhealth.model.CityTier;
import com.gillianbc.finhealth.model.IncomeBracket;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Reads the static JSON reference data from the classpath.
 * <p>
 * Benchmark entries are either {@code [min, max]} or
 * {@code {"Tier 1": {"IG1": [min, max], ...}, ...}}.
 */
@Slf4j
public final class ReferenceDataLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ReferenceDataLoader() {
    }

    public static BenchmarkTable loadBenchmarkTable(String resource) {
        JsonNode root = readTree(resource);
        BenchmarkTable.Builder builder = BenchmarkTable.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String metric = entry.getKey();
            JsonNode ideal = entry.getValue();
            if (ideal.isArray()) {
                builder.flat(metric, toBenchmark(metric, ideal));
            } else if (ideal.isObject()) {
                readTiered(builder, metric, ideal);
            } else {
                throw new InvalidConfigurationException("Benchmark for '" + metric + "' in " + resource
                        + " must be a [min, max] pair or a tier map");
            }
        }
        BenchmarkTable table = builder.build();
        log.info("Loaded benchmarks for {} metrics from {}", table.metrics().size(), resource);
        return table;
    }

    public static CityTierDirectory loadCityTiers(String resource) {
        JsonNode root = readTree(resource);
        Set<String> tier1 = toNameSet(resource, root.get("tier1"));
        Set<String> tier2 = toNameSet(resource, root.get("tier2"));
        log.info("Loaded {} tier 1 and {} tier 2 cities from {}", tier1.size(), tier2.size(), resource);
        return new CityTierDirectory(tier1, tier2);
    }

    public static Map<String, Object> loadGlossary(String resource) {
        try (InputStream in = open(resource)) {
            return Map.copyOf(MAPPER.readValue(in, new TypeReference<Map<String, Object>>() {
            }));
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read glossary " + resource, e);
        }
    }

    private static void readTiered(BenchmarkTable.Builder builder, String metric, JsonNode byTier) {
        for (CityTier tier : CityTier.values()) {
            JsonNode byBracket = byTier.get(tier.key());
            if (byBracket == null) {
                throw new InvalidConfigurationException("Benchmark for '" + metric + "' has no entry for " + tier.key());
            }
            for (IncomeBracket bracket : IncomeBracket.values()) {
                JsonNode pair = byBracket.get(bracket.name());
                if (pair == null) {
                    throw new InvalidConfigurationException("Benchmark for '" + metric + "' has no entry for "
                            + tier.key() + " / " + bracket);
                }
                builder.tiered(metric, tier, bracket, toBenchmark(metric, pair));
            }
        }
    }

    private static Benchmark toBenchmark(String metric, JsonNode pair) {
        if (!pair.isArray() || pair.size() != 2 || !pair.get(0).isNumber() || !pair.get(1).isNumber()) {
            throw new InvalidConfigurationException("Benchmark for '" + metric + "' must be a [min, max] pair of numbers");
        }
        BigDecimal min = pair.get(0).decimalValue();
        BigDecimal max = pair.get(1).decimalValue();
        if (min.compareTo(max) > 0) {
            throw new InvalidConfigurationException("Benchmark for '" + metric + "' has min " + min + " above max " + max);
        }
        return new Benchmark(min, max);
    }

    private static Set<String> toNameSet(String resource, JsonNode names) {
        if (names == null || !names.isArray()) {
            throw new InvalidConfigurationException("City tier data " + resource + " must have 'tier1' and 'tier2' arrays");
        }
        Set<String> result = new HashSet<>();
        names.forEach(n -> result.add(n.asText()));
        return result;
    }

    private static JsonNode readTree(String resource) {
        try (InputStream in = open(resource)) {
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Cannot read reference data " + resource, e);
        }
    }

    private static InputStream open(String resource) {
        InputStream in = ReferenceDataLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new InvalidConfigurationException("Reference data " + resource + " not found on the classpath");
        }
        return in;
    }
}
