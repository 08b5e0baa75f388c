package com.gillianbc.finhealth.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Makes an arbitrary map of metric weights sum to exactly 100.
 * <p>
 * Negative weights are clipped to 0, the rest scaled to 100 and floored. The shortfall is
 * handed out one point at a time to the largest fractional remainders; equal remainders go
 * to the key that comes first in the input's iteration order. When every weight is 0 the
 * 100 points are split evenly.
 */
@Slf4j
@Service
public class WeightNormalizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 10;

    public Map<String, Integer> normalize(Map<String, ? extends Number> rawWeights) {
        Objects.requireNonNull(rawWeights, "rawWeights must not be null");
        if (rawWeights.isEmpty()) {
            throw new IllegalArgumentException("At least one weight is required");
        }
        List<String> keys = new ArrayList<>(rawWeights.keySet());
        Map<String, BigDecimal> clipped = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (String key : keys) {
            BigDecimal w = toDecimal(key, rawWeights.get(key)).max(BigDecimal.ZERO);
            clipped.put(key, w);
            total = total.add(w);
        }

        if (total.signum() == 0) {
            log.warn("All {} weights are zero, splitting 100 points evenly", keys.size());
            return evenSplit(keys);
        }

        Map<String, Integer> floors = new LinkedHashMap<>();
        Map<String, BigDecimal> remainders = new LinkedHashMap<>();
        int allotted = 0;
        for (String key : keys) {
            BigDecimal scaled = clipped.get(key).multiply(HUNDRED).divide(total, SCALE, RoundingMode.HALF_UP);
            BigDecimal floor = scaled.setScale(0, RoundingMode.FLOOR);
            floors.put(key, floor.intValueExact());
            remainders.put(key, scaled.subtract(floor));
            allotted += floor.intValueExact();
        }

        int shortfall = 100 - allotted;
        // List.sort is stable, so equal remainders keep key order
        List<String> byRemainder = new ArrayList<>(keys);
        byRemainder.sort(Comparator.comparing(remainders::get, Comparator.reverseOrder()));
        for (int i = 0; i < shortfall; i++) {
            String key = byRemainder.get(i % byRemainder.size());
            floors.put(key, floors.get(key) + 1);
        }
        return floors;
    }

    private static Map<String, Integer> evenSplit(List<String> keys) {
        Map<String, Integer> result = new LinkedHashMap<>();
        int share = 100 / keys.size();
        int extra = 100 % keys.size();
        for (int i = 0; i < keys.size(); i++) {
            result.put(keys.get(i), share + (i < extra ? 1 : 0));
        }
        return result;
    }

    private static BigDecimal toDecimal(String key, Number weight) {
        if (weight == null) {
            return BigDecimal.ZERO;
        }
        if (weight instanceof BigDecimal) {
            return (BigDecimal) weight;
        }
        double d = weight.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("Weight for '" + key + "' must be a finite number");
        }
        return new BigDecimal(weight.toString());
    }
}
