package com.gillianbc.finhealth.config;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lower-cased names of the Tier 1 and Tier 2 cities. Everything else is Tier 3.
 */
public final class CityTierDirectory {

    private final Set<String> tier1;
    private final Set<String> tier2;

    public CityTierDirectory(Set<String> tier1, Set<String> tier2) {
        this.tier1 = normalize(tier1);
        this.tier2 = normalize(tier2);
    }

    public boolean isTier1(String normalizedName) {
        return tier1.contains(normalizedName);
    }

    public boolean isTier2(String normalizedName) {
        return tier2.contains(normalizedName);
    }

    private static Set<String> normalize(Set<String> names) {
        return names.stream()
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
