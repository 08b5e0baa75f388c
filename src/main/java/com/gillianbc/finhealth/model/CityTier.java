package com.gillianbc.finhealth.model;

public enum CityTier {

    TIER_1(1),
    TIER_2(2),
    TIER_3(3);

    private final int number;

    CityTier(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    /**
     * @return key used by the tiered benchmark data, e.g. "Tier 2"
     */
    public String key() {
        return "Tier " + number;
    }

    public static CityTier fromNumber(int number) {
        for (CityTier tier : values()) {
            if (tier.number == number) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown city tier " + number);
    }
}
