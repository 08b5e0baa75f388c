package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.config.CityTierDirectory;
import com.gillianbc.finhealth.model.CityTier;
import com.gillianbc.finhealth.model.IncomeBracket;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Places a user in the segment used to pick benchmarks: city tier and monthly income bracket.
 */
@Service
public class SegmentClassifier {

    private final CityTierDirectory cityTiers;

    public SegmentClassifier(CityTierDirectory cityTiers) {
        this.cityTiers = Objects.requireNonNull(cityTiers, "cityTiers must not be null");
    }

    /**
     * @param monthlyIncome total monthly income in INR
     * @return the first bracket whose exclusive upper bound is above the income
     */
    public IncomeBracket classifyIncomeBracket(BigDecimal monthlyIncome) {
        Objects.requireNonNull(monthlyIncome, "monthlyIncome must not be null");
        for (IncomeBracket bracket : IncomeBracket.values()) {
            BigDecimal upper = bracket.upperBoundExclusive();
            if (upper == null || monthlyIncome.compareTo(upper) < 0) {
                return bracket;
            }
        }
        return IncomeBracket.IG7;
    }

    /**
     * Case-insensitive and whitespace-trimmed. Unknown or missing cities are Tier 3.
     */
    public CityTier classifyCityTier(String cityName) {
        if (cityName == null) {
            return CityTier.TIER_3;
        }
        String name = cityName.trim().toLowerCase(Locale.ROOT);
        if (cityTiers.isTier1(name)) {
            return CityTier.TIER_1;
        }
        if (cityTiers.isTier2(name)) {
            return CityTier.TIER_2;
        }
        return CityTier.TIER_3;
    }
}
