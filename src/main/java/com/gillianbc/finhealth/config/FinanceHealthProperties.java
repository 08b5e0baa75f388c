package com.gillianbc.finhealth.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Tunable constants for the metric calculations, verdict bands and scoring curve.
 * Defaults match {@code application.yml}; unit tests construct this directly.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "finance-health")
public class FinanceHealthProperties {

    private BigDecimal annualInflationRate = new BigDecimal("0.05");
    // Nominal annual growth of retirement investments, also used post-retirement
    private BigDecimal retirementCorpusGrowthRate = new BigDecimal("0.08");
    private int lifeExpectancy = 75;
    // Percent, 0..50
    private BigDecimal retirementExpenseReductionPercent = BigDecimal.ZERO;
    // Scale the projected corpus by (1 + inflation)^years before comparing with the target
    private boolean inflateProjectedCorpus = true;

    private BigDecimal medicalCoverPerHead = new BigDecimal("500000");
    // Years of annual income a term policy should cover
    private BigDecimal termCoverIncomeMultiple = new BigDecimal("10");

    private BigDecimal scoringBaseValue = new BigDecimal("0.1");
    // When false, values above the range decay like values below it
    private boolean rewardOverPerformance = true;
    private BigDecimal overPerformanceFactor = new BigDecimal("0.85");
    private BigDecimal minimumGap = new BigDecimal("1000");

    private Relaxation relaxation = new Relaxation();

    private String benchmarkResource = "reference/ideal-ranges.json";
    private String cityTierResource = "reference/city-tiers.json";
    private String glossaryResource = "reference/glossary.json";

    private Report report = new Report();

    /**
     * Multipliers applied to the benchmark bounds to form the verdict bands.
     */
    @Getter
    @Setter
    public static class Relaxation {
        private BigDecimal lowStage1 = new BigDecimal("0.85");
        private BigDecimal highStage1 = new BigDecimal("1.15");
        private BigDecimal lowStage2 = new BigDecimal("0.75");
        private BigDecimal highStage2 = new BigDecimal("1.25");
    }

    @Getter
    @Setter
    public static class Report {
        // When set, the application analyses this profile on startup
        private String profilePath;
        private String outputDir = "target/results";
    }
}
