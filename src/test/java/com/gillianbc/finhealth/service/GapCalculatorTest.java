package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.TestProfiles;
import com.gillianbc.finhealth.model.Benchmark;
import com.gillianbc.finhealth.model.InsuranceData;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricError;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.UserProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.gillianbc.finhealth.TestProfiles.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GapCalculatorTest {

    private final GapCalculator calculator = new GapCalculator(TestProfiles.properties());
    private final UserProfile profile = TestProfiles.standard();
    private final PersonalFinanceMetrics pfm = TestProfiles.benchmarkResolver().attachBenchmarks(
            TestProfiles.metricsCalculator(TestProfiles.properties()).calculate(profile));

    private static Metric metric(MetricName name, String value, String lo, String hi) {
        return Metric.builder().name(name).value(amount(value)).benchmark(Benchmark.of(lo, hi)).build();
    }

    @Test
    @DisplayName("Income ratios measure the gap to the nearer bound in monthly income")
    void gap_incomeRatio() {
        // 0.03 * 100000 to the lower bound
        assertEquals(amount("3000.00"),
                calculator.gap(metric(MetricName.SAVINGS_INCOME_RATIO, "0.10", "0.13", "0.24"), pfm, profile));
        // 0.06 * 100000 to the upper bound
        assertEquals(amount("6000.00"),
                calculator.gap(metric(MetricName.DEBT_INCOME_RATIO, "0.36", "0", "0.3"), pfm, profile));
    }

    @Test
    @DisplayName("Reserve ratios measure the gap in months of outflow")
    void gap_reserveRatio() {
        assertEquals(amount("180000.00"),
                calculator.gap(metric(MetricName.EMERGENCY_FUND_RATIO, "3", "6", "9"), pfm, profile));
    }

    @Test
    @DisplayName("Small gaps are raised to the minimum")
    void gap_floorsAtMinimum() {
        assertEquals(amount("1000.00"),
                calculator.gap(metric(MetricName.SAVINGS_INCOME_RATIO, "0.129", "0.13", "0.24"), pfm, profile));
    }

    @Test
    @DisplayName("Metrics that failed to compute report the minimum gap")
    void gap_errorMetric() {
        Metric failed = Metric.builder()
                .name(MetricName.ASSET_LIABILITY_RATIO)
                .error(new MetricError("Asset Liability Ratio", "Total Liabilities"))
                .benchmark(Benchmark.of("2", "4"))
                .build();
        assertEquals(amount("1000.00"), calculator.gap(failed, pfm, profile));
    }

    @Test
    @DisplayName("Retirement gap is the corpus shortfall spread over the months left")
    void gap_retirement() {
        // 0.92 * 34482495 / (28 * 12)
        assertEquals(amount("94416.36"),
                calculator.gap(metric(MetricName.RETIREMENT_ADEQUACY, "0.08", "1", "1.5"), pfm, profile));
    }

    @Test
    @DisplayName("Insurance gaps are expressed as cover amounts")
    void gap_insurance() {
        UserProfile underInsured = TestProfiles.profile()
                .insuranceData(InsuranceData.builder()
                        .totalMedicalCover(amount("300000"))
                        .totalTermCover(amount("12000000"))
                        .build())
                .build();
        // two heads at 500000 each, cover 300000
        assertEquals(amount("700000.00"),
                calculator.gap(metric(MetricName.HEALTH_INSURANCE_ADEQUACY, "0.3", "1", "2"), pfm, underInsured));
        assertEquals(amount("1000000"), calculator.requiredMedicalCover(underInsured));
        assertEquals(amount("12000000"), calculator.requiredTermCover(pfm));
    }

    @Test
    @DisplayName("Asset-liability gap compares liabilities with the level each bound allows")
    void gap_assetLiability() {
        UserProfile indebted = TestProfiles.withLoans();
        PersonalFinanceMetrics loaded = TestProfiles.metricsCalculator(TestProfiles.properties()).calculate(indebted);
        // assets 2360000 allow 1180000 of liabilities at a ratio of 2, against 3400000 actual
        assertEquals(amount("2220000.00"),
                calculator.gap(metric(MetricName.ASSET_LIABILITY_RATIO, "0.69", "2", "4"), loaded, indebted));
    }
}
