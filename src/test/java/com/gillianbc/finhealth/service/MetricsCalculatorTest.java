package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.TestProfiles;
import com.gillianbc.finhealth.exception.MissingProfileException;
import com.gillianbc.finhealth.model.AssetData;
import com.gillianbc.finhealth.model.CityTier;
import com.gillianbc.finhealth.model.IncomeBracket;
import com.gillianbc.finhealth.model.IncomeData;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

import static com.gillianbc.finhealth.TestProfiles.amount;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class MetricsCalculatorTest {

    private final MetricsCalculator calculator = TestProfiles.metricsCalculator(TestProfiles.properties());

    @Test
    @DisplayName("Aggregates are sums of the profile fields")
    void calculate_aggregates() {
        PersonalFinanceMetrics pfm = calculator.calculate(TestProfiles.withLoans());

        assertEquals(amount("100000"), pfm.getTotalMonthlyIncome());
        assertEquals(amount("60000"), pfm.getTotalMonthlyExpense());
        assertEquals(amount("33000"), pfm.getTotalMonthlyEmi());
        assertEquals(amount("20000"), pfm.getTotalMonthlyInvestments());
        assertEquals(amount("2360000"), pfm.getTotalAssets());
        assertEquals(amount("3400000"), pfm.getTotalLiabilities());
        assertEquals(amount("93000"), pfm.totalMonthlyOutflow());
        assertEquals(CityTier.TIER_1, pfm.getCityTier());
        assertEquals(IncomeBracket.IG2, pfm.getIncomeBracket());
    }

    @Test
    @DisplayName("Income 100000, expense 60000 and no EMI gives a savings ratio of 0.40")
    void calculate_savingsScenario() {
        PersonalFinanceMetrics pfm = calculator.calculate(TestProfiles.standard());

        assertEquals(amount("0.40"), pfm.metric(MetricName.SAVINGS_INCOME_RATIO).getValue());
        assertEquals(amount("0.20"), pfm.metric(MetricName.INVESTMENT_INCOME_RATIO).getValue());
        assertEquals(amount("0.60"), pfm.metric(MetricName.EXPENSE_INCOME_RATIO).getValue());
        assertEquals(amount("0.00"), pfm.metric(MetricName.DEBT_INCOME_RATIO).getValue());
        assertEquals(amount("7.00"), pfm.metric(MetricName.EMERGENCY_FUND_RATIO).getValue());
        assertEquals(amount("4.00"), pfm.metric(MetricName.LIQUIDITY_RATIO).getValue());
        assertEquals(amount("0.20"), pfm.metric(MetricName.HOUSING_INCOME_RATIO).getValue());
        assertEquals(amount("1.00"), pfm.metric(MetricName.HEALTH_INSURANCE_ADEQUACY).getValue());
        assertEquals(amount("1.00"), pfm.metric(MetricName.TERM_INSURANCE_ADEQUACY).getValue());
        // 2360000 / (1200000 * 2)
        assertEquals(amount("0.98"), pfm.metric(MetricName.NET_WORTH_ADEQUACY).getValue());
        // 44927444.62 / 34482495
        assertEquals(amount("1.30"), pfm.metric(MetricName.RETIREMENT_ADEQUACY).getValue());
        assertEquals(amount("34482495"), pfm.getTargetRetirementCorpus());
    }

    @Test
    @DisplayName("Retirement adequacy compares the inflated future value of savings and SIP with the target corpus")
    void calculate_retirementAdequacy_inflatedFutureValue() {
        PersonalFinanceMetrics pfm = calculator.calculate(TestProfiles.standard());

        // 28 years to retirement at 8% growth and 5% inflation
        double monthlyRate = 0.08 / 12;
        double lumpsumFuture = 600000 * Math.pow(1.08, 28);
        double sipFuture = 5000 * (1 + monthlyRate) * (Math.pow(1 + monthlyRate, 28 * 12) - 1) / monthlyRate;
        double expected = (lumpsumFuture + sipFuture) * Math.pow(1.05, 28) / 34482495;

        assertEquals(1.3029, expected, 0.0001);
        assertEquals(BigDecimal.valueOf(expected).setScale(2, RoundingMode.HALF_UP),
                pfm.metric(MetricName.RETIREMENT_ADEQUACY).getValue());
    }

    @Test
    @DisplayName("Zero liabilities flags the asset-liability ratio instead of throwing")
    void calculate_zeroLiabilities_flagsError() {
        PersonalFinanceMetrics pfm = calculator.calculate(TestProfiles.standard());
        Metric metric = pfm.metric(MetricName.ASSET_LIABILITY_RATIO);

        assertTrue(metric.hasError());
        assertNull(metric.getValue());
        assertEquals("Total Liabilities", metric.getError().getErringParameter());
        assertEquals("Cannot compute 'Asset Liability Ratio' due to invalid (possibly zero) value of 'Total Liabilities'.",
                metric.getError().getMessage());
    }

    @Test
    @DisplayName("Zero income flags every income-based metric and leaves the others alone")
    void calculate_zeroIncome_flagsIncomeMetrics() {
        UserProfile profile = TestProfiles.profile().incomeData(IncomeData.builder().build()).build();
        PersonalFinanceMetrics pfm = calculator.calculate(profile);

        assertTrue(pfm.metric(MetricName.SAVINGS_INCOME_RATIO).hasError());
        assertTrue(pfm.metric(MetricName.DEBT_INCOME_RATIO).hasError());
        assertTrue(pfm.metric(MetricName.TERM_INSURANCE_ADEQUACY).hasError());
        assertTrue(pfm.metric(MetricName.NET_WORTH_ADEQUACY).hasError());
        assertFalse(pfm.metric(MetricName.EMERGENCY_FUND_RATIO).hasError());
        assertEquals(IncomeBracket.IG1, pfm.getIncomeBracket());
    }

    @Test
    @DisplayName("A profile without a city is benchmarked as Tier 3")
    void calculate_missingCity_isTier3() {
        UserProfile profile = TestProfiles.profile()
                .personalData(TestProfiles.personal().city(null).build())
                .build();
        PersonalFinanceMetrics pfm = calculator.calculate(profile);

        assertNull(profile.getPersonalData().getCity());
        assertEquals(CityTier.TIER_3, pfm.getCityTier());
        assertEquals(amount("0.40"), pfm.metric(MetricName.SAVINGS_INCOME_RATIO).getValue());
    }

    @Test
    @DisplayName("Calculating twice from the same profile gives equal results")
    void calculate_isIdempotent() {
        UserProfile profile = TestProfiles.withLoans();
        assertEquals(calculator.calculate(profile), calculator.calculate(profile));
    }

    @Test
    @DisplayName("Asset class fractions sum to exactly 1")
    void calculate_assetClassDistribution() {
        Map<String, BigDecimal> distribution = calculator.calculate(TestProfiles.standard()).getAssetClassDistribution();
        log.info("Asset distribution {}", distribution);

        assertEquals(6, distribution.size());
        BigDecimal total = distribution.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, total.compareTo(BigDecimal.ONE), "fractions should sum to 1 but were " + total);
        assertEquals(amount("0.1017"), distribution.get("liquid"));
        assertEquals(amount("0.1780"), distribution.get("emergency"));
        assertEquals(amount("0.3390"), distribution.get("equity"));
        assertEquals(amount("0.1271"), distribution.get("debt"));
        assertEquals(amount("0.2542"), distribution.get("retirement"));
        assertEquals(amount("0.0000"), distribution.get("real_estate"));
    }

    @Test
    @DisplayName("Six equal holdings split into sixths that still sum to exactly 1")
    void calculate_equalHoldings_distributionSumsToOne() {
        UserProfile profile = TestProfiles.profile()
                .assetData(AssetData.builder()
                        .totalSavingsBalance(BigDecimal.ONE)
                        .totalEmergencyFund(BigDecimal.ONE)
                        .totalEquityInvestments(BigDecimal.ONE)
                        .totalDebtInvestments(BigDecimal.ONE)
                        .totalRetirementInvestments(BigDecimal.ONE)
                        .totalRealEstateInvestments(BigDecimal.ONE)
                        .build())
                .build();
        Map<String, BigDecimal> distribution = calculator.calculate(profile).getAssetClassDistribution();

        BigDecimal total = distribution.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, total.compareTo(BigDecimal.ONE), "fractions should sum to 1 but were " + total);
        assertEquals(amount("0.1667"), distribution.get("liquid"));
        assertEquals(amount("0.1667"), distribution.get("emergency"));
        assertEquals(amount("0.1667"), distribution.get("equity"));
        assertEquals(amount("0.1667"), distribution.get("debt"));
        assertEquals(amount("0.1666"), distribution.get("retirement"));
        assertEquals(amount("0.1666"), distribution.get("real_estate"));
    }

    @Test
    @DisplayName("No assets gives an empty distribution")
    void calculate_noAssets_emptyDistribution() {
        UserProfile profile = TestProfiles.profile()
                .assetData(AssetData.builder().build())
                .build();
        PersonalFinanceMetrics pfm = calculator.calculate(profile);
        assertTrue(pfm.getAssetClassDistribution().isEmpty());
        assertNotNull(pfm.metric(MetricName.RETIREMENT_ADEQUACY).getValue());
    }

    @Test
    @DisplayName("Net worth multiplier steps up with age")
    void netWorthMultiplier_bands() {
        assertEquals(1, MetricsCalculator.netWorthMultiplier(29));
        assertEquals(2, MetricsCalculator.netWorthMultiplier(30));
        assertEquals(4, MetricsCalculator.netWorthMultiplier(45));
        assertEquals(6, MetricsCalculator.netWorthMultiplier(59));
        assertEquals(8, MetricsCalculator.netWorthMultiplier(60));
    }

    @Test
    @DisplayName("A missing profile is rejected")
    void calculate_nullProfile_throws() {
        assertThrows(MissingProfileException.class, () -> calculator.calculate(null));
    }
}
