package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.exception.MissingProfileException;
import com.gillianbc.finhealth.model.AssetData;
import com.gillianbc.finhealth.model.ExpenseData;
import com.gillianbc.finhealth.model.IncomeData;
import com.gillianbc.finhealth.model.LiabilityData;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricError;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.MetricResult;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.gillianbc.finhealth.model.Amounts.sum;

/**
 * Derives the aggregates and the twelve assessable metrics from a {@link UserProfile}.
 * <p>
 * Pure: the same profile always yields an equal {@link PersonalFinanceMetrics}. A metric
 * whose denominator is zero is returned with a {@link MetricError} instead of a value; it
 * never aborts the calculation. Metric values are rounded to 2 decimal places.
 */
@Slf4j
@Service
public class MetricsCalculator {

    private static final MathContext MATH_CONTEXT = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final int SHARE_SCALE = 4;
    private static final BigDecimal SHARE_UNIT = BigDecimal.ONE.movePointLeft(SHARE_SCALE);

    private final SegmentClassifier segmentClassifier;
    private final RetirementProjection retirementProjection;
    private final FinanceHealthProperties properties;

    public MetricsCalculator(SegmentClassifier segmentClassifier,
                             RetirementProjection retirementProjection,
                             FinanceHealthProperties properties) {
        this.segmentClassifier = Objects.requireNonNull(segmentClassifier, "segmentClassifier must not be null");
        this.retirementProjection = Objects.requireNonNull(retirementProjection, "retirementProjection must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * @throws MissingProfileException when {@code profile} is null
     * @throws com.gillianbc.finhealth.exception.InvalidConfigurationException when the
     *         retirement projection cannot be made for this profile
     */
    public PersonalFinanceMetrics calculate(UserProfile profile) {
        if (profile == null) {
            throw new MissingProfileException();
        }
        BigDecimal totalAssets = totalAssets(profile.getAssetData());
        BigDecimal totalLiabilities = totalLiabilities(profile.getLiabilityData());
        BigDecimal totalEmi = totalMonthlyEmi(profile.getLiabilityData());
        BigDecimal totalInvestments = totalMonthlyInvestments(profile.getAssetData());
        BigDecimal totalIncome = totalMonthlyIncome(profile.getIncomeData());
        BigDecimal totalExpense = totalMonthlyExpense(profile.getExpenseData());
        BigDecimal outflow = totalExpense.add(totalEmi);
        BigDecimal targetCorpus = retirementProjection.targetCorpus(profile.getPersonalData(), outflow);

        Map<MetricName, MetricResult> results = new EnumMap<>(MetricName.class);
        results.put(MetricName.SAVINGS_INCOME_RATIO,
                ratio(MetricName.SAVINGS_INCOME_RATIO, totalIncome.subtract(outflow), totalIncome, "Income"));
        results.put(MetricName.INVESTMENT_INCOME_RATIO,
                ratio(MetricName.INVESTMENT_INCOME_RATIO, totalInvestments, totalIncome, "Income"));
        results.put(MetricName.EXPENSE_INCOME_RATIO,
                ratio(MetricName.EXPENSE_INCOME_RATIO, outflow, totalIncome, "Income"));
        results.put(MetricName.DEBT_INCOME_RATIO,
                ratio(MetricName.DEBT_INCOME_RATIO, totalEmi, totalIncome, "Income"));
        results.put(MetricName.EMERGENCY_FUND_RATIO,
                ratio(MetricName.EMERGENCY_FUND_RATIO, profile.getAssetData().getTotalEmergencyFund(), outflow, "Expense"));
        results.put(MetricName.LIQUIDITY_RATIO,
                ratio(MetricName.LIQUIDITY_RATIO, profile.getAssetData().getTotalSavingsBalance(), outflow, "Expense"));
        results.put(MetricName.ASSET_LIABILITY_RATIO,
                ratio(MetricName.ASSET_LIABILITY_RATIO, totalAssets, totalLiabilities, "Total Liabilities"));
        results.put(MetricName.HOUSING_INCOME_RATIO,
                ratio(MetricName.HOUSING_INCOME_RATIO,
                        profile.getExpenseData().getHousingCost().add(profile.getLiabilityData().getHomeLoanEmi()),
                        totalIncome, "Income"));
        results.put(MetricName.HEALTH_INSURANCE_ADEQUACY, healthInsuranceAdequacy(profile));
        results.put(MetricName.TERM_INSURANCE_ADEQUACY, termInsuranceAdequacy(profile, totalIncome));
        results.put(MetricName.NET_WORTH_ADEQUACY,
                netWorthAdequacy(profile.getPersonalData().getAge(), totalAssets, totalLiabilities, totalIncome));
        results.put(MetricName.RETIREMENT_ADEQUACY, retirementAdequacy(profile, targetCorpus));

        Map<MetricName, Metric> metrics = new EnumMap<>(MetricName.class);
        results.forEach((name, result) -> {
            if (!result.isOk()) {
                log.warn(result.getError().getMessage());
            }
            metrics.put(name, Metric.of(name, result));
        });

        PersonalFinanceMetrics pfm = PersonalFinanceMetrics.builder()
                .cityTier(segmentClassifier.classifyCityTier(profile.getPersonalData().getCity()))
                .incomeBracket(segmentClassifier.classifyIncomeBracket(totalIncome))
                .totalMonthlyIncome(totalIncome)
                .totalMonthlyExpense(totalExpense)
                .totalMonthlyInvestments(totalInvestments)
                .totalMonthlyEmi(totalEmi)
                .totalAssets(totalAssets)
                .totalLiabilities(totalLiabilities)
                .targetRetirementCorpus(targetCorpus)
                .assetClassDistribution(assetClassDistribution(profile.getAssetData(), totalAssets))
                .metrics(metrics)
                .build();
        log.info("Derived metrics for {} / {}", pfm.getCityTier().key(), pfm.getIncomeBracket());
        return pfm;
    }

    public BigDecimal totalAssets(AssetData assets) {
        return sum(assets.getTotalSavingsBalance(),
                assets.getTotalEmergencyFund(),
                assets.getTotalEquityInvestments(),
                assets.getTotalDebtInvestments(),
                assets.getTotalRetirementInvestments(),
                assets.getTotalRealEstateInvestments());
    }

    public BigDecimal totalLiabilities(LiabilityData liabilities) {
        return sum(liabilities.getOutstandingCreditCardBalance(),
                liabilities.getOutstandingPersonalLoanBalance(),
                liabilities.getOutstandingCarLoanBalance(),
                liabilities.getOutstandingStudentLoanBalance(),
                liabilities.getOutstandingHomeLoanBalance());
    }

    public BigDecimal totalMonthlyEmi(LiabilityData liabilities) {
        return sum(liabilities.getCreditCardEmi(),
                liabilities.getPersonalLoanEmi(),
                liabilities.getCarLoanEmi(),
                liabilities.getStudentLoanEmi(),
                liabilities.getHomeLoanEmi());
    }

    public BigDecimal totalMonthlyInvestments(AssetData assets) {
        return sum(assets.getEquitySip(), assets.getDebtSip(), assets.getRetirementSip());
    }

    public BigDecimal totalMonthlyIncome(IncomeData income) {
        return sum(income.getSalariedIncome(),
                income.getBusinessIncome(),
                income.getFreelanceIncome(),
                income.getRentalIncome(),
                income.getOtherIncome());
    }

    public BigDecimal totalMonthlyExpense(ExpenseData expense) {
        return sum(expense.getHousingCost(),
                expense.getUtilitiesAndBills(),
                expense.getGroceriesAndEssentials(),
                expense.getDiscretionaryExpense(),
                expense.getMedicalInsurancePremium(),
                expense.getTermInsurancePremium());
    }

    /**
     * Age-based multiple of annual income the net worth is expected to reach.
     */
    public static int netWorthMultiplier(int age) {
        if (age < 30) {
            return 1;
        } else if (age < 40) {
            return 2;
        } else if (age < 50) {
            return 4;
        } else if (age < 60) {
            return 6;
        }
        return 8;
    }

    private MetricResult healthInsuranceAdequacy(UserProfile profile) {
        BigDecimal familySize = BigDecimal.valueOf(profile.getPersonalData().getNoOfDependents() + 1L);
        BigDecimal requiredCover = familySize.multiply(properties.getMedicalCoverPerHead());
        return ratio(MetricName.HEALTH_INSURANCE_ADEQUACY,
                profile.getInsuranceData().getTotalMedicalCover(), requiredCover, "No of Dependents");
    }

    private MetricResult termInsuranceAdequacy(UserProfile profile, BigDecimal monthlyIncome) {
        BigDecimal requiredCover = monthlyIncome.multiply(TWELVE).multiply(properties.getTermCoverIncomeMultiple());
        return ratio(MetricName.TERM_INSURANCE_ADEQUACY,
                profile.getInsuranceData().getTotalTermCover(), requiredCover, "Income");
    }

    private MetricResult netWorthAdequacy(int age, BigDecimal assets, BigDecimal liabilities, BigDecimal monthlyIncome) {
        BigDecimal requiredNetWorth = monthlyIncome.multiply(TWELVE).multiply(BigDecimal.valueOf(netWorthMultiplier(age)));
        return ratio(MetricName.NET_WORTH_ADEQUACY, assets.subtract(liabilities), requiredNetWorth, "Income");
    }

    private MetricResult retirementAdequacy(UserProfile profile, BigDecimal targetCorpus) {
        BigDecimal projected = retirementProjection.projectedCorpus(profile.getPersonalData(),
                profile.getAssetData().getTotalRetirementInvestments(),
                profile.getAssetData().getRetirementSip());
        return ratio(MetricName.RETIREMENT_ADEQUACY, projected, targetCorpus, "Target Retirement Corpus");
    }

    /**
     * Share of total assets per asset class, at 4 decimal places. Empty when there are no assets.
     * Shares are floored and the missing ten-thousandths go to the largest remainders, earlier
     * classes first on ties, so the shares always add up to exactly 1.
     */
    private static Map<String, BigDecimal> assetClassDistribution(AssetData assets, BigDecimal totalAssets) {
        Map<String, BigDecimal> distribution = new LinkedHashMap<>();
        if (totalAssets.signum() == 0) {
            return distribution;
        }
        Map<String, BigDecimal> holdings = new LinkedHashMap<>();
        holdings.put("liquid", assets.getTotalSavingsBalance());
        holdings.put("emergency", assets.getTotalEmergencyFund());
        holdings.put("equity", assets.getTotalEquityInvestments());
        holdings.put("debt", assets.getTotalDebtInvestments());
        holdings.put("retirement", assets.getTotalRetirementInvestments());
        holdings.put("real_estate", assets.getTotalRealEstateInvestments());
        Map<String, BigDecimal> remainders = new LinkedHashMap<>();
        BigDecimal allotted = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> holding : holdings.entrySet()) {
            BigDecimal share = holding.getValue().divide(totalAssets, MATH_CONTEXT);
            BigDecimal floor = share.setScale(SHARE_SCALE, RoundingMode.FLOOR);
            distribution.put(holding.getKey(), floor);
            remainders.put(holding.getKey(), share.subtract(floor));
            allotted = allotted.add(floor);
        }

        int shortfall = BigDecimal.ONE.subtract(allotted).movePointRight(SHARE_SCALE).intValueExact();
        List<String> byRemainder = new ArrayList<>(holdings.keySet());
        byRemainder.sort(Comparator.comparing(remainders::get, Comparator.reverseOrder()));
        for (int i = 0; i < shortfall; i++) {
            distribution.merge(byRemainder.get(i % byRemainder.size()), SHARE_UNIT, BigDecimal::add);
        }
        return distribution;
    }

    private static MetricResult ratio(MetricName metric, BigDecimal numerator, BigDecimal denominator, String erringParameter) {
        if (denominator.signum() == 0) {
            return MetricResult.failed(new MetricError(metric.displayName(), erringParameter));
        }
        return MetricResult.ok(numerator.divide(denominator, MATH_CONTEXT).setScale(2, RoundingMode.HALF_UP));
    }
}
