package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.model.Benchmark;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Estimates the rupee amount needed to bring a metric into its benchmark range.
 * <p>
 * For each metric the distance to both bounds is converted into rupees against the metric's
 * base, and the nearer one is used. The result is never below the configured minimum gap.
 */
@Slf4j
@Service
public class GapCalculator {

    private static final MathContext MATH_CONTEXT = new MathContext(12, RoundingMode.HALF_UP);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);

    private final FinanceHealthProperties properties;

    public GapCalculator(FinanceHealthProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public BigDecimal gap(Metric metric, PersonalFinanceMetrics pfm, UserProfile profile) {
        BigDecimal minimum = properties.getMinimumGap().setScale(2, RoundingMode.HALF_UP);
        Benchmark benchmark = metric.getBenchmark();
        if (metric.hasError() || benchmark == null) {
            return minimum;
        }
        BigDecimal lo = benchmark.getMin();
        BigDecimal hi = benchmark.getMax();
        BigDecimal value = metric.getValue();
        BigDecimal income = pfm.getTotalMonthlyIncome();

        BigDecimal gap;
        switch (metric.getName()) {
            case SAVINGS_INCOME_RATIO:
            case INVESTMENT_INCOME_RATIO:
            case EXPENSE_INCOME_RATIO:
            case DEBT_INCOME_RATIO:
            case HOUSING_INCOME_RATIO:
                gap = nearer(lo, hi, value, income);
                break;
            case EMERGENCY_FUND_RATIO:
            case LIQUIDITY_RATIO:
                gap = nearer(lo, hi, value, pfm.totalMonthlyOutflow());
                break;
            case RETIREMENT_ADEQUACY:
                BigDecimal months = BigDecimal.valueOf(Math.max(1, 12L * profile.getPersonalData().yearsToRetirement()));
                gap = nearer(lo, hi, value, pfm.getTargetRetirementCorpus()).divide(months, MATH_CONTEXT);
                break;
            case ASSET_LIABILITY_RATIO:
                gap = assetLiabilityGap(lo, hi, pfm);
                break;
            case HEALTH_INSURANCE_ADEQUACY:
                gap = coverGap(profile.getInsuranceData().getTotalMedicalCover(), lo, hi, requiredMedicalCover(profile));
                break;
            case TERM_INSURANCE_ADEQUACY:
                gap = coverGap(profile.getInsuranceData().getTotalTermCover(), lo, hi, requiredTermCover(pfm));
                break;
            case NET_WORTH_ADEQUACY:
                BigDecimal required = income.multiply(TWELVE)
                        .multiply(BigDecimal.valueOf(MetricsCalculator.netWorthMultiplier(profile.getPersonalData().getAge())));
                gap = nearer(lo, hi, value, required);
                break;
            default:
                log.warn("No gap rule for {}, using the minimum", metric.getName().key());
                return minimum;
        }
        return gap.setScale(2, RoundingMode.HALF_UP).max(minimum);
    }

    /**
     * Cover that would make the health adequacy ratio exactly 1.
     */
    public BigDecimal requiredMedicalCover(UserProfile profile) {
        return BigDecimal.valueOf(profile.getPersonalData().getNoOfDependents() + 1L)
                .multiply(properties.getMedicalCoverPerHead());
    }

    /**
     * Cover that would make the term adequacy ratio exactly 1.
     */
    public BigDecimal requiredTermCover(PersonalFinanceMetrics pfm) {
        return pfm.getTotalMonthlyIncome().multiply(TWELVE).multiply(properties.getTermCoverIncomeMultiple());
    }

    private static BigDecimal nearer(BigDecimal lo, BigDecimal hi, BigDecimal value, BigDecimal base) {
        BigDecimal toLo = lo.subtract(value).abs().multiply(base);
        BigDecimal toHi = hi.subtract(value).abs().multiply(base);
        return toLo.min(toHi);
    }

    private static BigDecimal coverGap(BigDecimal cover, BigDecimal lo, BigDecimal hi, BigDecimal requiredCover) {
        BigDecimal toLo = cover.subtract(lo.multiply(requiredCover)).abs();
        BigDecimal toHi = cover.subtract(hi.multiply(requiredCover)).abs();
        return toLo.min(toHi);
    }

    // Liabilities that would put the ratio on each bound, compared with the actual liabilities
    private static BigDecimal assetLiabilityGap(BigDecimal lo, BigDecimal hi, PersonalFinanceMetrics pfm) {
        BigDecimal assets = pfm.getTotalAssets();
        BigDecimal liabilities = pfm.getTotalLiabilities();
        BigDecimal atLo = assets.divide(lo.signum() == 0 ? BigDecimal.ONE : lo, MATH_CONTEXT);
        BigDecimal atHi = assets.divide(hi.signum() == 0 ? BigDecimal.ONE : hi, MATH_CONTEXT);
        return liabilities.subtract(atLo).abs().min(liabilities.subtract(atHi).abs());
    }
}
