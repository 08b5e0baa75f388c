package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.exception.InvalidConfigurationException;
import com.gillianbc.finhealth.model.PersonalData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Retirement arithmetic: the corpus needed at retirement and the corpus the current
 * retirement holdings and SIP are projected to reach.
 */
@Slf4j
@Service
public class RetirementProjection {

    private static final MathContext MATH_CONTEXT = new MathContext(20, RoundingMode.HALF_UP);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MAX_EXPENSE_REDUCTION_PERCENT = BigDecimal.valueOf(50);
    // Below this the annuity formula divides by (almost) zero
    private static final BigDecimal NEAR_ZERO_REAL_RETURN = new BigDecimal("0.000001");

    private final FinanceHealthProperties properties;

    public RetirementProjection(FinanceHealthProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Corpus needed at retirement to fund the current monthly outflow until life expectancy.
     * <p>
     * The outflow is inflated to the retirement date, reduced by the configured expense
     * reduction, then valued as a monthly annuity due discounted at the real return
     * (growth net of inflation). With a real return of (almost) zero the payouts are simply summed.
     *
     * @param personal         supplies current and retirement age
     * @param monthlyOutflow   current monthly expense plus EMI
     * @return target corpus rounded to whole rupees
     * @throws InvalidConfigurationException when the ages or expense reduction are out of range
     */
    public BigDecimal targetCorpus(PersonalData personal, BigDecimal monthlyOutflow) {
        Objects.requireNonNull(personal, "personal must not be null");
        Objects.requireNonNull(monthlyOutflow, "monthlyOutflow must not be null");
        int presentAge = personal.getAge();
        int retirementAge = personal.getExpectedRetirementAge();
        int lifeExpectancy = properties.getLifeExpectancy();
        BigDecimal expenseReduction = properties.getRetirementExpenseReductionPercent();

        if (presentAge >= retirementAge) {
            throw new InvalidConfigurationException("Retirement age " + retirementAge
                    + " must be greater than present age " + presentAge + ".");
        }
        if (retirementAge >= lifeExpectancy) {
            throw new InvalidConfigurationException("Life expectancy " + lifeExpectancy
                    + " must be greater than retirement age " + retirementAge + ".");
        }
        if (expenseReduction.signum() < 0 || expenseReduction.compareTo(MAX_EXPENSE_REDUCTION_PERCENT) > 0) {
            throw new InvalidConfigurationException("Expense reduction must be between 0% and 50%, was "
                    + expenseReduction + "%.");
        }

        BigDecimal inflation = properties.getAnnualInflationRate();
        BigDecimal growth = properties.getRetirementCorpusGrowthRate();

        int yearsToRetirement = retirementAge - presentAge;
        BigDecimal futureExpenses = monthlyOutflow.multiply(
                BigDecimal.ONE.add(inflation).pow(yearsToRetirement, MATH_CONTEXT), MATH_CONTEXT);
        BigDecimal retirementExpenses = futureExpenses.multiply(
                BigDecimal.ONE.subtract(expenseReduction.divide(ONE_HUNDRED, MATH_CONTEXT)), MATH_CONTEXT);

        BigDecimal realReturn = BigDecimal.ONE.add(growth)
                .divide(BigDecimal.ONE.add(inflation), MATH_CONTEXT)
                .subtract(BigDecimal.ONE);
        int payoutMonths = (lifeExpectancy - retirementAge) * 12;

        BigDecimal corpus;
        if (realReturn.abs().compareTo(NEAR_ZERO_REAL_RETURN) < 0) {
            corpus = retirementExpenses.multiply(BigDecimal.valueOf(payoutMonths), MATH_CONTEXT);
        } else {
            BigDecimal monthlyRate = realReturn.divide(TWELVE, MATH_CONTEXT);
            BigDecimal onePlusRate = BigDecimal.ONE.add(monthlyRate);
            BigDecimal discount = BigDecimal.ONE.subtract(onePlusRate.pow(-payoutMonths, MATH_CONTEXT));
            corpus = retirementExpenses
                    .multiply(discount, MATH_CONTEXT)
                    .divide(monthlyRate, MATH_CONTEXT)
                    .multiply(onePlusRate, MATH_CONTEXT);
        }
        log.debug("Target corpus {} for {} payout months from monthly outflow {}", corpus, payoutMonths, monthlyOutflow);
        return corpus.setScale(0, RoundingMode.HALF_UP);
    }

    /**
     * Value at retirement of the existing retirement holdings plus the monthly retirement SIP,
     * both growing at the nominal corpus growth rate. When configured, the result is carried
     * forward by inflation over the same years, in line with how the target corpus is stated.
     *
     * @return projected corpus rounded to 2 decimal places
     */
    public BigDecimal projectedCorpus(PersonalData personal, BigDecimal lumpsum, BigDecimal monthlySip) {
        Objects.requireNonNull(personal, "personal must not be null");
        Objects.requireNonNull(lumpsum, "lumpsum must not be null");
        Objects.requireNonNull(monthlySip, "monthlySip must not be null");
        int years = Math.max(0, personal.yearsToRetirement());
        BigDecimal growth = properties.getRetirementCorpusGrowthRate();

        BigDecimal lumpsumFuture = lumpsum.multiply(BigDecimal.ONE.add(growth).pow(years, MATH_CONTEXT), MATH_CONTEXT);
        BigDecimal sipFuture;
        if (growth.signum() == 0) {
            sipFuture = monthlySip.multiply(BigDecimal.valueOf(12L * years), MATH_CONTEXT);
        } else {
            BigDecimal monthlyRate = growth.divide(TWELVE, MATH_CONTEXT);
            BigDecimal onePlusRate = BigDecimal.ONE.add(monthlyRate);
            // annuity due: each SIP is invested at the start of its month
            sipFuture = monthlySip
                    .multiply(onePlusRate, MATH_CONTEXT)
                    .multiply(onePlusRate.pow(12 * years, MATH_CONTEXT).subtract(BigDecimal.ONE), MATH_CONTEXT)
                    .divide(monthlyRate, MATH_CONTEXT);
        }
        BigDecimal projected = lumpsumFuture.add(sipFuture, MATH_CONTEXT);
        if (properties.isInflateProjectedCorpus()) {
            projected = projected.multiply(
                    BigDecimal.ONE.add(properties.getAnnualInflationRate()).pow(years, MATH_CONTEXT), MATH_CONTEXT);
        }
        return projected.setScale(2, RoundingMode.HALF_UP);
    }
}
