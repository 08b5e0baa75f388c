package com.gillianbc.finhealth.feedback;

import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.Verdict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.gillianbc.finhealth.feedback.Placeholder.Style.DECIMAL_1;
import static com.gillianbc.finhealth.feedback.Placeholder.Style.DECIMAL_2;
import static com.gillianbc.finhealth.feedback.Placeholder.Style.PERCENT;
import static com.gillianbc.finhealth.feedback.Placeholder.Style.PLAIN;
import static com.gillianbc.finhealth.feedback.Placeholder.Style.RUPEES;
import static com.gillianbc.finhealth.feedback.TemplateVariable.GAP_AMOUNT;
import static com.gillianbc.finhealth.feedback.TemplateVariable.MAX_VALUE;
import static com.gillianbc.finhealth.feedback.TemplateVariable.MIN_VALUE;
import static com.gillianbc.finhealth.feedback.TemplateVariable.USER_VALUE;

/**
 * Canned feedback text per metric and verdict.
 * <p>
 * Review templates exist only where an above-range value may be deliberate. A metric with no
 * review template for its verdict is reported as an improvement instead. For the insurance
 * metrics the commendable and improvement texts are given the cover amount in rupees rather
 * than the adequacy ratio, and the improvement bounds are scaled to rupees as well.
 */
public final class FeedbackTemplateCatalog {

    public static final FeedbackTemplate COMMENDABLE_FALLBACK =
            FeedbackTemplate.of("Metric values are well within ideal ranges. Great work!");
    public static final ImprovementTemplate IMPROVEMENT_FALLBACK = new ImprovementTemplate(
            FeedbackTemplate.of("Metric value is far from ideal."),
            FeedbackTemplate.of("Optimize for a healthier financial future."));
    public static final FeedbackTemplate DEBT_FREE =
            FeedbackTemplate.of("Great work being debt-free! This significantly strengthens your financial position.");

    private final Map<MetricName, Map<Verdict, FeedbackTemplate>> commendable;
    private final Map<MetricName, Map<Verdict, FeedbackTemplate>> review;
    private final Map<MetricName, Map<Verdict, ImprovementTemplate>> improvement;

    private FeedbackTemplateCatalog(Builder builder) {
        this.commendable = freeze(builder.commendable);
        this.review = freeze(builder.review);
        this.improvement = freeze(builder.improvement);
    }

    public Optional<FeedbackTemplate> commendable(MetricName metric, Verdict verdict) {
        return find(commendable, metric, verdict);
    }

    public Optional<FeedbackTemplate> review(MetricName metric, Verdict verdict) {
        return find(review, metric, verdict);
    }

    public Optional<ImprovementTemplate> improvement(MetricName metric, Verdict verdict) {
        return find(improvement, metric, verdict);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FeedbackTemplateCatalog defaults() {
        Builder b = builder();

        b.commendable(MetricName.EMERGENCY_FUND_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("Your emergency fund covers %s months of expenses. Great job maintaining strong financial safety!",
                        USER_VALUE.as(DECIMAL_1)));
        b.commendable(MetricName.EMERGENCY_FUND_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("Your emergency fund covers %s months, fairly close to the ideal range. Keep building for better protection.",
                        USER_VALUE.as(DECIMAL_1)));
        b.commendable(MetricName.LIQUIDITY_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("Liquid reserves cover %s months. You're in a solid position, keep it up!",
                        USER_VALUE.as(DECIMAL_1)));
        b.commendable(MetricName.LIQUIDITY_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("Liquid reserves cover %s months, nearing the ideal. A bit more will strengthen your buffer.",
                        USER_VALUE.as(DECIMAL_1)));
        b.commendable(MetricName.ASSET_LIABILITY_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("Assets are %s times your liabilities. This shows strong financial health.",
                        USER_VALUE.as(DECIMAL_2)));
        b.commendable(MetricName.ASSET_LIABILITY_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("Assets are %s times liabilities, almost at a safe level. Keep improving your position.",
                        USER_VALUE.as(DECIMAL_2)));
        b.commendable(MetricName.HOUSING_INCOME_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("You're spending %s on housing, well within the healthy range.",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.HOUSING_INCOME_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("You're spending %s on housing, fairly close to ideal. Stay on track!",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.EXCELLENT,
                FeedbackTemplate.of("Health insurance cover is %s. You're well protected.",
                        USER_VALUE.as(RUPEES)));
        b.commendable(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.GOOD,
                FeedbackTemplate.of("Health cover is %s, almost adequate. A small top-up can help.",
                        USER_VALUE.as(RUPEES)));
        b.commendable(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.EXCELLENT,
                FeedbackTemplate.of("Term insurance is %s. Your family is well secured.",
                        USER_VALUE.as(RUPEES)));
        b.commendable(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.GOOD,
                FeedbackTemplate.of("Term insurance is %s, close to ideal. A bit more would enhance coverage.",
                        USER_VALUE.as(RUPEES)));
        b.commendable(MetricName.RETIREMENT_ADEQUACY, Verdict.EXCELLENT,
                FeedbackTemplate.of("Retirement corpus at %s of target. You're on track, great foresight!",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.RETIREMENT_ADEQUACY, Verdict.GOOD,
                FeedbackTemplate.of("Retirement corpus at %s of target, almost there. Stay consistent.",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.NET_WORTH_ADEQUACY, Verdict.EXCELLENT,
                FeedbackTemplate.of("Your net worth matches age-based expectations. Keep compounding!"));
        b.commendable(MetricName.NET_WORTH_ADEQUACY, Verdict.GOOD,
                FeedbackTemplate.of("Your net worth is nearly on track. You're progressing well, stay the course."));
        b.commendable(MetricName.SAVINGS_INCOME_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("Saving %s of income is a strong habit. Stay disciplined!",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.SAVINGS_INCOME_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("Saving %s of income is almost ideal. Keep going!",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.INVESTMENT_INCOME_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("Investing %s of income is excellent for long-term success.",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.INVESTMENT_INCOME_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("Investing %s is close to optimal. A bit more consistency helps.",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.EXPENSE_INCOME_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("Expenses are %s of income, efficiently managed. Great job!",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.EXPENSE_INCOME_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("Expenses are %s of income, nearing ideal. Some tweaks can optimize it.",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.DEBT_INCOME_RATIO, Verdict.EXCELLENT,
                FeedbackTemplate.of("Debt takes up %s of income, well within the safe zone.",
                        USER_VALUE.as(PERCENT)));
        b.commendable(MetricName.DEBT_INCOME_RATIO, Verdict.GOOD,
                FeedbackTemplate.of("Debt is %s of income, almost safe. Stay focused on reducing it.",
                        USER_VALUE.as(PERCENT)));

        b.review(MetricName.SAVINGS_INCOME_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your savings-to-income ratio is %s, which is above the typical range of [%s, %s]. "
                                + "Please review this to ensure the excess savings aren't impacting other financial needs.",
                        USER_VALUE.as(DECIMAL_2), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.SAVINGS_INCOME_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your savings-to-income ratio is a striking %s, well beyond the expected range [%s, %s]. "
                                + "If this is unintentional, it may be holding you back from a better lifestyle.",
                        USER_VALUE.as(DECIMAL_2), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.INVESTMENT_INCOME_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your investment-income ratio stands at %s, which exceeds the normal range of [%s, %s]. "
                                + "It may be worth reviewing your portfolio allocation.",
                        USER_VALUE.as(DECIMAL_2), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.INVESTMENT_INCOME_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your investment-income ratio is an unusually high %s, far above the typical levels of [%s, %s]. "
                                + "Double-check if this aligns with your risk and liquidity goals.",
                        USER_VALUE.as(DECIMAL_2), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.EMERGENCY_FUND_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your emergency-fund ratio is %s months, above the suggested upper limit of %s months. "
                                + "Verify if this level of reserves is purposeful.",
                        USER_VALUE.as(DECIMAL_1), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.EMERGENCY_FUND_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your emergency-fund ratio at %s months far exceeds the guideline of [%s, %s] months. "
                                + "High liquidity levels may be better off invested, unless otherwise intended.",
                        USER_VALUE.as(DECIMAL_1), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.LIQUIDITY_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your liquidity ratio is %s months, which is above the typical band of [%s, %s] months. "
                                + "Please review to ensure you're not holding too much in cash.",
                        USER_VALUE.as(DECIMAL_1), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.LIQUIDITY_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your liquidity ratio at %s months is significantly beyond the general [%s, %s] month range. "
                                + "You may want to shift it if it is sitting idle.",
                        USER_VALUE.as(DECIMAL_1), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.ASSET_LIABILITY_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your asset-to-liability ratio is %s, past the typical maximum of %s, indicating a solid net-asset buffer. "
                                + "If you wish to amplify growth you could consider borrowing against your holdings, "
                                + "but review the associated risks and align it with your financial goals.",
                        USER_VALUE.as(DECIMAL_2), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.ASSET_LIABILITY_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your asset-to-liability ratio is exceptionally high at %s, well above the expected maximum of %s. "
                                + "If you're comfortable with additional risk and have a clear investment plan, you may leverage "
                                + "your position to pursue higher returns; otherwise you're already in a very strong position.",
                        USER_VALUE.as(DECIMAL_2), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("Your health-insurance adequacy score is %s, above the expected range [%s, %s]. "
                                + "Please review to ensure you're not over-insured.",
                        USER_VALUE.as(DECIMAL_1), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your health-insurance adequacy of %s is significantly above [%s, %s]. "
                                + "Verify this level of coverage is intentional.",
                        USER_VALUE.as(DECIMAL_1), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("Your term-insurance adequacy score is %s, higher than the usual max of %s. "
                                + "You may wish to review your policy limits.",
                        USER_VALUE.as(DECIMAL_1), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your term-insurance adequacy at %s greatly exceeds %s. Ensure this policy size is deliberate.",
                        USER_VALUE.as(DECIMAL_1), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.NET_WORTH_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("Your net-worth adequacy ratio is %s, above the normal band of [%s, %s]. "
                                + "You might want to confirm your asset valuations.",
                        USER_VALUE.as(DECIMAL_2), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.NET_WORTH_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your net-worth adequacy of %s far exceeds [%s, %s]. "
                                + "Check for anomalies or intentional overvaluation.",
                        USER_VALUE.as(DECIMAL_2), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.RETIREMENT_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("Your retirement adequacy is %s, above the typical target range of [%s, %s]. "
                                + "Impressive readiness, although ensure it's not at the expense of your current lifestyle.",
                        USER_VALUE.as(DECIMAL_1), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.review(MetricName.RETIREMENT_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your retirement adequacy of %s is well beyond [%s, %s]. "
                                + "If you wish, pause retirement investments to fund your current ambitions.",
                        USER_VALUE.as(DECIMAL_1), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));

        b.improvement(MetricName.SAVINGS_INCOME_RATIO, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("You are saving only %s of your income, far below a healthy level.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Cut monthly spending by %s to start saving at least %s of income.",
                        GAP_AMOUNT.as(RUPEES), MIN_VALUE.as(PERCENT)));
        b.improvement(MetricName.SAVINGS_INCOME_RATIO, Verdict.LOW,
                FeedbackTemplate.of("Your savings rate of %s is below the ideal range.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Set aside another %s each month to reach the ideal savings rate.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.SAVINGS_INCOME_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("You are saving %s of income, more than most people at your level.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Put %s a month to work in goal-based investments instead of idle savings.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.SAVINGS_INCOME_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Saving %s of income may be holding back your present lifestyle.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Consider investing or spending about %s a month on your current goals.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.INVESTMENT_INCOME_RATIO, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Only %s of your income is being invested.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Start SIPs of at least %s a month to build long-term wealth.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.INVESTMENT_INCOME_RATIO, Verdict.LOW,
                FeedbackTemplate.of("You invest %s of income, a little under the ideal range.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Increase your monthly SIPs by %s.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.INVESTMENT_INCOME_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("You invest %s of income, above the typical range.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Make sure the extra %s a month isn't squeezing your emergency buffer.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.INVESTMENT_INCOME_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Investing %s of income leaves little room for anything else.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Consider redirecting %s a month to liquidity or near-term goals.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.EXPENSE_INCOME_RATIO, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Your expenses are only %s of income.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Make sure essentials aren't being neglected; spending up to %s more a month is affordable.",
                        GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.EXPENSE_INCOME_RATIO, Verdict.LOW,
                FeedbackTemplate.of("Your expenses are a modest %s of income.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("You have room of about %s a month for planned lifestyle spending.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.EXPENSE_INCOME_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Expenses and EMIs take %s of your income.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Trim discretionary spending by %s a month to get back within %s of income.",
                        GAP_AMOUNT.as(RUPEES), MAX_VALUE.as(PERCENT)));
        b.improvement(MetricName.EXPENSE_INCOME_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("At %s of income, your spending is unsustainable.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Reduce monthly outgoings by at least %s, starting with discretionary items.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.DEBT_INCOME_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("EMIs take %s of your income, above the safe limit.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Prepay or consolidate loans to lower EMIs by %s a month.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.DEBT_INCOME_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("EMIs consume %s of your income, a serious debt burden.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Avoid new borrowing and bring EMIs down by %s a month, highest interest first.",
                        GAP_AMOUNT.as(RUPEES)));

        b.improvement(MetricName.EMERGENCY_FUND_RATIO, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Your emergency fund covers only %s months, which is dangerously low.", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Build at least %s more to reach %s months' worth of expenses.",
                        GAP_AMOUNT.as(RUPEES), MIN_VALUE.as(PLAIN)));
        b.improvement(MetricName.EMERGENCY_FUND_RATIO, Verdict.LOW,
                FeedbackTemplate.of("You have %s months of emergency savings.", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Increase it by %s to hit the %s-month safety buffer.",
                        GAP_AMOUNT.as(RUPEES), MIN_VALUE.as(PLAIN)));
        b.improvement(MetricName.EMERGENCY_FUND_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your emergency fund covers %s months, more than required.", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Consider shifting %s to investments for better returns.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.EMERGENCY_FUND_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("You've overfunded your emergency reserves (%s months).", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Move %s to long-term assets for growth.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.LIQUIDITY_RATIO, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Liquid assets cover only %s months of expenses.", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Boost this by at least %s to handle emergencies effectively.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.LIQUIDITY_RATIO, Verdict.LOW,
                FeedbackTemplate.of("You have limited liquidity (%s months).", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Add %s more to reach the %s to %s month ideal range.",
                        GAP_AMOUNT.as(RUPEES), MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN)));
        b.improvement(MetricName.LIQUIDITY_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your liquidity of %s months is higher than needed.", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Redirect %s to equity or debt investments to optimize returns.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.LIQUIDITY_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("You're holding %s months of expenses in low-return liquid assets.", USER_VALUE.as(DECIMAL_1)),
                FeedbackTemplate.of("Shift %s to more productive investments.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.ASSET_LIABILITY_RATIO, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Your liabilities greatly exceed your assets (ratio: %s).", USER_VALUE.as(DECIMAL_2)),
                FeedbackTemplate.of("Focus on clearing debts or building assets worth %s.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.ASSET_LIABILITY_RATIO, Verdict.LOW,
                FeedbackTemplate.of("Your asset-liability ratio of %s is below safe levels.", USER_VALUE.as(DECIMAL_2)),
                FeedbackTemplate.of("Increase net worth by %s through debt repayment or asset growth.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.ASSET_LIABILITY_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Your assets substantially exceed liabilities (ratio: %s), which is great.", USER_VALUE.as(DECIMAL_2)),
                FeedbackTemplate.of("Maintain or reallocate %s for goal-based planning.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.ASSET_LIABILITY_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Your asset base is very strong (ratio: %s).", USER_VALUE.as(DECIMAL_2)),
                FeedbackTemplate.of("Consider putting %s to work through goal-aligned investments.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.HOUSING_INCOME_RATIO, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("You're spending just %s on housing.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Ensure you're not compromising on safety or convenience."));
        b.improvement(MetricName.HOUSING_INCOME_RATIO, Verdict.LOW,
                FeedbackTemplate.of("Housing expenses are modest at %s. That's efficient.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Consider whether lifestyle upgrades worth %s are justified.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.HOUSING_INCOME_RATIO, Verdict.HIGH,
                FeedbackTemplate.of("Housing takes up %s of your income.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Reduce rent or EMIs by %s if possible.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.HOUSING_INCOME_RATIO, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("At %s, housing is consuming too much of your income.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Consider downsizing or refinancing to free up %s monthly.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Your health cover of %s is dangerously insufficient.", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("Raise it by %s to protect against medical risks.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.LOW,
                FeedbackTemplate.of("You may be underinsured with only %s of health cover.", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("Increase coverage by %s to reach the recommended %s for your family.",
                        GAP_AMOUNT.as(RUPEES), MIN_VALUE.as(RUPEES)));
        b.improvement(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("Your health cover of %s is higher than typical needs.", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("You may review it to optimize %s of cover and save on premiums.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.HEALTH_INSURANCE_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("You're overinsured in health with %s.", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("Consider trimming %s in coverage to reduce costs.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("You have little or no term insurance (%s).", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("Secure your family by adding at least %s in coverage.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.LOW,
                FeedbackTemplate.of("Your term cover of %s may fall short.", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("Increase it by %s to reach the recommended %s.",
                        GAP_AMOUNT.as(RUPEES), MIN_VALUE.as(RUPEES)));
        b.improvement(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("Your term cover of %s is more than required.", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("Assess if %s of cover can be optimized to reduce premiums.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.TERM_INSURANCE_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("Term insurance of %s may be excessive.", USER_VALUE.as(RUPEES)),
                FeedbackTemplate.of("Reduce cover by %s to save on premiums.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.RETIREMENT_ADEQUACY, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Your retirement savings are on course for only %s of the target.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Begin investing at least %s/month to secure your future.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.RETIREMENT_ADEQUACY, Verdict.LOW,
                FeedbackTemplate.of("You're behind on retirement readiness (%s).", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Raise monthly contributions by %s to catch up.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.RETIREMENT_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("You're ahead on retirement (%s).", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("Reassess goals; extra savings of %s/month can support early retirement or legacy planning.",
                        GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.RETIREMENT_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("You've oversaved for retirement at %s.", USER_VALUE.as(PERCENT)),
                FeedbackTemplate.of("You might ease contributions by %s/month and focus on current goals.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.NET_WORTH_ADEQUACY, Verdict.EXTREMELY_LOW,
                FeedbackTemplate.of("Your net worth is critically low for your age."),
                FeedbackTemplate.of("Accelerate asset creation by at least %s annually.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.NET_WORTH_ADEQUACY, Verdict.LOW,
                FeedbackTemplate.of("Your net worth is below expected benchmarks."),
                FeedbackTemplate.of("Build additional assets worth %s to stay financially resilient.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.NET_WORTH_ADEQUACY, Verdict.HIGH,
                FeedbackTemplate.of("Your net worth is higher than your peers'."),
                FeedbackTemplate.of("Consider using %s to explore higher-return or impact-driven opportunities.", GAP_AMOUNT.as(RUPEES)));
        b.improvement(MetricName.NET_WORTH_ADEQUACY, Verdict.EXTREMELY_HIGH,
                FeedbackTemplate.of("You're well ahead in net worth growth."),
                FeedbackTemplate.of("Use this advantage to reduce working years or build legacy plans with %s.", GAP_AMOUNT.as(RUPEES)));

        return b.build();
    }

    private static <T> Optional<T> find(Map<MetricName, Map<Verdict, T>> table, MetricName metric, Verdict verdict) {
        Map<Verdict, T> byVerdict = table.get(metric);
        return byVerdict == null ? Optional.empty() : Optional.ofNullable(byVerdict.get(verdict));
    }

    private static <T> Map<MetricName, Map<Verdict, T>> freeze(Map<MetricName, Map<Verdict, T>> source) {
        Map<MetricName, Map<Verdict, T>> copy = new EnumMap<>(MetricName.class);
        source.forEach((metric, byVerdict) -> copy.put(metric, Collections.unmodifiableMap(new EnumMap<>(byVerdict))));
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {

        private final Map<MetricName, Map<Verdict, FeedbackTemplate>> commendable = new EnumMap<>(MetricName.class);
        private final Map<MetricName, Map<Verdict, FeedbackTemplate>> review = new EnumMap<>(MetricName.class);
        private final Map<MetricName, Map<Verdict, ImprovementTemplate>> improvement = new EnumMap<>(MetricName.class);

        private Builder() {
        }

        public Builder commendable(MetricName metric, Verdict verdict, FeedbackTemplate template) {
            if (!verdict.isCommendable()) {
                throw new IllegalArgumentException(verdict + " is not a commendable verdict");
            }
            put(commendable, metric, verdict, template);
            return this;
        }

        public Builder review(MetricName metric, Verdict verdict, FeedbackTemplate template) {
            if (!verdict.needsReview()) {
                throw new IllegalArgumentException(verdict + " is not a review verdict");
            }
            put(review, metric, verdict, template);
            return this;
        }

        public Builder improvement(MetricName metric, Verdict verdict, FeedbackTemplate currentScenario, FeedbackTemplate actionable) {
            if (!verdict.needsImprovement()) {
                throw new IllegalArgumentException(verdict + " is not an improvement verdict");
            }
            put(improvement, metric, verdict, new ImprovementTemplate(currentScenario, actionable));
            return this;
        }

        public FeedbackTemplateCatalog build() {
            return new FeedbackTemplateCatalog(this);
        }

        private static <T> void put(Map<MetricName, Map<Verdict, T>> table, MetricName metric, Verdict verdict, T template) {
            Objects.requireNonNull(metric, "metric must not be null");
            Objects.requireNonNull(template, "template must not be null");
            table.computeIfAbsent(metric, m -> new EnumMap<>(Verdict.class)).put(verdict, template);
        }
    }
}
