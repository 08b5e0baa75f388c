package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.TestProfiles;
import com.gillianbc.finhealth.config.FinanceHealthProperties;
import com.gillianbc.finhealth.exception.FeedbackAssemblyException;
import com.gillianbc.finhealth.feedback.FeedbackTemplateCatalog;
import com.gillianbc.finhealth.feedback.HeaderTemplates;
import com.gillianbc.finhealth.model.CommendablePoint;
import com.gillianbc.finhealth.model.FeedbackPoint;
import com.gillianbc.finhealth.model.FeedbackReport;
import com.gillianbc.finhealth.model.ImprovementPoint;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.ReviewPoint;
import com.gillianbc.finhealth.model.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class FeedbackAssemblerTest {

    private final FinanceHealthProperties properties = TestProfiles.properties();

    private PersonalFinanceMetrics classified(UserProfile profile) {
        PersonalFinanceMetrics pfm = TestProfiles.metricsCalculator(properties).calculate(profile);
        pfm = TestProfiles.benchmarkResolver().attachBenchmarks(pfm);
        return new VerdictClassifier(properties).classifyAll(pfm);
    }

    private static List<String> names(List<? extends FeedbackPoint> points) {
        return points.stream().map(FeedbackPoint::getMetricName).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Standard profile: savings for review, nothing to improve, the rest commended by priority")
    void assemble_standardProfile() {
        UserProfile profile = TestProfiles.standard();
        FeedbackReport report = TestProfiles.feedbackAssembler(properties, new Random(42)).assemble(profile, classified(profile));
        log.info("Feedback {}", report);

        assertEquals(List.of("savings_income_ratio"), names(report.getReviewAreas()));
        assertTrue(report.getAreasForImprovement().isEmpty());
        assertEquals(List.of("emergency_fund_ratio", "health_insurance_adequacy", "term_insurance_adequacy",
                        "retirement_adequacy", "investment_income_ratio", "expense_income_ratio", "debt_income_ratio", "liquidity_ratio",
                        "housing_income_ratio", "net_worth_adequacy", FeedbackAssembler.DEBT_FREE),
                names(report.getCommendableAreas()));
    }

    @Test
    @DisplayName("Rendered text carries the metric values")
    void assemble_renderedText() {
        UserProfile profile = TestProfiles.standard();
        FeedbackReport report = TestProfiles.feedbackAssembler(properties, new Random(42)).assemble(profile, classified(profile));

        ReviewPoint savings = report.getReviewAreas().get(0);
        assertEquals("Your savings-to-income ratio is a striking 0.40, well beyond the expected range [0.13, 0.24]. "
                + "If this is unintentional, it may be holding you back from a better lifestyle.", savings.getCurrentScenario());

        CommendablePoint health = report.getCommendableAreas().get(1);
        assertEquals("Health insurance cover is ₹1,000,000. You're well protected.", health.getCurrentScenario());
        assertTrue(health.getHeader().contains("Health Insurance Adequacy"));

        CommendablePoint retirement = report.getCommendableAreas().get(3);
        assertEquals("Retirement corpus at 130% of target. You're on track, great foresight!", retirement.getCurrentScenario());

        UserProfile indebted = TestProfiles.withLoans();
        FeedbackReport loans = TestProfiles.feedbackAssembler(properties, new Random(42)).assemble(indebted, classified(indebted));
        // (100000 - 60000 - 33000) / 100000 against [0.13, 0.24]
        ImprovementPoint lowSavings = loans.getAreasForImprovement().stream()
                .filter(point -> point.getMetricName().equals("savings_income_ratio"))
                .findFirst()
                .orElseThrow();
        assertEquals("You are saving only 7% of your income, far below a healthy level.", lowSavings.getCurrentScenario());
        assertEquals("Cut monthly spending by ₹6,000 to start saving at least 13% of income.", lowSavings.getActionable());
    }

    @Test
    @DisplayName("No metric appears in more than one list")
    void assemble_noDuplicates() {
        for (UserProfile profile : List.of(TestProfiles.standard(), TestProfiles.withLoans())) {
            FeedbackReport report = TestProfiles.feedbackAssembler(properties, new Random()).assemble(profile, classified(profile));
            List<String> all = Stream.of(report.getCommendableAreas(), report.getReviewAreas(), report.getAreasForImprovement())
                    .flatMap(List::stream)
                    .map(FeedbackPoint::getMetricName)
                    .collect(Collectors.toList());
            Set<String> unique = new HashSet<>(all);
            assertEquals(unique.size(), all.size(), all.toString());
        }
    }

    @Test
    @DisplayName("Only debt-free profiles get the debt-free point, and always last")
    void assemble_debtFreePoint() {
        UserProfile standard = TestProfiles.standard();
        FeedbackReport debtFree = TestProfiles.feedbackAssembler(properties, new Random(1)).assemble(standard, classified(standard));
        CommendablePoint last = debtFree.getCommendableAreas().get(debtFree.getCommendableAreas().size() - 1);
        assertEquals(FeedbackAssembler.DEBT_FREE, last.getMetricName());
        assertEquals(HeaderTemplates.DEBT_FREE, last.getHeader());

        UserProfile indebted = TestProfiles.withLoans();
        FeedbackReport loans = TestProfiles.feedbackAssembler(properties, new Random(1)).assemble(indebted, classified(indebted));
        assertFalse(names(loans.getCommendableAreas()).contains(FeedbackAssembler.DEBT_FREE));
        assertTrue(names(loans.getAreasForImprovement()).contains("savings_income_ratio"));
    }

    @Test
    @DisplayName("A seeded random source makes the report repeatable")
    void assemble_seededIsDeterministic() {
        UserProfile profile = TestProfiles.withLoans();
        PersonalFinanceMetrics pfm = classified(profile);
        assertEquals(TestProfiles.feedbackAssembler(properties, new Random(7)).assemble(profile, pfm),
                TestProfiles.feedbackAssembler(properties, new Random(7)).assemble(profile, pfm));
    }

    @Test
    @DisplayName("Metrics without text fall back to the generic sentences")
    void assemble_emptyCatalog_usesFallbacks() {
        FeedbackAssembler assembler = new FeedbackAssembler(FeedbackTemplateCatalog.builder().build(),
                new HeaderGenerator(new Random(3)), new GapCalculator(properties));
        UserProfile profile = TestProfiles.standard();
        FeedbackReport report = assembler.assemble(profile, classified(profile));

        assertTrue(report.getReviewAreas().isEmpty());
        assertEquals(List.of("savings_income_ratio"), names(report.getAreasForImprovement()));
        ImprovementPoint savings = report.getAreasForImprovement().get(0);
        assertEquals("Metric value is far from ideal.", savings.getCurrentScenario());
        assertEquals("Optimize for a healthier financial future.", savings.getActionable());
        assertEquals("Metric values are well within ideal ranges. Great work!",
                report.getCommendableAreas().get(0).getCurrentScenario());
    }

    @Test
    @DisplayName("Missing profile or metrics are rejected")
    void assemble_missingInputs_throw() {
        FeedbackAssembler assembler = TestProfiles.feedbackAssembler(properties, new Random());
        UserProfile profile = TestProfiles.standard();
        PersonalFinanceMetrics pfm = classified(profile);

        assertThrows(FeedbackAssemblyException.class, () -> assembler.assemble(null, pfm));
        assertThrows(FeedbackAssemblyException.class, () -> assembler.assemble(profile, null));
    }
}
