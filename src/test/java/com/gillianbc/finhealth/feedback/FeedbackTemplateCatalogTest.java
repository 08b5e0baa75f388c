package com.gillianbc.finhealth.feedback;

import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedbackTemplateCatalogTest {

    private final FeedbackTemplateCatalog catalog = FeedbackTemplateCatalog.defaults();

    @Test
    @DisplayName("Every metric has commendable text for good and excellent")
    void defaults_commendableComplete() {
        for (MetricName metric : MetricName.values()) {
            assertTrue(catalog.commendable(metric, Verdict.GOOD).isPresent(), metric.key());
            assertTrue(catalog.commendable(metric, Verdict.EXCELLENT).isPresent(), metric.key());
        }
    }

    @Test
    @DisplayName("Expense, debt and housing have no review text")
    void defaults_reviewGaps() {
        Set<MetricName> noReview = EnumSet.of(MetricName.EXPENSE_INCOME_RATIO, MetricName.DEBT_INCOME_RATIO,
                MetricName.HOUSING_INCOME_RATIO);
        for (MetricName metric : MetricName.values()) {
            boolean expected = !noReview.contains(metric);
            assertTrue(catalog.review(metric, Verdict.HIGH).isPresent() == expected, metric.key());
            assertTrue(catalog.review(metric, Verdict.EXTREMELY_HIGH).isPresent() == expected, metric.key());
        }
    }

    @Test
    @DisplayName("Every out-of-range verdict has improvement text, except low debt")
    void defaults_improvementCoverage() {
        for (MetricName metric : MetricName.values()) {
            for (Verdict verdict : Verdict.values()) {
                if (!verdict.needsImprovement()) {
                    continue;
                }
                boolean lowDebt = metric == MetricName.DEBT_INCOME_RATIO && verdict.isBelowRange();
                assertTrue(catalog.improvement(metric, verdict).isPresent() != lowDebt, metric.key() + " " + verdict);
            }
        }
    }

    @Test
    @DisplayName("Marker verdicts have no text anywhere")
    void defaults_noMarkerText() {
        assertFalse(catalog.commendable(MetricName.SAVINGS_INCOME_RATIO, Verdict.ERROR_COMPUTING_METRIC).isPresent());
        assertFalse(catalog.improvement(MetricName.SAVINGS_INCOME_RATIO, Verdict.NO_BENCHMARK_PROVIDED).isPresent());
    }

    @Test
    @DisplayName("The builder only accepts verdicts that fit the list")
    void builder_rejectsWrongVerdict() {
        FeedbackTemplate text = FeedbackTemplate.of("text");
        FeedbackTemplateCatalog.Builder builder = FeedbackTemplateCatalog.builder();

        assertThrows(IllegalArgumentException.class,
                () -> builder.commendable(MetricName.SAVINGS_INCOME_RATIO, Verdict.LOW, text));
        assertThrows(IllegalArgumentException.class,
                () -> builder.review(MetricName.SAVINGS_INCOME_RATIO, Verdict.LOW, text));
        assertThrows(IllegalArgumentException.class,
                () -> builder.improvement(MetricName.SAVINGS_INCOME_RATIO, Verdict.GOOD, text, text));
    }

    @Test
    @DisplayName("An empty catalog finds nothing")
    void builder_empty() {
        FeedbackTemplateCatalog empty = FeedbackTemplateCatalog.builder().build();
        assertFalse(empty.commendable(MetricName.SAVINGS_INCOME_RATIO, Verdict.GOOD).isPresent());
        assertFalse(empty.review(MetricName.SAVINGS_INCOME_RATIO, Verdict.HIGH).isPresent());
    }
}
