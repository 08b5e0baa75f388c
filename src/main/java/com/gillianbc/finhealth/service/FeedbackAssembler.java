package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.exception.FeedbackAssemblyException;
import com.gillianbc.finhealth.feedback.FeedbackTemplate;
import com.gillianbc.finhealth.feedback.FeedbackTemplateCatalog;
import com.gillianbc.finhealth.feedback.HeaderTemplates;
import com.gillianbc.finhealth.feedback.ImprovementTemplate;
import com.gillianbc.finhealth.feedback.PriorityScheme;
import com.gillianbc.finhealth.feedback.TemplateVariable;
import com.gillianbc.finhealth.model.CommendablePoint;
import com.gillianbc.finhealth.model.FeedbackReport;
import com.gillianbc.finhealth.model.ImprovementPoint;
import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.ReviewPoint;
import com.gillianbc.finhealth.model.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns classified metrics into commendable, review and improvement points.
 * <p>
 * Each metric lands in at most one list. Above-range metrics go to review when a review
 * template exists for them, and otherwise to improvement. Each list is ordered by the
 * {@link PriorityScheme} for the user's age. A debt-free profile gets an extra commendable
 * point at the end.
 * <p>
 * Holds no per-call state, so one instance can serve concurrent analyses.
 */
@Slf4j
@Service
public class FeedbackAssembler {

    public static final String DEBT_FREE = "debt_free";

    private final FeedbackTemplateCatalog catalog;
    private final HeaderGenerator headerGenerator;
    private final GapCalculator gapCalculator;

    public FeedbackAssembler(FeedbackTemplateCatalog catalog, HeaderGenerator headerGenerator, GapCalculator gapCalculator) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.headerGenerator = Objects.requireNonNull(headerGenerator, "headerGenerator must not be null");
        this.gapCalculator = Objects.requireNonNull(gapCalculator, "gapCalculator must not be null");
    }

    /**
     * @throws FeedbackAssemblyException when the profile or the derived metrics are missing
     */
    public FeedbackReport assemble(UserProfile profile, PersonalFinanceMetrics pfm) {
        if (profile == null || pfm == null) {
            log.error("Cannot assemble feedback: profile present={}, metrics present={}", profile != null, pfm != null);
            throw new FeedbackAssemblyException(profile == null
                    ? "No user profile was provided for feedback."
                    : "No derived metrics were provided for feedback.");
        }
        int age = profile.getPersonalData().getAge();
        Set<MetricName> analysed = EnumSet.noneOf(MetricName.class);

        List<ReviewPoint> review = new ArrayList<>();
        for (Metric metric : pfm.assessableMetrics()) {
            if (metric.getVerdict() == null || !metric.getVerdict().needsReview()) {
                continue;
            }
            Optional<FeedbackTemplate> template = catalog.review(metric.getName(), metric.getVerdict());
            if (template.isPresent()) {
                review.add(new ReviewPoint(metric.getName().key(), headerGenerator.header(metric),
                        template.get().render(reviewContext(metric))));
                analysed.add(metric.getName());
            }
        }

        List<ImprovementPoint> improvement = new ArrayList<>();
        for (Metric metric : pfm.assessableMetrics()) {
            if (metric.getVerdict() == null || !metric.getVerdict().needsImprovement() || analysed.contains(metric.getName())) {
                continue;
            }
            improvement.add(improvementPoint(metric, pfm, profile));
            analysed.add(metric.getName());
        }

        List<CommendablePoint> commendable = new ArrayList<>();
        for (Metric metric : pfm.assessableMetrics()) {
            if (metric.getVerdict() == null || !metric.getVerdict().isCommendable() || analysed.contains(metric.getName())) {
                continue;
            }
            commendable.add(commendablePoint(metric, pfm, profile));
            analysed.add(metric.getName());
        }

        commendable = PriorityScheme.sort(commendable, age);
        if (profile.getLiabilityData().isDebtFree()) {
            commendable.add(new CommendablePoint(DEBT_FREE, HeaderTemplates.DEBT_FREE,
                    FeedbackTemplateCatalog.DEBT_FREE.render(Map.of())));
        }
        FeedbackReport report = new FeedbackReport(commendable,
                PriorityScheme.sort(review, age),
                PriorityScheme.sort(improvement, age));
        log.info("Feedback assembled: {} commendable, {} review, {} improvement",
                report.getCommendableAreas().size(), report.getReviewAreas().size(), report.getAreasForImprovement().size());
        return report;
    }

    private CommendablePoint commendablePoint(Metric metric, PersonalFinanceMetrics pfm, UserProfile profile) {
        FeedbackTemplate template = catalog.commendable(metric.getName(), metric.getVerdict()).orElseGet(() -> {
            log.warn("No commendable template for {} / {}, using the generic text", metric.getName().key(), metric.getVerdict().label());
            return FeedbackTemplateCatalog.COMMENDABLE_FALLBACK;
        });
        Map<TemplateVariable, BigDecimal> context = new EnumMap<>(TemplateVariable.class);
        context.put(TemplateVariable.USER_VALUE, displayValue(metric, profile));
        putBounds(context, metric, pfm, profile);
        return new CommendablePoint(metric.getName().key(), headerGenerator.header(metric), template.render(context));
    }

    private ImprovementPoint improvementPoint(Metric metric, PersonalFinanceMetrics pfm, UserProfile profile) {
        ImprovementTemplate template = catalog.improvement(metric.getName(), metric.getVerdict()).orElseGet(() -> {
            log.warn("No improvement template for {} / {}, using the generic text", metric.getName().key(), metric.getVerdict().label());
            return FeedbackTemplateCatalog.IMPROVEMENT_FALLBACK;
        });
        Map<TemplateVariable, BigDecimal> context = new EnumMap<>(TemplateVariable.class);
        context.put(TemplateVariable.USER_VALUE, displayValue(metric, profile));
        context.put(TemplateVariable.GAP_AMOUNT, gapCalculator.gap(metric, pfm, profile));
        putBounds(context, metric, pfm, profile);
        return new ImprovementPoint(metric.getName().key(), headerGenerator.header(metric),
                template.getCurrentScenario().render(context),
                template.getActionable().render(context));
    }

    private static Map<TemplateVariable, BigDecimal> reviewContext(Metric metric) {
        Map<TemplateVariable, BigDecimal> context = new EnumMap<>(TemplateVariable.class);
        context.put(TemplateVariable.USER_VALUE, metric.getValue());
        context.put(TemplateVariable.MIN_VALUE, metric.getBenchmark().getMin());
        context.put(TemplateVariable.MAX_VALUE, metric.getBenchmark().getMax());
        return context;
    }

    // Insurance bounds are expressed as cover amounts
    private void putBounds(Map<TemplateVariable, BigDecimal> context, Metric metric, PersonalFinanceMetrics pfm, UserProfile profile) {
        BigDecimal scale = BigDecimal.ONE;
        if (metric.getName() == MetricName.HEALTH_INSURANCE_ADEQUACY) {
            scale = gapCalculator.requiredMedicalCover(profile);
        } else if (metric.getName() == MetricName.TERM_INSURANCE_ADEQUACY) {
            scale = gapCalculator.requiredTermCover(pfm);
        }
        context.put(TemplateVariable.MIN_VALUE, metric.getBenchmark().getMin().multiply(scale));
        context.put(TemplateVariable.MAX_VALUE, metric.getBenchmark().getMax().multiply(scale));
    }

    private static BigDecimal displayValue(Metric metric, UserProfile profile) {
        switch (metric.getName()) {
            case HEALTH_INSURANCE_ADEQUACY:
                return profile.getInsuranceData().getTotalMedicalCover();
            case TERM_INSURANCE_ADEQUACY:
                return profile.getInsuranceData().getTotalTermCover();
            default:
                return metric.getValue();
        }
    }
}
