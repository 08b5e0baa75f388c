package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.exception.MissingProfileException;
import com.gillianbc.finhealth.model.FeedbackReport;
import com.gillianbc.finhealth.model.FinancialHealthReport;
import com.gillianbc.finhealth.model.Glossary;
import com.gillianbc.finhealth.model.MetricName;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one analysis end to end:
 * weights, metrics, benchmarks, verdicts, scores, feedback and the scoring table.
 */
@Slf4j
@Service
public class FinancialHealthAnalyzer {

    private final MetricsCalculator metricsCalculator;
    private final BenchmarkResolver benchmarkResolver;
    private final VerdictClassifier verdictClassifier;
    private final Scorer scorer;
    private final WeightNormalizer weightNormalizer;
    private final FeedbackAssembler feedbackAssembler;
    private final ScoringTableBuilder scoringTableBuilder;
    private final Glossary glossary;

    public FinancialHealthAnalyzer(MetricsCalculator metricsCalculator,
                                   BenchmarkResolver benchmarkResolver,
                                   VerdictClassifier verdictClassifier,
                                   Scorer scorer,
                                   WeightNormalizer weightNormalizer,
                                   FeedbackAssembler feedbackAssembler,
                                   ScoringTableBuilder scoringTableBuilder,
                                   Glossary glossary) {
        this.metricsCalculator = Objects.requireNonNull(metricsCalculator, "metricsCalculator must not be null");
        this.benchmarkResolver = Objects.requireNonNull(benchmarkResolver, "benchmarkResolver must not be null");
        this.verdictClassifier = Objects.requireNonNull(verdictClassifier, "verdictClassifier must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.weightNormalizer = Objects.requireNonNull(weightNormalizer, "weightNormalizer must not be null");
        this.feedbackAssembler = Objects.requireNonNull(feedbackAssembler, "feedbackAssembler must not be null");
        this.scoringTableBuilder = Objects.requireNonNull(scoringTableBuilder, "scoringTableBuilder must not be null");
        this.glossary = Objects.requireNonNull(glossary, "glossary must not be null");
    }

    public FinancialHealthReport analyse(UserProfile profile) {
        return analyse(profile, null);
    }

    /**
     * @param rawWeights weights keyed by metric name; null or empty uses {@link DefaultWeights}.
     *                   Unknown names are ignored and the rest are normalised to sum to 100.
     */
    public FinancialHealthReport analyse(UserProfile profile, Map<String, ? extends Number> rawWeights) {
        if (profile == null) {
            throw new MissingProfileException();
        }
        Map<MetricName, Integer> weights = resolveWeights(rawWeights);

        PersonalFinanceMetrics pfm = metricsCalculator.calculate(profile);
        pfm = benchmarkResolver.attachBenchmarks(pfm);
        pfm = verdictClassifier.classifyAll(pfm);
        pfm = scorer.scoreAll(pfm, weights);
        FeedbackReport feedback = feedbackAssembler.assemble(profile, pfm);

        FinancialHealthReport report = FinancialHealthReport.builder()
                .metrics(pfm)
                .feedback(feedback)
                .scoringTable(scoringTableBuilder.build(pfm))
                .glossary(glossary.getTerms())
                .build();
        log.info("Analysis complete, total score {}", report.totalScore());
        return report;
    }

    Map<MetricName, Integer> resolveWeights(Map<String, ? extends Number> rawWeights) {
        if (rawWeights == null || rawWeights.isEmpty()) {
            return DefaultWeights.weights();
        }
        Map<String, Number> known = new LinkedHashMap<>();
        rawWeights.forEach((name, weight) -> {
            Optional<MetricName> metric = MetricName.fromKey(name);
            if (metric.isPresent()) {
                known.put(metric.get().key(), weight);
            } else {
                log.warn("Ignoring weight for unknown metric '{}'", name);
            }
        });
        if (known.isEmpty()) {
            log.warn("No weights matched a known metric, using the defaults");
            return DefaultWeights.weights();
        }
        Map<MetricName, Integer> weights = new EnumMap<>(MetricName.class);
        weightNormalizer.normalize(known).forEach((key, weight) ->
                weights.put(MetricName.fromKey(key).orElseThrow(), weight));
        return Collections.unmodifiableMap(weights);
    }
}
