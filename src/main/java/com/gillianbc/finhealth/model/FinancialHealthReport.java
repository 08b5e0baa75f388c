package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Output of one analysis: the scored metrics, the feedback lists and the scoring table.
 * The glossary is reference text attached unmodified for report renderers.
 */
@Value
@Builder
public class FinancialHealthReport {

    PersonalFinanceMetrics metrics;
    FeedbackReport feedback;
    ScoringTable scoringTable;
    Map<String, Object> glossary;

    public BigDecimal totalScore() {
        return scoringTable.totalPoints();
    }
}
