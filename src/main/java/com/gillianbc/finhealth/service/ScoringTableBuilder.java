package com.gillianbc.finhealth.service;

import com.gillianbc.finhealth.model.Metric;
import com.gillianbc.finhealth.model.PersonalFinanceMetrics;
import com.gillianbc.finhealth.model.ScoringTable;
import com.gillianbc.finhealth.model.ScoringTableRow;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Service
public class ScoringTableBuilder {

    static final String NOT_AVAILABLE = "N/A";
    static final String ERROR = "Error";

    public ScoringTable build(PersonalFinanceMetrics pfm) {
        List<ScoringTableRow> rows = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        for (Metric metric : pfm.assessableMetrics()) {
            BigDecimal points = metric.getAssignedScore() == null ? BigDecimal.ZERO : metric.getAssignedScore();
            total = total.add(points);
            rows.add(ScoringTableRow.builder()
                    .metric(metric.getName().displayName())
                    .weightAssigned(String.valueOf(metric.getWeight()))
                    .benchmark(metric.hasBenchmark() ? metric.getBenchmark().describe() : NOT_AVAILABLE)
                    .userValue(metric.hasError() ? ERROR : metric.getValue().toPlainString())
                    .verdict(metric.getVerdict() == null ? NOT_AVAILABLE : metric.getVerdict().displayName())
                    .pointsAwarded(points)
                    .build());
        }
        rows.add(ScoringTableRow.builder()
                .metric(ScoringTable.TOTAL_LABEL)
                .weightAssigned("")
                .benchmark("")
                .userValue("")
                .verdict("")
                .pointsAwarded(total)
                .build());
        return new ScoringTable(rows);
    }
}
