package com.gillianbc.finhealth.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * One row per assessable metric followed by a "Total" row summing the points awarded.
 */
@Value
public class ScoringTable {

    public static final String TOTAL_LABEL = "Total";

    List<ScoringTableRow> rows;

    public ScoringTable(List<ScoringTableRow> rows) {
        this.rows = List.copyOf(rows);
    }

    public BigDecimal totalPoints() {
        if (rows.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return rows.get(rows.size() - 1).getPointsAwarded();
    }

    /**
     * @return the per-metric rows, without the totals row
     */
    public List<ScoringTableRow> metricRows() {
        return rows.isEmpty() ? rows : rows.subList(0, rows.size() - 1);
    }
}
