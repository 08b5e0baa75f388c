package com.gillianbc.finhealth.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One display row of the scoring table. Text columns are blank on the totals row.
 */
@Value
@Builder
public class ScoringTableRow {

    String metric;
    String weightAssigned;
    String benchmark;
    String userValue;
    String verdict;
    BigDecimal pointsAwarded;
}
