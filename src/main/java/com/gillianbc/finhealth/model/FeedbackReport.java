package com.gillianbc.finhealth.model;

import lombok.Value;

import java.util.List;

/**
 * The three ordered feedback lists. A metric appears in at most one of them.
 */
@Value
public class FeedbackReport {

    List<CommendablePoint> commendableAreas;
    List<ReviewPoint> reviewAreas;
    List<ImprovementPoint> areasForImprovement;

    public FeedbackReport(List<CommendablePoint> commendableAreas,
                          List<ReviewPoint> reviewAreas,
                          List<ImprovementPoint> areasForImprovement) {
        this.commendableAreas = List.copyOf(commendableAreas);
        this.reviewAreas = List.copyOf(reviewAreas);
        this.areasForImprovement = List.copyOf(areasForImprovement);
    }
}
