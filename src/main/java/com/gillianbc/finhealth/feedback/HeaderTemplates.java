package com.gillianbc.finhealth.feedback;

import java.util.List;

/**
 * Phrasing pools for feedback headers. {@code %s} is replaced by the metric's display name.
 */
public final class HeaderTemplates {

    public static final List<String> RATIO_GOOD = List.of(
            "Good %s", "Optimal %s", "Strong %s", "Healthy %s");
    public static final List<String> RATIO_HIGH = List.of(
            "High %s", "Excessive %s", "Above normal %s", "Higher than ideal %s");
    public static final List<String> RATIO_LOW = List.of(
            "Low %s", "%s very low", "Below average %s", "Lower than ideal %s");
    public static final List<String> ADEQUACY_GOOD = List.of(
            "Good %s", "Strong %s", "Stable %s");
    public static final List<String> ADEQUACY_BAD = List.of(
            "Inadequate %s", "Insufficient %s");

    public static final String DEBT_FREE = "Debt Free";

    private HeaderTemplates() {
    }
}
