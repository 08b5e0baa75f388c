package com.gillianbc.finhealth.feedback;

/**
 * Values a feedback template can refer to.
 */
public enum TemplateVariable {

    USER_VALUE,
    GAP_AMOUNT,
    MIN_VALUE,
    MAX_VALUE;

    public Placeholder as(Placeholder.Style style) {
        return new Placeholder(this, style);
    }
}
