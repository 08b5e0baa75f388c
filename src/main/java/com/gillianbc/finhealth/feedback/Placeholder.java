package com.gillianbc.finhealth.feedback;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * One slot in a {@link FeedbackTemplate}: which variable goes there and how it is printed.
 */
@Value
public class Placeholder {

    public enum Style {
        /** 4.2 */
        DECIMAL_1,
        /** 4.25 */
        DECIMAL_2,
        /** 0.4 as 40% */
        PERCENT,
        /** rupee amount with thousands separators, no decimals */
        RUPEES,
        /** as few digits as needed, e.g. 0.2 or 6 */
        PLAIN
    }

    private static final String RUPEE = "₹";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    TemplateVariable variable;
    Style style;

    public Placeholder(TemplateVariable variable, Style style) {
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.style = Objects.requireNonNull(style, "style must not be null");
    }

    public String format(BigDecimal value) {
        switch (style) {
            case DECIMAL_1:
                return String.format(Locale.ENGLISH, "%.1f", value);
            case DECIMAL_2:
                return String.format(Locale.ENGLISH, "%.2f", value);
            case PERCENT:
                return value.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).toPlainString() + "%";
            case RUPEES:
                return RUPEE + String.format(Locale.ENGLISH, "%,.0f", value.setScale(0, RoundingMode.HALF_UP));
            case PLAIN:
            default:
                return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
        }
    }
}
