package com.gillianbc.finhealth.feedback;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.gillianbc.finhealth.feedback.Placeholder.Style.DECIMAL_1;
import static com.gillianbc.finhealth.feedback.Placeholder.Style.PERCENT;
import static com.gillianbc.finhealth.feedback.Placeholder.Style.PLAIN;
import static com.gillianbc.finhealth.feedback.Placeholder.Style.RUPEES;
import static com.gillianbc.finhealth.feedback.TemplateVariable.GAP_AMOUNT;
import static com.gillianbc.finhealth.feedback.TemplateVariable.MAX_VALUE;
import static com.gillianbc.finhealth.feedback.TemplateVariable.MIN_VALUE;
import static com.gillianbc.finhealth.feedback.TemplateVariable.USER_VALUE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FeedbackTemplateTest {

    private static Map<TemplateVariable, BigDecimal> context(String user, String gap) {
        Map<TemplateVariable, BigDecimal> context = new EnumMap<>(TemplateVariable.class);
        context.put(USER_VALUE, new BigDecimal(user));
        context.put(GAP_AMOUNT, new BigDecimal(gap));
        return context;
    }

    @ParameterizedTest(name = "{0} as {1} -> {2}")
    @CsvSource({
            "7.00,       DECIMAL_1, 7.0",
            "2.456,      DECIMAL_2, 2.46",
            "0.4,        PERCENT,   40%",
            "0.085,      PERCENT,   9%",
            "1234567.5,  RUPEES,    '₹1,234,568'",
            "999,        RUPEES,    ₹999",
            "0.20,       PLAIN,     0.2",
            "6.00,       PLAIN,     6",
            "0.0,        PLAIN,     0"
    })
    @DisplayName("Each style prints values its own way")
    void placeholder_styles(String value, Placeholder.Style style, String expected) {
        assertEquals(expected, USER_VALUE.as(style).format(new BigDecimal(value)));
    }

    @Test
    @DisplayName("Slots are filled in declaration order")
    void render_fillsSlotsInOrder() {
        FeedbackTemplate template = FeedbackTemplate.of("%s months, short by %s.", USER_VALUE.as(DECIMAL_1), GAP_AMOUNT.as(RUPEES));
        assertEquals("3.5 months, short by ₹12,000.", template.render(context("3.5", "12000")));
    }

    @Test
    @DisplayName("A variable may be used twice; extra context entries are ignored")
    void render_repeatsAndIgnoresExtras() {
        FeedbackTemplate template = FeedbackTemplate.of("%s (that is %s)", USER_VALUE.as(PERCENT), USER_VALUE.as(PLAIN));
        assertEquals("25% (that is 0.25)", template.render(context("0.25", "1")));
        assertEquals(Set.of(USER_VALUE), template.requiredVariables());
    }

    @Test
    @DisplayName("Templates without slots render as-is")
    void render_noSlots() {
        assertEquals("Keep it up.", FeedbackTemplate.of("Keep it up.").render(Map.of()));
    }

    @Test
    @DisplayName("Rendering without a declared variable fails")
    void render_missingVariable_throws() {
        FeedbackTemplate template = FeedbackTemplate.of("[%s, %s]", MIN_VALUE.as(PLAIN), MAX_VALUE.as(PLAIN));
        assertThrows(IllegalArgumentException.class, () -> template.render(context("1", "2")));
    }

    @Test
    @DisplayName("Slot and placeholder counts must agree")
    void of_mismatchedSlots_throws() {
        assertThrows(IllegalArgumentException.class, () -> FeedbackTemplate.of("%s and %s", USER_VALUE.as(PLAIN)));
        assertThrows(IllegalArgumentException.class, () -> FeedbackTemplate.of("none", USER_VALUE.as(PLAIN)));
    }
}
