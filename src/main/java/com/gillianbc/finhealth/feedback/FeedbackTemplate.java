package com.gillianbc.finhealth.feedback;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A feedback sentence with {@code %s} slots, each bound to a declared {@link Placeholder}.
 * <pre>
 *   FeedbackTemplate.of("Saving %s of income.", TemplateVariable.USER_VALUE.as(Style.PERCENT))
 * </pre>
 * Only the declared variables are needed to render; anything else in the context is ignored.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FeedbackTemplate {

    private static final String SLOT = "%s";

    private final String text;
    private final List<Placeholder> placeholders;

    private FeedbackTemplate(String text, List<Placeholder> placeholders) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.placeholders = List.copyOf(placeholders);
        int slots = countSlots(text);
        if (slots != this.placeholders.size()) {
            throw new IllegalArgumentException("Template has " + slots + " slots but "
                    + this.placeholders.size() + " placeholders: " + text);
        }
    }

    public static FeedbackTemplate of(String text, Placeholder... placeholders) {
        return new FeedbackTemplate(text, List.of(placeholders));
    }

    public Set<TemplateVariable> requiredVariables() {
        Set<TemplateVariable> vars = EnumSet.noneOf(TemplateVariable.class);
        placeholders.forEach(p -> vars.add(p.getVariable()));
        return vars;
    }

    /**
     * @throws IllegalArgumentException when a declared variable has no value in {@code context}
     */
    public String render(Map<TemplateVariable, BigDecimal> context) {
        StringBuilder sb = new StringBuilder();
        int from = 0;
        for (Placeholder placeholder : placeholders) {
            BigDecimal value = context.get(placeholder.getVariable());
            if (value == null) {
                throw new IllegalArgumentException("No value for " + placeholder.getVariable() + " in: " + text);
            }
            int at = text.indexOf(SLOT, from);
            sb.append(text, from, at).append(placeholder.format(value));
            from = at + SLOT.length();
        }
        sb.append(text.substring(from));
        return sb.toString();
    }

    private static int countSlots(String text) {
        int count = 0;
        int at = text.indexOf(SLOT);
        while (at >= 0) {
            count++;
            at = text.indexOf(SLOT, at + SLOT.length());
        }
        return count;
    }
}
