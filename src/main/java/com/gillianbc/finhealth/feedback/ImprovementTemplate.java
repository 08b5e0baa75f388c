package com.gillianbc.finhealth.feedback;

import lombok.Value;

import java.util.Objects;

/**
 * What is wrong, and what to do about it.
 */
@Value
public class ImprovementTemplate {

    FeedbackTemplate currentScenario;
    FeedbackTemplate actionable;

    public ImprovementTemplate(FeedbackTemplate currentScenario, FeedbackTemplate actionable) {
        this.currentScenario = Objects.requireNonNull(currentScenario, "currentScenario must not be null");
        this.actionable = Objects.requireNonNull(actionable, "actionable must not be null");
    }
}
