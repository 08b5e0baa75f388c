package com.gillianbc.finhealth.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RiskProfile {
    @JsonProperty("Conservative") CONSERVATIVE,
    @JsonProperty("Moderate") MODERATE,
    @JsonProperty("Aggressive") AGGRESSIVE
}
