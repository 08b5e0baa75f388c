package com.gillianbc.finhealth.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum MaritalStatus {
    @JsonProperty("Married") MARRIED,
    @JsonProperty("Unmarried") UNMARRIED
}
