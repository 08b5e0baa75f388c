package com.gillianbc.finhealth.model;

import lombok.Value;

import java.util.Map;

/**
 * Term definitions shown alongside a report.
 */
@Value
public class Glossary {

    Map<String, Object> terms;

    public Glossary(Map<String, Object> terms) {
        this.terms = Map.copyOf(terms);
    }
}
