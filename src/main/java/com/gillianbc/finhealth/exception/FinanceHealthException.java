package com.gillianbc.finhealth.exception;

/**
 * Base type for structural failures that abort an analysis. Per-metric arithmetic problems
 * are not exceptions; see {@link com.gillianbc.finhealth.model.MetricError}.
 */
public class FinanceHealthException extends RuntimeException {

    public FinanceHealthException(String message) {
        super(message);
    }

    public FinanceHealthException(String message, Throwable cause) {
        super(message, cause);
    }
}
