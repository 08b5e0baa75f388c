package com.gillianbc.finhealth.exception;

public class FeedbackAssemblyException extends FinanceHealthException {

    public FeedbackAssemblyException(String message) {
        super(message);
    }
}
