package com.gillianbc.finhealth.exception;

public class MissingProfileException extends FinanceHealthException {

    public MissingProfileException() {
        super("No user profile was provided.");
    }

    public MissingProfileException(String message) {
        super(message);
    }
}
