package com.gillianbc.finhealth.exception;

/**
 * Configuration or reference data outside its valid domain, e.g. a retirement age that is
 * not after the current age.
 */
public class InvalidConfigurationException extends FinanceHealthException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
