package com.eainde.policyaudit.gap;

/** The expectation mapping is missing, empty, or has an unusable entry. */
public class InvalidExpectationConfigException extends IllegalStateException {

    public InvalidExpectationConfigException(String message) {
        super(message);
    }

    public InvalidExpectationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
