package com.decisiontree.exception;

/**
 * Exception thrown when engine settings are invalid or cannot be read.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends DecisionTreeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
