package com.purchasingpower.genki.exception;

/**
 * The monitored GitHub username is not configured.
 */
public class MissingConfigurationException extends RuntimeException {

    public MissingConfigurationException(String message) {
        super(message);
    }
}
