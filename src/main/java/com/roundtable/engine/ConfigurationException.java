package com.roundtable.engine;

/**
 * A setup problem the caller must fix: missing credential, empty round table, no chairman.
 * Never retried.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }
}
