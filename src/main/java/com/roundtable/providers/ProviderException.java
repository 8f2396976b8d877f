package com.roundtable.providers;

import java.io.IOException;

/**
 * Uniform failure of a provider call. Backend-specific errors are always wrapped into this type.
 * Carries the HTTP status and raw response body when the backend produced them.
 */
public class ProviderException extends IOException {

    private final Integer statusCode;
    private final String body;
    private final int attempts;

    public ProviderException(String message) {
        this(message, null, null, null, 0);
    }

    public ProviderException(String message, Throwable cause) {
        this(message, cause, null, null, 0);
    }

    public ProviderException(String message, Integer statusCode, String body) {
        this(message, null, statusCode, body, 0);
    }

    public ProviderException(String message, Throwable cause, Integer statusCode, String body, int attempts) {
        super(message, cause);
        this.statusCode = statusCode;
        this.body = body;
        this.attempts = attempts;
    }

    /**
     * HTTP status of the failed response, or null when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Raw response body, or null when none was received.
     */
    public String getBody() {
        return body;
    }

    /**
     * Number of attempts made before giving up; 0 for a single-call failure.
     */
    public int getAttempts() {
        return attempts;
    }
}
