package com.strollie.planner.error;

/**
 * Network timeout, connection reset, rate limit or 5xx from an upstream API.
 * The only failure a resilient call retries.
 */
public class TransientFetchException extends TravelEngineException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
