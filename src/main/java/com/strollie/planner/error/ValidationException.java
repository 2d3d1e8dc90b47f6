package com.strollie.planner.error;

/**
 * Malformed caller input: out-of-range coordinates, bad limits, sort values that cannot be compared.
 */
public class ValidationException extends TravelEngineException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
