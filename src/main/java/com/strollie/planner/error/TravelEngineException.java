package com.strollie.planner.error;

/**
 * Root of the failures raised by the planner engine and the API clients it wraps.
 */
public abstract class TravelEngineException extends RuntimeException {

    protected TravelEngineException(String message) {
        super(message);
    }

    protected TravelEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
