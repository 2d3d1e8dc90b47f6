package com.strollie.planner.error;

/**
 * Missing credential or setup. Fatal: surfaced immediately, never retried, never cached.
 */
public class ConfigurationException extends TravelEngineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
