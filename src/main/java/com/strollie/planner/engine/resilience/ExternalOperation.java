package com.strollie.planner.engine.resilience;

/**
 * A call into a third-party API or store. Implementations classify their failures as
 * {@link com.strollie.planner.error.TransientFetchException},
 * {@link com.strollie.planner.error.ConfigurationException} or
 * {@link com.strollie.planner.error.ValidationException} before throwing.
 */
@FunctionalInterface
public interface ExternalOperation<R> {

    R invoke(CallArguments arguments);
}
