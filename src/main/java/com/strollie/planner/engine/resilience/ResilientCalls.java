package com.strollie.planner.engine.resilience;

import lombok.RequiredArgsConstructor;

/**
 * Entry point for wrapping external operations. Every call produced here shares the injected cache.
 *
 * <pre>{@code
 * ExternalOperation<WeatherReport> weather =
 *         resilientCalls.resilient("weather.current", policy).wrap(client::fetchCurrent);
 * }</pre>
 */
@RequiredArgsConstructor
public class ResilientCalls {

    private final ResultCache cache;

    public Decorator resilient(String operationName, RetryPolicy policy) {
        return new Decorator(operationName, policy);
    }

    public ResultCache cache() {
        return cache;
    }

    @RequiredArgsConstructor
    public final class Decorator {

        private final String operationName;
        private final RetryPolicy policy;

        public <R> ResilientCall<R> wrap(ExternalOperation<R> operation) {
            return new ResilientCall<>(operationName, policy, cache, operation);
        }
    }
}
