package com.strollie.planner.engine.resilience;

import com.strollie.planner.error.TransientFetchException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * An {@link ExternalOperation} wrapped with a cache lookup in front of a bounded retry loop.
 * <p>
 * Only {@link TransientFetchException} is retried. Any other failure propagates on the first
 * attempt, and once attempts run out the last transient failure propagates as thrown.
 * Failures are never cached. Backoff sleeps the calling thread only.
 */
@Slf4j
public class ResilientCall<R> implements ExternalOperation<R> {

    private final String operationName;
    private final RetryPolicy policy;
    private final ResultCache cache;
    private final ExternalOperation<R> delegate;
    private final Retry retry;

    public ResilientCall(String operationName, RetryPolicy policy, ResultCache cache, ExternalOperation<R> delegate) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName must not be blank");
        }
        this.operationName = operationName;
        this.policy = policy;
        this.cache = cache;
        this.delegate = delegate;
        this.retry = Retry.of(operationName, retryConfig(policy));
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying '{}' after attempt {} in {} ms: {}",
                        operationName,
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));
    }

    @Override
    @SuppressWarnings("unchecked")
    public R invoke(CallArguments arguments) {
        String key = arguments.cacheKey(operationName);

        Optional<ResultCache.CacheEntry> cached = cache.lookup(key);
        if (cached.isPresent()) {
            log.debug("Cache hit: {}", key);
            return (R) cached.get().value();
        }

        log.debug("Cache miss: {}", key);
        R result = retry.executeSupplier(() -> delegate.invoke(arguments));
        cache.put(key, result);
        return result;
    }

    public String operationName() {
        return operationName;
    }

    public RetryPolicy policy() {
        return policy;
    }

    private static RetryConfig retryConfig(RetryPolicy policy) {
        IntervalFunction backoff = attempt -> policy.backoffAfterAttempt(attempt).toMillis();
        return RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(backoff)
                .retryOnException(TransientFetchException.class::isInstance)
                .build();
    }
}
