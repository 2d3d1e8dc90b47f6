package com.strollie.planner.engine.resilience;

import com.strollie.planner.error.ConfigurationException;
import com.strollie.planner.error.TransientFetchException;
import com.strollie.planner.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilientCallTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(5), 2.0);

    private final MutableClock clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
    private final ResilientCalls calls = new ResilientCalls(new ResultCache(Duration.ofMinutes(10), 100, clock));

    @Test
    void secondIdenticalCallWithinTtlIsServedFromCache() {
        // given: an operation that counts its invocations
        AtomicInteger invocations = new AtomicInteger();
        ResilientCall<String> call = calls.resilient("weather.current", FAST_RETRY)
                .wrap(args -> "sunny in " + args.getString("city") + " #" + invocations.incrementAndGet());

        // when: the same logical call is made twice
        String first = call.invoke(CallArguments.of("city", "paris"));
        String second = call.invoke(CallArguments.of("city", "paris"));

        // then: the upstream was hit exactly once
        assertThat(invocations).hasValue(1);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void callAfterTtlExpiryFetchesAgain() {
        AtomicInteger invocations = new AtomicInteger();
        ResilientCall<Integer> call = calls.resilient("listings.fetch", FAST_RETRY)
                .wrap(args -> invocations.incrementAndGet());

        call.invoke(CallArguments.of("city", "rome"));
        call.invoke(CallArguments.of("city", "rome"));
        clock.advance(Duration.ofMinutes(11));
        Integer third = call.invoke(CallArguments.of("city", "rome"));

        assertThat(invocations).hasValue(2);
        assertThat(third).isEqualTo(2);
    }

    @Test
    void argumentOrderMapsToTheSameEntry() {
        AtomicInteger invocations = new AtomicInteger();
        ResilientCall<Integer> call = calls.resilient("weather.forecast", FAST_RETRY)
                .wrap(args -> invocations.incrementAndGet());

        call.invoke(CallArguments.of("city", "paris", "date", "2025-06-02"));
        call.invoke(CallArguments.of("date", "2025-06-02", "city", "paris"));

        assertThat(invocations).hasValue(1);
    }

    @Test
    void transientFailuresBelowTheLimitAreRetriedUntilSuccess() {
        // given: fails twice, then succeeds (k = 2 < maxAttempts = 3)
        AtomicInteger attempts = new AtomicInteger();
        ResilientCall<String> call = calls.resilient("events.search", FAST_RETRY).wrap(args -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new TransientFetchException("connection reset");
            }
            return "ok";
        });

        // when
        String result = call.invoke(CallArguments.of("city", "berlin"));

        // then: k + 1 attempts
        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void persistentTransientFailureIsAttemptedMaxTimesThenRaised() {
        AtomicInteger attempts = new AtomicInteger();
        TransientFetchException failure = new TransientFetchException("503 from upstream");
        ResilientCall<String> call = calls.resilient("flights.search", FAST_RETRY).wrap(args -> {
            attempts.incrementAndGet();
            throw failure;
        });

        assertThatThrownBy(() -> call.invoke(CallArguments.of("origin", "CGK")))
                .isSameAs(failure);
        assertThat(attempts).hasValue(3);
    }

    @Test
    void nonTransientFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        ResilientCall<String> missingKey = calls.resilient("weather.current", FAST_RETRY).wrap(args -> {
            attempts.incrementAndGet();
            throw new ConfigurationException("OPENWEATHER key missing");
        });
        ResilientCall<String> badInput = calls.resilient("weather.forecast", FAST_RETRY).wrap(args -> {
            attempts.incrementAndGet();
            throw new ValidationException("bad date");
        });

        assertThatThrownBy(() -> missingKey.invoke(CallArguments.of("city", "x")))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> badInput.invoke(CallArguments.of("city", "x")))
                .isInstanceOf(ValidationException.class);
        assertThat(attempts).hasValue(2);
    }

    @Test
    void failuresAreNeverCached() {
        AtomicInteger attempts = new AtomicInteger();
        ResilientCall<String> call = calls.resilient("transport.lookup", RetryPolicy.noRetry()).wrap(args -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TransientFetchException("timeout");
            }
            return "metro";
        });

        assertThatThrownBy(() -> call.invoke(CallArguments.of("city", "paris")))
                .isInstanceOf(TransientFetchException.class);
        String recovered = call.invoke(CallArguments.of("city", "paris"));

        assertThat(recovered).isEqualTo("metro");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void concurrentCallersForDifferentKeysAllComplete() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        ResilientCall<String> call = calls.resilient("places.fetch", FAST_RETRY).wrap(args -> {
            invocations.incrementAndGet();
            return args.getString("city");
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> tasks = List.of("paris", "rome", "berlin", "oslo", "lisbon", "vienna").stream()
                    .<Callable<String>>map(city -> () -> call.invoke(CallArguments.of("city", city)))
                    .toList();

            List<String> cities = new ArrayList<>();
            for (Future<String> result : pool.invokeAll(tasks, 5, TimeUnit.SECONDS)) {
                cities.add(result.get());
            }

            assertThat(cities).containsExactly("paris", "rome", "berlin", "oslo", "lisbon", "vienna");
        } finally {
            pool.shutdownNow();
        }

        assertThat(invocations).hasValue(6);
    }
}
