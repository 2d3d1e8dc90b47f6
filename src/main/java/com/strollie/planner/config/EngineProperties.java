package com.strollie.planner.config;

import com.strollie.planner.engine.resilience.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
    private Cache cache = new Cache();
    private Retry retry = new Retry();
    private Proximity proximity = new Proximity();
    private int defaultTopN = 5;

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofMinutes(10);
        private int maxEntries = 200;
    }

    @Data
    public static class Retry {
        private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
        private double backoffMultiplier = RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER;

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, backoffMultiplier);
        }
    }

    @Data
    public static class Proximity {
        private double maxDistanceKm = 2.0;
        private int limit = 5;
    }
}
