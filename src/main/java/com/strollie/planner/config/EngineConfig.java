package com.strollie.planner.config;

import com.strollie.planner.engine.geo.ProximityJoin;
import com.strollie.planner.engine.ranking.RankingEngine;
import com.strollie.planner.engine.resilience.ResilientCalls;
import com.strollie.planner.engine.resilience.ResultCache;
import com.strollie.planner.engine.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(EngineProperties properties, Clock clock) {
        EngineProperties.Cache cache = properties.getCache();
        log.info("Result cache: ttl={}, maxEntries={}", cache.getTtl(), cache.getMaxEntries());
        return new ResultCache(cache.getTtl(), cache.getMaxEntries(), clock);
    }

    @Bean
    public ResilientCalls resilientCalls(ResultCache resultCache) {
        return new ResilientCalls(resultCache);
    }

    @Bean
    public RetryPolicy retryPolicy(EngineProperties properties) {
        RetryPolicy policy = properties.getRetry().toPolicy();
        log.info("Retry policy: maxAttempts={}, baseDelay={}, backoffMultiplier={}",
                policy.maxAttempts(), policy.baseDelay(), policy.backoffMultiplier());
        return policy;
    }

    @Bean
    public ProximityJoin proximityJoin() {
        return new ProximityJoin();
    }

    @Bean
    public RankingEngine rankingEngine(ProximityJoin proximityJoin) {
        return new RankingEngine(proximityJoin);
    }
}
