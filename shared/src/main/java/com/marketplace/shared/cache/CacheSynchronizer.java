package com.marketplace.shared.cache;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Short-lived derived aggregates in Redis, e.g. the number of listings awaiting review.
 *
 * Reads never depend on Redis: when it is down or the circuit is open, values are recomputed
 * from the source on every call. Invalidation is eager on every membership change; the TTL only
 * bounds staleness if an invalidation is lost.
 */
@Slf4j
@Component
public class CacheSynchronizer {

    public static final String CIRCUIT_BREAKER_NAME = "derived-cache";

    private final StringRedisTemplate redis;
    private final CircuitBreaker circuitBreaker;
    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter degradedCounter;

    public CacheSynchronizer(StringRedisTemplate redis,
                             CircuitBreakerRegistry circuitBreakerRegistry,
                             MeterRegistry meterRegistry) {
        this.redis = redis;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.hitCounter = Counter.builder("cache.lookups").tag("outcome", "hit").register(meterRegistry);
        this.missCounter = Counter.builder("cache.lookups").tag("outcome", "miss").register(meterRegistry);
        this.degradedCounter = Counter.builder("cache.lookups").tag("outcome", "degraded")
                .description("Lookups served by recomputation because the cache was unreachable")
                .register(meterRegistry);
    }

    /**
     * Drop a cached value.
     *
     * @throws CacheUnavailableException when Redis cannot be reached; the caller decides whether
     *                                   that matters (the TTL still bounds staleness)
     */
    public void invalidate(String key) {
        try {
            circuitBreaker.executeRunnable(() -> redis.delete(key));
            log.debug("Cache invalidated: key={}", key);
        } catch (CallNotPermittedException e) {
            throw new CacheUnavailableException("Cache circuit open, invalidation skipped: " + key, e);
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Cache invalidation failed: " + key, e);
        }
    }

    /**
     * Cached value or the computed one. Never throws because of the cache.
     */
    public String getOrCompute(String key, long ttlSeconds, Supplier<String> compute) {
        String cached;
        try {
            cached = circuitBreaker.executeSupplier(() -> redis.opsForValue().get(key));
        } catch (RuntimeException e) {
            degradedCounter.increment();
            log.warn("Cache read unavailable, recomputing: key={}, error={}", key, e.getMessage());
            return compute.get();
        }
        if (cached != null) {
            hitCounter.increment();
            return cached;
        }

        missCounter.increment();
        String value = compute.get();
        try {
            circuitBreaker.executeRunnable(() ->
                    redis.opsForValue().set(key, value, Duration.ofSeconds(ttlSeconds)));
        } catch (RuntimeException e) {
            log.warn("Cache write skipped: key={}, error={}", key, e.getMessage());
        }
        return value;
    }

    public long getOrComputeCount(String key, long ttlSeconds, LongSupplier compute) {
        String value = getOrCompute(key, ttlSeconds, () -> Long.toString(compute.getAsLong()));
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Discarding malformed cached count: key={}, value={}", key, value);
            return compute.getAsLong();
        }
    }

    public static class CacheUnavailableException extends RuntimeException {
        public CacheUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
