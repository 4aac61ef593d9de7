package com.marketplace.shared.cache;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests — CacheSynchronizer
 *
 * Redis is mocked; the circuit breaker is real.
 */
@ExtendWith(MockitoExtension.class)
class CacheSynchronizerTest {

    private static final String KEY = "listings:pending:count";

    @Mock StringRedisTemplate redis;
    @Mock ValueOperations<String, String> valueOps;

    CircuitBreakerRegistry circuitBreakers;
    SimpleMeterRegistry meterRegistry;
    CacheSynchronizer cache;

    @BeforeEach
    void setUp() {
        circuitBreakers = CircuitBreakerRegistry.ofDefaults();
        meterRegistry = new SimpleMeterRegistry();
        cache = new CacheSynchronizer(redis, circuitBreakers, meterRegistry);
    }

    @Test
    @DisplayName("hit returns the cached value without computing")
    void hitSkipsCompute() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn("7");
        AtomicInteger computed = new AtomicInteger();

        long count = cache.getOrComputeCount(KEY, 15, () -> { computed.incrementAndGet(); return 3; });

        assertThat(count).isEqualTo(7);
        assertThat(computed).hasValue(0);
    }

    @Test
    @DisplayName("miss computes and stores with the requested TTL")
    void missComputesAndStores() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn(null);

        long count = cache.getOrComputeCount(KEY, 15, () -> 4);

        assertThat(count).isEqualTo(4);
        verify(valueOps).set(KEY, "4", Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("unreachable Redis degrades to recompute on every call")
    void unreachableRedisRecomputes() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));
        AtomicInteger computed = new AtomicInteger();

        long first = cache.getOrComputeCount(KEY, 15, () -> computed.incrementAndGet());
        long second = cache.getOrComputeCount(KEY, 15, () -> computed.incrementAndGet());

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
        assertThat(meterRegistry.counter("cache.lookups", "outcome", "degraded").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("open circuit skips Redis entirely")
    void openCircuitSkipsRedis() {
        circuitBreakers.circuitBreaker(CacheSynchronizer.CIRCUIT_BREAKER_NAME).transitionToOpenState();

        long count = cache.getOrComputeCount(KEY, 15, () -> 9);

        assertThat(count).isEqualTo(9);
        verifyNoInteractions(redis);
        assertThatThrownBy(() -> cache.invalidate(KEY))
                .isInstanceOf(CacheSynchronizer.CacheUnavailableException.class);
    }

    @Test
    @DisplayName("failed write after compute still returns the computed value")
    void failedWriteStillReturnsValue() {
        when(redis.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(KEY)).thenReturn(null);
        doThrow(new RedisConnectionFailureException("gone")).when(valueOps).set(anyString(), anyString(), any(Duration.class));

        assertThat(cache.getOrComputeCount(KEY, 15, () -> 2)).isEqualTo(2);
    }

    @Test
    @DisplayName("invalidate deletes the key and surfaces failures to the caller")
    void invalidate() {
        cache.invalidate(KEY);
        verify(redis).delete(KEY);

        when(redis.delete(KEY)).thenThrow(new RedisConnectionFailureException("down"));
        assertThatThrownBy(() -> cache.invalidate(KEY))
                .isInstanceOf(CacheSynchronizer.CacheUnavailableException.class);
    }
}
