package com.marketplace.shared.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-backed consumer deduplication.
 *
 * Kafka redelivers after rebalances and crashes. A consumer checks the event id here before acting;
 * SET NX makes check-and-mark a single atomic step.
 *
 * Key format: idempotency:{topic}:{eventId}, kept for one hour.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String KEY_PREFIX = "idempotency:";
    private static final Duration TTL = Duration.ofHours(1);

    private final StringRedisTemplate redisTemplate;

    /**
     * @return true if the event was already seen, false if this call marked it
     */
    public boolean isDuplicate(String eventId, String topic) {
        String key = KEY_PREFIX + topic + ":" + eventId;
        Boolean isNew = redisTemplate.opsForValue().setIfAbsent(key, "1", TTL);

        if (Boolean.FALSE.equals(isNew)) {
            log.debug("Duplicate event skipped: eventId={}, topic={}", eventId, topic);
            return true;
        }
        return false;
    }
}
