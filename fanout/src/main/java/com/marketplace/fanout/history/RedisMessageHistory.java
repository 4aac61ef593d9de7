package com.marketplace.fanout.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Message history kept as one capped Redis list per channel.
 *
 * Key format: fanout:history:{channel}. Only the newest {@code fanout.history.max-messages}
 * entries are kept; older ones are trimmed on append.
 */
@Slf4j
@Component
public class RedisMessageHistory implements MessageHistory {

    private static final String KEY_PREFIX = "fanout:history:";
    private static final TypeReference<Map<String, Object>> MESSAGE_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final int maxMessages;

    public RedisMessageHistory(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               @Value("${fanout.history.max-messages:200}") int maxMessages) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.maxMessages = maxMessages;
    }

    @Override
    public void append(String channel, Map<String, Object> message) {
        String key = KEY_PREFIX + channel;
        try {
            redisTemplate.opsForList().rightPush(key, objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message not serializable for channel " + channel, e);
        }
        redisTemplate.opsForList().trim(key, -maxMessages, -1);
    }

    @Override
    public List<Map<String, Object>> recent(String channel) {
        List<String> raw = redisTemplate.opsForList().range(KEY_PREFIX + channel, 0, -1);
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> messages = new ArrayList<>(raw.size());
        for (String json : raw) {
            try {
                messages.add(objectMapper.readValue(json, MESSAGE_TYPE));
            } catch (JsonProcessingException e) {
                log.warn("Unreadable history entry skipped: channel={}, error={}", channel, e.getMessage());
            }
        }
        return messages;
    }
}
