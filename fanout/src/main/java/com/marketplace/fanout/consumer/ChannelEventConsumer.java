package com.marketplace.fanout.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.fanout.dispatch.FanoutDispatcher;
import com.marketplace.shared.events.EventTypes;
import com.marketplace.shared.kafka.IdempotencyService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Feeds channel events published by the marketplace service into the local dispatcher.
 *
 * Every fan-out instance holds its own connections, so every instance must see every event:
 * the consumer group and the dedup key are both per instance. Delivery is at-most-once; a
 * record that cannot be read is logged and skipped, never retried.
 */
@Slf4j
@Component
public class ChannelEventConsumer {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final FanoutDispatcher dispatcher;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;
    private final String instanceId;

    public ChannelEventConsumer(FanoutDispatcher dispatcher,
                                IdempotencyService idempotencyService,
                                ObjectMapper objectMapper,
                                @Qualifier("fanoutInstanceId") String instanceId) {
        this.dispatcher = dispatcher;
        this.idempotencyService = idempotencyService;
        this.objectMapper = objectMapper;
        this.instanceId = instanceId;
    }

    @KafkaListener(topics = EventTypes.TOPIC_CHANNEL_EVENTS, groupId = "fanout-#{@fanoutInstanceId}")
    public void onChannelEvent(ConsumerRecord<String, String> record, Acknowledgment ack) {
        var h = record.headers().lastHeader("event-id");
        String eventId = h != null ? new String(h.value(), StandardCharsets.UTF_8) : null;
        if (eventId != null && idempotencyService.isDuplicate(eventId, EventTypes.TOPIC_CHANNEL_EVENTS + ":" + instanceId)) {
            ack.acknowledge();
            return;
        }

        try {
            JsonNode event = objectMapper.readTree(record.value());
            String channel = event.path("channel").asText(null);
            String eventType = event.path("eventType").asText(null);
            if (channel == null || eventType == null) {
                log.error("Channel event without channel or type skipped: eventId={}, key={}", eventId, record.key());
            } else {
                Map<String, Object> payload = event.hasNonNull("payload")
                        ? objectMapper.convertValue(event.get("payload"), PAYLOAD_TYPE)
                        : Map.of();
                int delivered = dispatcher.publish(channel, eventType, payload);
                log.debug("Channel event dispatched: eventId={}, channel={}, type={}, delivered={}",
                        eventId, channel, eventType, delivered);
            }
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.error("Unreadable channel event skipped: eventId={}, offset={}", eventId, record.offset(), ex);
        }
        ack.acknowledge();
    }
}
