package com.marketplace.shared.fanout;

import com.marketplace.shared.events.ChannelEvent;
import com.marketplace.shared.events.EventTypes;
import com.marketplace.shared.kafka.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Hands channel events to the fan-out service through Kafka, keyed by channel name.
 * Delivery outcome is reported asynchronously by {@link EventPublisher}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaChannelPublisher implements ChannelPublisher {

    private final EventPublisher eventPublisher;

    @Value("${spring.application.name:marketplace}")
    private String serviceName;

    @Override
    public void publish(String channel, String eventType, Map<String, Object> payload) {
        ChannelEvent event = new ChannelEvent(channel, eventType, payload, "/services/" + serviceName, null);
        eventPublisher.publish(EventTypes.TOPIC_CHANNEL_EVENTS, event, channel);
        log.debug("Channel event queued: channel={}, type={}, eventId={}", channel, eventType, event.getId());
    }
}
