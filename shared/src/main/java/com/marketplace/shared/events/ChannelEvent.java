package com.marketplace.shared.events;

import lombok.Getter;

import java.util.Map;

/**
 * A message addressed to one fan-out channel. Published to {@link EventTypes#TOPIC_CHANNEL_EVENTS}
 * keyed by channel, so all events for one channel land on one partition in publish order.
 */
@Getter
public class ChannelEvent extends DomainEvent {

    private final String channel;
    private final String eventType;
    private final Map<String, Object> payload;

    public ChannelEvent(String channel, String eventType, Map<String, Object> payload,
                        String source, String correlationId) {
        super(EventTypes.CHANNEL_EVENT, source, correlationId);
        this.channel = channel;
        this.eventType = eventType;
        this.payload = payload;
    }
}
