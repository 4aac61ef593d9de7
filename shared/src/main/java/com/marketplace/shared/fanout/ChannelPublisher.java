package com.marketplace.shared.fanout;

import java.util.Map;

/**
 * Fire-and-forget publication to a fan-out channel.
 */
public interface ChannelPublisher {

    void publish(String channel, String eventType, Map<String, Object> payload);
}
