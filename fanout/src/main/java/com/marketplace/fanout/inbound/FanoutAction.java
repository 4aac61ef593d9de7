package com.marketplace.fanout.inbound;

import java.util.Map;

/**
 * What an inbound event asks the fan-out layer to do. Handlers only return actions;
 * {@link InboundEventProcessor} carries them out in list order.
 */
public interface FanoutAction {

    record Join(String channel) implements FanoutAction {}

    record Leave(String channel) implements FanoutAction {}

    record Publish(String channel, String eventType, Map<String, Object> payload) implements FanoutAction {}

    /** Sent back to the requesting connection only. */
    record Reply(String eventType, Map<String, Object> payload) implements FanoutAction {}

    record AppendHistory(String channel, Map<String, Object> message) implements FanoutAction {}

    record FetchHistory(String channel) implements FanoutAction {}
}
