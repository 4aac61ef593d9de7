package com.marketplace.shared.effects;

import java.util.Map;

/**
 * One channel message to emit once the state change is committed.
 */
public record Notification(String channel, String eventType, Map<String, Object> payload) {
}
