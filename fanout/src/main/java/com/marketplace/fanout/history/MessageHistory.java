package com.marketplace.fanout.history;

import java.util.List;
import java.util.Map;

/**
 * Recent direct messages per channel, oldest first.
 */
public interface MessageHistory {

    void append(String channel, Map<String, Object> message);

    List<Map<String, Object>> recent(String channel);
}
