package com.marketplace.fanout.inbound;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.fanout.dispatch.Connection;
import com.marketplace.fanout.dispatch.FanoutDispatcher;
import com.marketplace.fanout.history.MessageHistory;
import com.marketplace.shared.events.EventTypes;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Runs one inbound frame: parse the {@code {"event": ..., "data": {...}}} envelope, look the
 * handler up in the {@link DispatchTable}, then carry out the returned actions.
 *
 * A history failure is reported to the sender as an error; the message itself is still
 * delivered to the channel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundEventProcessor {

    private final DispatchTable dispatchTable;
    private final FanoutDispatcher dispatcher;
    private final MessageHistory history;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public void process(Connection connection, String frame) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            count("malformed");
            reply(connection, EventTypes.ERROR, Map.of("message", "Malformed frame"));
            return;
        }
        String event = envelope.path("event").asText(null);
        List<FanoutAction> actions = dispatchTable.handle(connection.context(), event, envelope.path("data"));
        count(dispatchTable.knows(event) ? event : "unknown");

        for (FanoutAction action : actions) {
            apply(connection, action);
        }
    }

    private void apply(Connection connection, FanoutAction action) {
        if (action instanceof FanoutAction.Join join) {
            dispatcher.subscribe(connection, join.channel());
        } else if (action instanceof FanoutAction.Leave leave) {
            dispatcher.unsubscribe(connection, leave.channel());
        } else if (action instanceof FanoutAction.Publish publish) {
            dispatcher.publish(publish.channel(), publish.eventType(), publish.payload());
        } else if (action instanceof FanoutAction.Reply reply) {
            reply(connection, reply.eventType(), reply.payload());
        } else if (action instanceof FanoutAction.AppendHistory append) {
            try {
                history.append(append.channel(), append.message());
            } catch (DataAccessException e) {
                log.warn("Message history append failed: channel={}, error={}", append.channel(), e.getMessage());
                reply(connection, EventTypes.ERROR, Map.of("message", "Message not saved to history"));
            }
        } else if (action instanceof FanoutAction.FetchHistory fetch) {
            try {
                reply(connection, EventTypes.MESSAGE_HISTORY,
                        Map.of("channel", fetch.channel(), "messages", history.recent(fetch.channel())));
            } catch (DataAccessException e) {
                log.warn("Message history read failed: channel={}, error={}", fetch.channel(), e.getMessage());
                reply(connection, EventTypes.ERROR, Map.of("message", "History unavailable"));
            }
        } else {
            throw new IllegalStateException("Unhandled action " + action);
        }
    }

    private void reply(Connection connection, String eventType, Map<String, Object> payload) {
        try {
            connection.send(eventType, payload);
        } catch (IOException e) {
            log.debug("Reply failed: connectionId={}, type={}, error={}", connection.id(), eventType, e.getMessage());
        }
    }

    private void count(String event) {
        meterRegistry.counter("fanout.inbound", "event", event).increment();
    }
}
