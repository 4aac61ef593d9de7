package com.marketplace.fanout.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.fanout.dispatch.Connection;
import com.marketplace.fanout.dispatch.ConnectionContext;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection over a WebSocket session. Frames are {@code {"event": <type>, "data": <payload>}}.
 *
 * The session is wrapped in a {@link ConcurrentWebSocketSessionDecorator} so the Kafka consumer
 * thread and the session's own thread can send at the same time; a client that stops reading
 * is cut off once the send buffer limit is hit.
 */
public class WebSocketConnection implements Connection {

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ConnectionContext context;
    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketConnection(ConnectionContext context, WebSocketSession session, ObjectMapper objectMapper) {
        this.context = context;
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.objectMapper = objectMapper;
    }

    @Override
    public ConnectionContext context() {
        return context;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String eventType, Object payload) throws IOException {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", eventType);
        frame.put("data", payload);
        session.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
    }
}
