package com.marketplace.fanout.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.fanout.dispatch.ConnectionContext;
import com.marketplace.fanout.dispatch.FanoutDispatcher;
import com.marketplace.fanout.inbound.InboundEventProcessor;
import com.marketplace.shared.workflow.ActorRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint: one {@link WebSocketConnection} per session, registered with the
 * dispatcher while the session is open.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FanoutWebSocketHandler extends TextWebSocketHandler {

    private final FanoutDispatcher dispatcher;
    private final InboundEventProcessor processor;
    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketConnection> connections = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object principalId = session.getAttributes().get(IdentityHandshakeInterceptor.PRINCIPAL_ATTRIBUTE);
        Object role = session.getAttributes().get(IdentityHandshakeInterceptor.ROLE_ATTRIBUTE);
        if (!(principalId instanceof String) || !(role instanceof ActorRole)) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("identity required"));
            return;
        }
        var context = new ConnectionContext(session.getId(), (String) principalId, (ActorRole) role);
        var connection = new WebSocketConnection(context, session, objectMapper);
        connections.put(session.getId(), connection);
        dispatcher.register(connection);
        log.info("Connection opened: connectionId={}, principalId={}, role={}",
                session.getId(), principalId, role);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketConnection connection = connections.get(session.getId());
        if (connection != null) {
            processor.process(connection, message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error: connectionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketConnection connection = connections.remove(session.getId());
        if (connection != null) {
            dispatcher.disconnect(connection);
            log.info("Connection closed: connectionId={}, status={}", session.getId(), status.getCode());
        }
    }
}
