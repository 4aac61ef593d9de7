package com.marketplace.fanout.transport;

import com.marketplace.shared.workflow.ActorRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Takes the caller's identity from the trusted {@code X-Actor-Id} / {@code X-Actor-Role} headers
 * set by the gateway, falling back to {@code actorId} / {@code role} query parameters for
 * browser clients. A handshake without a usable identity is refused with 401.
 */
@Slf4j
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    public static final String PRINCIPAL_ATTRIBUTE = "fanout.principalId";
    public static final String ROLE_ATTRIBUTE = "fanout.role";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        var query = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        String principalId = firstNonBlank(request.getHeaders().getFirst("X-Actor-Id"), query.getFirst("actorId"));
        String role = firstNonBlank(request.getHeaders().getFirst("X-Actor-Role"), query.getFirst("role"));

        if (principalId == null || role == null) {
            log.debug("Handshake refused, identity missing: uri={}", request.getURI());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        try {
            attributes.put(ROLE_ATTRIBUTE, ActorRole.valueOf(role));
        } catch (IllegalArgumentException e) {
            log.debug("Handshake refused, unknown role: role={}", role);
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(PRINCIPAL_ATTRIBUTE, principalId);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) return first;
        if (second != null && !second.isBlank()) return second;
        return null;
    }
}
