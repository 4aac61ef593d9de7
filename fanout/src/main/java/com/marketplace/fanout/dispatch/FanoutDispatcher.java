package com.marketplace.fanout.dispatch;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fan-out Dispatcher — pushes channel events to the connections subscribed to them.
 *
 * Delivery is at-most-once and best-effort: a subscriber that fails to receive is skipped (and
 * pruned if its connection is gone), the others still receive. Events published to the same
 * channel from one thread reach each subscriber in publish order.
 *
 * Owns its {@link ChannelRegistry}; stopping the dispatcher drops all memberships.
 */
@Slf4j
@Component
public class FanoutDispatcher implements SmartLifecycle {

    private final ChannelRegistry registry = new ChannelRegistry();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;
    private volatile boolean running;

    public FanoutDispatcher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder("fanout.connections", connections, Map::size)
                .description("Open subscriber connections")
                .register(meterRegistry);
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @Override
    public void start() {
        running = true;
        log.info("Fan-out dispatcher started");
    }

    @Override
    public void stop() {
        running = false;
        int dropped = connections.size();
        registry.clear();
        connections.clear();
        log.info("Fan-out dispatcher stopped: connectionsDropped={}", dropped);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ─── Connections ──────────────────────────────────────────────────────────

    public void register(Connection connection) {
        connections.put(connection.id(), connection);
        log.debug("Connection registered: connectionId={}, principalId={}",
                connection.id(), connection.context().principalId());
    }

    public void disconnect(Connection connection) {
        connections.remove(connection.id());
        var channels = registry.removeConnection(connection);
        log.debug("Connection removed: connectionId={}, channels={}", connection.id(), channels.size());
    }

    public void subscribe(Connection connection, String channel) {
        if (registry.subscribe(connection, channel)) {
            log.debug("Subscribed: connectionId={}, channel={}", connection.id(), channel);
        }
    }

    public void unsubscribe(Connection connection, String channel) {
        if (registry.unsubscribe(connection, channel)) {
            log.debug("Unsubscribed: connectionId={}, channel={}", connection.id(), channel);
        }
    }

    // ─── Publish ──────────────────────────────────────────────────────────────

    /**
     * @return how many subscribers the event was handed to
     */
    public int publish(String channel, String eventType, Object payload) {
        if (!running) {
            count("dropped");
            log.debug("Dispatcher not running, event dropped: channel={}, type={}", channel, eventType);
            return 0;
        }
        int delivered = 0;
        for (Connection connection : registry.subscribers(channel)) {
            if (!connection.isOpen()) {
                disconnect(connection);
                count("pruned");
                continue;
            }
            try {
                connection.send(eventType, payload);
                delivered++;
                count("delivered");
            } catch (IOException | RuntimeException e) {
                count("failed");
                log.debug("Delivery failed: channel={}, type={}, connectionId={}, error={}",
                        channel, eventType, connection.id(), e.getMessage());
                if (!connection.isOpen()) {
                    disconnect(connection);
                }
            }
        }
        return delivered;
    }

    public ChannelRegistry registry() {
        return registry;
    }

    public int connectionCount() {
        return connections.size();
    }

    private void count(String outcome) {
        meterRegistry.counter("fanout.deliveries", "outcome", outcome).increment();
    }
}
