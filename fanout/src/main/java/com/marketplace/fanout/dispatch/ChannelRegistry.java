package com.marketplace.fanout.dispatch;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel membership: channel name → subscribed connections, plus the reverse index used to drop
 * a connection from everything on disconnect.
 *
 * Subscribe and unsubscribe are idempotent. Empty channels are removed so the map only holds
 * channels with at least one member.
 */
public class ChannelRegistry {

    private final Map<String, Set<Connection>> members = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> channelsByConnection = new ConcurrentHashMap<>();

    /** @return true if the connection was not yet a member */
    public boolean subscribe(Connection connection, String channel) {
        boolean[] added = new boolean[1];
        members.compute(channel, (name, set) -> {
            Set<Connection> target = set != null ? set : ConcurrentHashMap.newKeySet();
            added[0] = target.add(connection);
            return target;
        });
        channelsByConnection.computeIfAbsent(connection.id(), id -> ConcurrentHashMap.newKeySet()).add(channel);
        return added[0];
    }

    /** @return true if the connection was a member */
    public boolean unsubscribe(Connection connection, String channel) {
        boolean[] removed = new boolean[1];
        members.computeIfPresent(channel, (name, set) -> {
            removed[0] = set.remove(connection);
            return set.isEmpty() ? null : set;
        });
        channelsByConnection.computeIfPresent(connection.id(), (id, channels) -> {
            channels.remove(channel);
            return channels.isEmpty() ? null : channels;
        });
        return removed[0];
    }

    /** @return the channels the connection was removed from */
    public Set<String> removeConnection(Connection connection) {
        Set<String> channels = channelsByConnection.remove(connection.id());
        if (channels == null) {
            return Set.of();
        }
        for (String channel : channels) {
            members.computeIfPresent(channel, (name, set) -> {
                set.remove(connection);
                return set.isEmpty() ? null : set;
            });
        }
        return Set.copyOf(channels);
    }

    /** Snapshot; safe to iterate while members join and leave. */
    public Set<Connection> subscribers(String channel) {
        Set<Connection> set = members.get(channel);
        return set != null ? Set.copyOf(set) : Set.of();
    }

    public Set<String> channelsOf(Connection connection) {
        Set<String> channels = channelsByConnection.get(connection.id());
        return channels != null ? Set.copyOf(channels) : Set.of();
    }

    public int channelCount() {
        return members.size();
    }

    public void clear() {
        members.clear();
        channelsByConnection.clear();
    }
}
