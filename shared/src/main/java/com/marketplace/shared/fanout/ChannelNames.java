package com.marketplace.shared.fanout;

import java.util.Optional;

/**
 * Channel naming scheme, used by both publishers and the dispatcher.
 *
 * <ul>
 *   <li>{@code order:<orderId>} buyer and seller of one order</li>
 *   <li>{@code owner:<ownerId>} everything concerning one owner's listings and orders</li>
 *   <li>{@code reviewers} the moderation pool</li>
 *   <li>{@code dm:<a>:<b>} direct messages between a buyer and a seller, ids in lexical order</li>
 * </ul>
 */
public final class ChannelNames {

    public static final String REVIEWERS = "reviewers";

    private static final String ORDER_PREFIX = "order:";
    private static final String OWNER_PREFIX = "owner:";
    private static final String DIRECT_PREFIX = "dm:";

    private ChannelNames() {}

    public static String order(String orderId) {
        return ORDER_PREFIX + requireId(orderId);
    }

    public static String owner(String ownerId) {
        return OWNER_PREFIX + requireId(ownerId);
    }

    /** Same name regardless of argument order. */
    public static String direct(String participantA, String participantB) {
        String a = requireId(participantA);
        String b = requireId(participantB);
        return a.compareTo(b) <= 0 ? DIRECT_PREFIX + a + ":" + b : DIRECT_PREFIX + b + ":" + a;
    }

    public static Optional<String> ownerIdOf(String channel) {
        return channel.startsWith(OWNER_PREFIX)
                ? Optional.of(channel.substring(OWNER_PREFIX.length()))
                : Optional.empty();
    }

    public static boolean isOrder(String channel) {
        return channel.startsWith(ORDER_PREFIX) && channel.length() > ORDER_PREFIX.length();
    }

    public static boolean isDirect(String channel) {
        return channel.startsWith(DIRECT_PREFIX);
    }

    /**
     * @return true if {@code principalId} is one of the two ids in a {@code dm:} channel name
     */
    public static boolean isDirectParticipant(String channel, String principalId) {
        if (!isDirect(channel) || principalId == null) {
            return false;
        }
        String[] ids = channel.substring(DIRECT_PREFIX.length()).split(":", -1);
        return ids.length == 2 && (ids[0].equals(principalId) || ids[1].equals(principalId));
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank() || id.contains(":")) {
            throw new IllegalArgumentException("Invalid channel id: " + id);
        }
        return id;
    }
}
