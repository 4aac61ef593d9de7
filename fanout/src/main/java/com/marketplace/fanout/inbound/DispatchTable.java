package com.marketplace.fanout.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketplace.fanout.dispatch.ConnectionContext;
import com.marketplace.shared.events.EventTypes;
import com.marketplace.shared.fanout.ChannelNames;
import com.marketplace.shared.workflow.ActorRole;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Inbound event name → handler.
 *
 * Every handler is a function of the caller's context and the event payload returning the
 * actions to perform; none touches the registry or the network. Join checks are structural:
 * the reviewers channel needs the REVIEWER role, an owner channel needs the owner, a direct
 * channel is always built from the caller's own id.
 */
@Component
public class DispatchTable {

    public static final String JOIN_ORDER_ROOM = "join-order-room";
    public static final String LEAVE_ORDER_ROOM = "leave-order-room";
    public static final String JOIN_OWNER_ROOM = "join-owner-room";
    public static final String LEAVE_OWNER_ROOM = "leave-owner-room";
    public static final String JOIN_REVIEWER_ROOM = "join-reviewer-room";
    public static final String LEAVE_REVIEWER_ROOM = "leave-reviewer-room";
    public static final String JOIN_DIRECT_ROOM = "join-direct-room";
    public static final String LEAVE_DIRECT_ROOM = "leave-direct-room";
    public static final String MESSAGE_SEND = "message:send";
    public static final String HISTORY_FETCH = "history:fetch";

    static final int MAX_MESSAGE_LENGTH = 1000;

    @FunctionalInterface
    interface Handler {
        List<FanoutAction> handle(ConnectionContext context, JsonNode payload);
    }

    private final Map<String, Handler> handlers;
    private final Clock clock;

    public DispatchTable() {
        this(Clock.systemUTC());
    }

    DispatchTable(Clock clock) {
        this.clock = clock;
        this.handlers = Map.of(
                JOIN_ORDER_ROOM, (ctx, p) -> withId(p, "orderId", id -> List.of(new FanoutAction.Join(ChannelNames.order(id)))),
                LEAVE_ORDER_ROOM, (ctx, p) -> withId(p, "orderId", id -> List.of(new FanoutAction.Leave(ChannelNames.order(id)))),
                JOIN_OWNER_ROOM, this::joinOwnerRoom,
                LEAVE_OWNER_ROOM, (ctx, p) -> withId(p, "ownerId", id -> List.of(new FanoutAction.Leave(ChannelNames.owner(id)))),
                JOIN_REVIEWER_ROOM, this::joinReviewerRoom,
                LEAVE_REVIEWER_ROOM, (ctx, p) -> List.of(new FanoutAction.Leave(ChannelNames.REVIEWERS)),
                JOIN_DIRECT_ROOM, (ctx, p) -> withPeer(ctx, p, channel -> List.of(new FanoutAction.Join(channel))),
                LEAVE_DIRECT_ROOM, (ctx, p) -> withPeer(ctx, p, channel -> List.of(new FanoutAction.Leave(channel))),
                MESSAGE_SEND, this::sendMessage,
                HISTORY_FETCH, (ctx, p) -> withPeer(ctx, p, channel -> List.of(new FanoutAction.FetchHistory(channel))));
    }

    public List<FanoutAction> handle(ConnectionContext context, String event, JsonNode payload) {
        if (!knows(event)) {
            return error(event, "Unknown event");
        }
        try {
            return handlers.get(event).handle(context, payload);
        } catch (IllegalArgumentException e) {
            return error(event, e.getMessage());
        }
    }

    public boolean knows(String event) {
        return event != null && handlers.containsKey(event);
    }

    // ─── Handlers ─────────────────────────────────────────────────────────────

    private List<FanoutAction> joinOwnerRoom(ConnectionContext ctx, JsonNode payload) {
        return withId(payload, "ownerId", ownerId -> ownerId.equals(ctx.principalId())
                ? List.of(new FanoutAction.Join(ChannelNames.owner(ownerId)))
                : error(JOIN_OWNER_ROOM, "Not allowed to join owner room " + ownerId));
    }

    private List<FanoutAction> joinReviewerRoom(ConnectionContext ctx, JsonNode payload) {
        return ctx.role() == ActorRole.REVIEWER
                ? List.of(new FanoutAction.Join(ChannelNames.REVIEWERS))
                : error(JOIN_REVIEWER_ROOM, "Only reviewers may join the reviewer room");
    }

    private List<FanoutAction> sendMessage(ConnectionContext ctx, JsonNode payload) {
        return withPeer(ctx, payload, channel -> {
            String text = text(payload, "text").map(String::strip).orElse("");
            if (text.isEmpty()) {
                return error(MESSAGE_SEND, "Message text is required");
            }
            if (text.length() > MAX_MESSAGE_LENGTH) {
                return error(MESSAGE_SEND, "Message longer than " + MAX_MESSAGE_LENGTH + " characters");
            }
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("id", UUID.randomUUID().toString());
            message.put("channel", channel);
            message.put("senderId", ctx.principalId());
            message.put("text", text);
            message.put("sentAt", clock.instant().toString());
            return List.of(
                    new FanoutAction.AppendHistory(channel, message),
                    new FanoutAction.Publish(channel, EventTypes.MESSAGE_NEW, message));
        });
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static List<FanoutAction> withId(JsonNode payload, String field,
                                             Function<String, List<FanoutAction>> then) {
        return text(payload, field)
                .map(then)
                .orElseGet(() -> error(null, "Missing field: " + field));
    }

    private static List<FanoutAction> withPeer(ConnectionContext ctx, JsonNode payload,
                                               Function<String, List<FanoutAction>> then) {
        return withId(payload, "peerId", peerId -> peerId.equals(ctx.principalId())
                ? error(null, "Cannot open a direct channel with yourself")
                : then.apply(ChannelNames.direct(ctx.principalId(), peerId)));
    }

    private static Optional<String> text(JsonNode payload, String field) {
        if (payload == null || !payload.hasNonNull(field) || !payload.get(field).isTextual()) {
            return Optional.empty();
        }
        String value = payload.get(field).asText();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static List<FanoutAction> error(String event, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (event != null) {
            payload.put("event", event);
        }
        payload.put("message", message);
        return List.of(new FanoutAction.Reply(EventTypes.ERROR, payload));
    }
}
