package com.marketplace.shared.events;

/**
 * Event type and topic constants. Producers and consumers both reference these.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Kafka envelope ────────────────────────────────────────────────────────
    public static final String CHANNEL_EVENT          = "fanout.channel-event";
    public static final String TOPIC_CHANNEL_EVENTS   = "fanout.channel-events";

    // ── Channel event names (what subscribers receive) ────────────────────────
    public static final String ORDER_UPDATE           = "order-update";
    public static final String ORDER_NEW              = "order-new";
    public static final String LISTING_STATUS         = "listing-status";
    public static final String LISTING_NEW            = "listing-new";
    public static final String LISTING_LOW_STOCK      = "listing-low-stock";
    public static final String LISTING_OUT_OF_STOCK   = "listing-out-of-stock";
    public static final String LISTING_DELETED        = "listing-deleted";
    public static final String MESSAGE_NEW            = "message:new";
    public static final String MESSAGE_HISTORY        = "message:history";
    public static final String ERROR                  = "error";
}
