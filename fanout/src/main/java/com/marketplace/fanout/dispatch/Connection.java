package com.marketplace.fanout.dispatch;

import java.io.IOException;

/**
 * One live subscriber connection.
 */
public interface Connection {

    ConnectionContext context();

    default String id() {
        return context().connectionId();
    }

    boolean isOpen();

    /**
     * Push one event. Implementations must tolerate concurrent callers.
     */
    void send(String eventType, Object payload) throws IOException;
}
