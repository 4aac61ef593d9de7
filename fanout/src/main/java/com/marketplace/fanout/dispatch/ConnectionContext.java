package com.marketplace.fanout.dispatch;

import com.marketplace.shared.workflow.ActorRole;

/**
 * Who is on the other end of a connection, resolved once at handshake.
 */
public record ConnectionContext(String connectionId, String principalId, ActorRole role) {
}
