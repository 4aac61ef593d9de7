package com.marketplace.shared.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.marketplace.shared.workflow.EntityKind;

import java.time.Instant;
import java.util.Map;

/**
 * What to append to the audit trail for one state change.
 *
 * {@code occurredAt} is the moment of the change, not of the write, so an entry replayed by
 * reconciliation still sorts where the change happened.
 */
public record AuditEntry(String actorId,
                         String action,
                         EntityKind entityKind,
                         String entityId,
                         Map<String, Object> before,
                         Map<String, Object> after,
                         Instant occurredAt) {

    @JsonCreator
    public AuditEntry {
    }

    /** Entry for a change committed just now. */
    public AuditEntry(String actorId, String action, EntityKind entityKind, String entityId,
                      Map<String, Object> before, Map<String, Object> after) {
        this(actorId, action, entityKind, entityId, before, after, Instant.now());
    }
}
