package com.marketplace.shared.effects;

import com.marketplace.shared.audit.AuditEntry;
import com.marketplace.shared.workflow.EntityKind;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Everything that has to happen after one committed state change, built by the workflow service
 * from the effect tags the validator declared. Any part may be absent.
 */
@Getter
@Builder
@ToString
public class EffectPlan {

    private final EntityKind entityKind;
    private final String entityId;

    /** Null when the change is not audited. */
    private final AuditEntry audit;

    @Singular
    private final List<String> invalidations;

    /** Idempotent search re-sync for the entity, or null. */
    @ToString.Exclude
    private final Runnable search;

    @Singular
    private final List<Notification> notifications;

    String lane() {
        return entityKind + ":" + entityId;
    }
}
