package com.marketplace.shared.workflow;

import lombok.Getter;

/**
 * Raised at the service boundary when the validator rejects a request, so the API layer can
 * map the typed reason to a response.
 */
@Getter
public class TransitionRejectedException extends RuntimeException {

    private final EntityKind entityKind;
    private final String entityId;
    private final RejectionReason reason;

    public TransitionRejectedException(EntityKind entityKind, String entityId,
                                       WorkflowState current, WorkflowState requested,
                                       RejectionReason reason) {
        super(entityKind + " " + entityId + ": " + current + " -> " + requested + " rejected (" + reason + ")");
        this.entityKind = entityKind;
        this.entityId = entityId;
        this.reason = reason;
    }

    public TransitionRejectedException(EntityKind entityKind, String entityId, RejectionReason reason, String message) {
        super(message);
        this.entityKind = entityKind;
        this.entityId = entityId;
        this.reason = reason;
    }
}
