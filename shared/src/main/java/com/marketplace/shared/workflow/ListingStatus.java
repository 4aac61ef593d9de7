package com.marketplace.shared.workflow;

/**
 * Listing lifecycle. No state is terminal: APPROVED and REJECTED are both re-entered after an owner edit.
 */
public enum ListingStatus implements WorkflowState {
    DRAFT,
    PENDING_REVIEW,
    APPROVED,
    REJECTED;

    @Override
    public EntityKind kind() {
        return EntityKind.LISTING;
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    /** Searchable and orderable. */
    public boolean isDiscoverable() {
        return this == APPROVED;
    }
}
